package com.example.waterrights.application.service;

import com.example.waterrights.application.exception.UseCaseValidationException;
import com.example.waterrights.application.service.extraction.FontRoleTable;
import com.example.waterrights.application.service.extraction.HierarchicalSegmenter;
import com.example.waterrights.application.service.extraction.KeyValueGrouper;
import com.example.waterrights.application.service.extraction.TextBlockAssembler;
import com.example.waterrights.application.service.parse.WaterRightParser;
import com.example.waterrights.domain.exception.ReportFileRequiredException;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.exception.UnsupportedPdfFormatException;
import com.example.waterrights.domain.model.CadenzaRow;
import com.example.waterrights.domain.model.CadenzaTable;
import com.example.waterrights.domain.model.Duration;
import com.example.waterrights.domain.model.LandRecord;
import com.example.waterrights.domain.model.LegalDepartmentAbbreviation;
import com.example.waterrights.domain.model.OrFallback;
import com.example.waterrights.domain.model.Rate;
import com.example.waterrights.domain.model.ReportParseResult;
import com.example.waterrights.domain.model.SingleOrPair;
import com.example.waterrights.domain.model.UsageLocation;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import com.example.waterrights.infrastructure.pdf.PdfBoxDrawingEventReader;
import com.example.waterrights.infrastructure.pdf.PdfBoxTextDecoder;
import com.example.waterrights.support.ReportPdfBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs the whole pipeline on PDFs drawn with PDFBox.
 */
class WaterRightReportServiceTest {

    private final WaterRightReportService service = new WaterRightReportService(
            new PdfBoxDrawingEventReader(),
            PdfBoxTextDecoder.forEncoding("WinAnsiEncoding"),
            new TextBlockAssembler(),
            new KeyValueGrouper(FontRoleTable.of(List.of("F1"), List.of("F2", "F3"))),
            new HierarchicalSegmenter(true),
            WaterRightParser.create(),
            new CadenzaEnricher(),
            new WaterRightPostProcessor());

    static byte[] sampleReport() throws Exception {
        return new ReportPdfBuilder()
                .field("Wasserbuchbehörde", "Region Hannover")
                .field("Kennziffer", "12-3 (aktiv)")
                .field("erteilt am:", "01.02.2003")
                .field("Betreff:", "Beregnung")
                .field("Abteilung:", "E Entnahme von Grundwasser")
                .field("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)")
                .field("Bezeichnung:", "Brunnen 1")
                .field("Erlaubniswert:", "Entnahmemenge 12 m³/2a")
                .field("Gemarkung, Flur:", "Foo12")
                .field("Top. Karte 1:25.000:", "3524", "Hannover")
                .field("Bemerkung:")
                .field("wichtig")
                .build();
    }

    @Test
    void parsesReport() throws Exception {
        ReportParseResult result = service.parse(17, sampleReport(), CadenzaTable.empty());

        WaterRight waterRight = result.waterRight();
        assertThat(result.waterRightNo()).isEqualTo(17);
        assertThat(result.enriched()).isFalse();
        assertThat(result.warnings()).isEmpty();
        assertThat(waterRight.getWaterAuthority()).isEqualTo("Region Hannover");
        assertThat(waterRight.getExternalIdentifier()).isEqualTo("12-3");
        assertThat(waterRight.getStatus()).isEqualTo("aktiv");
        assertThat(waterRight.getValidFrom()).isEqualTo("2003-02-01");
        assertThat(waterRight.getSubject()).isEqualTo("Beregnung");
        assertThat(waterRight.getAnnotation()).isEqualTo("wichtig");

        List<UsageLocation> locations =
                waterRight.getLegalDepartments().get(LegalDepartmentAbbreviation.E).getUsageLocations();
        assertThat(locations).hasSize(1);
        UsageLocation well = locations.get(0);
        assertThat(well.getName()).isEqualTo("Brunnen 1");
        assertThat(well.getWithdrawalRates()).containsExactly(
                OrFallback.expected(new Rate(12, "m³", Duration.of(Duration.Unit.YEARS, 2))));
        assertThat(well.getLandRecord()).isEqualTo(OrFallback.expected(new LandRecord("Foo", 12)));
        assertThat(well.getMapExcerpt()).isEqualTo(new SingleOrPair.Pair(3524, "Hannover"));
    }

    @Test
    void valueWrappedOntoNextPageContinuesItsField() throws Exception {
        byte[] pdf = new ReportPdfBuilder()
                .field("Wasserbuchbehörde", "Region")
                .field("Abteilung:", "E Entnahme von Grundwasser")
                .field("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)")
                .field("Bezeichnung:", "Brunnen am")
                .newPage()
                .continuation("Waldrand")
                .field("Flurstück:", "12/3")
                .build();

        WaterRight waterRight = service.parse(18, pdf, CadenzaTable.empty()).waterRight();

        UsageLocation well = waterRight.getLegalDepartments().get(LegalDepartmentAbbreviation.E)
                .getUsageLocations().get(0);
        assertThat(well.getName()).isEqualTo("Brunnen am Waldrand");
        assertThat(well.getPlot()).isEqualTo("12/3");
    }

    @Test
    void labelClosingAPageKeepsTheValueOnTheNextPage() throws Exception {
        byte[] pdf = new ReportPdfBuilder()
                .field("Wasserbuchbehörde", "Region")
                .field("Abteilung:", "E Entnahme von Grundwasser")
                .field("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)")
                .field("Bezeichnung:")
                .newPage()
                .continuation("Brunnen 1")
                .field("Flurstück:", "12/3")
                .build();

        UsageLocation well = service.parse(21, pdf, CadenzaTable.empty()).waterRight()
                .getLegalDepartments().get(LegalDepartmentAbbreviation.E).getUsageLocations().get(0);

        assertThat(well.getSerial()).isEqualTo("1");
        assertThat(well.getName()).isEqualTo("Brunnen 1");
        assertThat(well.getPlot()).isEqualTo("12/3");
    }

    @Test
    void enrichesFromSpreadsheet() throws Exception {
        CadenzaRow row = new CadenzaRow(17, "Stadtwerke", null, null, null, "Erlaubnis", null, null,
                "04.03.2021", null, null, null, null, 4L, "Brunnen 1", "E", null, "Hannover",
                null, null, null, null, null, null);

        ReportParseResult result = service.parse(17, sampleReport(), CadenzaTable.of(List.of(row)));

        assertThat(result.enriched()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.waterRight().getHolder()).isEqualTo("Stadtwerke");
        assertThat(result.waterRight().getLastChange()).isEqualTo("2021-03-04");
        assertThat(result.waterRight().getLegalDepartments().get(LegalDepartmentAbbreviation.E)
                .getUsageLocations().get(0).getNo()).isEqualTo(4L);
    }

    @Test
    void unknownKeyFailsTheReport() throws Exception {
        byte[] pdf = new ReportPdfBuilder()
                .field("Wasserbuchbehörde", "Region")
                .field("Sachbearbeiter:", "Frau Muster")
                .build();

        assertThrows(UnknownFieldException.class, () -> service.parse(19, pdf, CadenzaTable.empty()));
    }

    @Test
    void brokenDocumentIsAProcessingError() {
        byte[] garbage = "not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThrows(PdfProcessingException.class, () -> service.parse(20, garbage, CadenzaTable.empty()));
    }

    @Test
    void waterRightNumberMustBePositive() throws Exception {
        byte[] pdf = sampleReport();

        assertThrows(UseCaseValidationException.class, () -> service.parse(0, pdf, CadenzaTable.empty()));
    }

    @Test
    void uploadIsParsed() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "rep17.pdf", "application/pdf", sampleReport());

        ReportParseResult result = service.parse(17, file);

        assertThat(result.waterRight().getWaterAuthority()).isEqualTo("Region Hannover");
    }

    @Test
    void uploadWithoutPdfNameOrTypeIsRejected() {
        MockMultipartFile file = new MockMultipartFile(
                "file", "note.txt", "text/plain", "plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(UnsupportedPdfFormatException.class, () -> service.parse(1, file));
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile file = new MockMultipartFile("file", "rep1.pdf", "application/pdf", new byte[0]);

        assertThrows(ReportFileRequiredException.class, () -> service.parse(1, file));
        assertThrows(ReportFileRequiredException.class, () -> service.parse(1, (MultipartFile) null));
    }
}
