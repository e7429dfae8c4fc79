package com.example.waterrights.interfaces.api;

import com.example.waterrights.application.exception.UseCaseValidationException;
import com.example.waterrights.application.service.WaterRightBatchService;
import com.example.waterrights.application.service.WaterRightReportService;
import com.example.waterrights.domain.exception.ReportFileRequiredException;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.model.BatchParseReport;
import com.example.waterrights.domain.model.CadenzaTable;
import com.example.waterrights.domain.model.ReportFailure;
import com.example.waterrights.domain.model.ReportParseResult;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import com.example.waterrights.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyList;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = WaterRightReportController.class)
@Import(GlobalExceptionHandler.class)
class WaterRightReportControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WaterRightReportService reportService;

    @MockBean
    private WaterRightBatchService batchService;

    private final MockMultipartFile file =
            new MockMultipartFile("file", "rep7.pdf", "application/pdf", "data".getBytes());

    /**
     * Verifies that a parsed report is returned as JSON.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void parsedReportReturnedAsJson() throws Exception {
        WaterRight waterRight = new WaterRight(7);
        waterRight.setWaterAuthority("Region Hannover");
        BDDMockito.given(reportService.parse(BDDMockito.eq(7L), BDDMockito.any(MultipartFile.class)))
                .willReturn(new ReportParseResult(7, waterRight, false, List.of()));

        mockMvc.perform(multipart("/api/reports/7").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waterRightNo").value(7))
                .andExpect(jsonPath("$.waterRight.waterAuthority").value("Region Hannover"));
    }

    /**
     * Verifies that reports violating the expected layout translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void reportFormatExceptionMappedTo422() throws Exception {
        BDDMockito.given(reportService.parse(anyLong(), BDDMockito.any(MultipartFile.class)))
                .willThrow(new UnknownFieldException("root", "Sachbearbeiter:"));

        mockMvc.perform(multipart("/api/reports/7").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("REPORT_FORMAT_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/reports/7"));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(reportService.parse(anyLong(), BDDMockito.any(MultipartFile.class)))
                .willThrow(new ReportFileRequiredException());

        mockMvc.perform(multipart("/api/reports/7").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that invalid water right numbers translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void useCaseValidationExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(reportService.parse(anyLong(), BDDMockito.any(MultipartFile.class)))
                .willThrow(new UseCaseValidationException("Water right number must be positive: 0"));

        mockMvc.perform(multipart("/api/reports/0").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(reportService.parse(anyLong(), BDDMockito.any(MultipartFile.class)))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/reports/7").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies that batch uploads pass file names and spreadsheet rows on to the batch service.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void batchUploadReturnsSummary() throws Exception {
        MockMultipartFile first = new MockMultipartFile("files", "rep1.pdf", "application/pdf", "a".getBytes());
        MockMultipartFile second = new MockMultipartFile("files", "rep2.pdf", "application/pdf", "b".getBytes());
        MockMultipartFile cadenza = new MockMultipartFile("cadenza", "", "application/json",
                "[{\"no\":1,\"rightsHolder\":\"Stadtwerke\",\"usageLocation\":\"Brunnen 1\"}]"
                        .getBytes(StandardCharsets.UTF_8));
        BDDMockito.given(batchService.parseAll(anyList(), BDDMockito.any(CadenzaTable.class)))
                .willReturn(new BatchParseReport(List.of(), List.of(),
                        List.of(new ReportFailure(2, ReportFailure.Kind.BROKEN, "Unable to read the report PDF.")),
                        List.of()));

        mockMvc.perform(multipart("/api/reports/batch").file(first).file(second).file(cadenza))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failed[0].waterRightNo").value(2))
                .andExpect(jsonPath("$.failed[0].kind").value("BROKEN"));

        ArgumentCaptor<CadenzaTable> table = ArgumentCaptor.forClass(CadenzaTable.class);
        BDDMockito.then(batchService).should().parseAll(anyList(), table.capture());
        assertThat(table.getValue().rowsFor(1)).singleElement()
                .satisfies(row -> assertThat(row.rightsHolder()).isEqualTo("Stadtwerke"));
    }
}
