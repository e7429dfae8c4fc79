package com.example.waterrights.application.service;

import com.example.waterrights.application.exception.UseCaseValidationException;
import com.example.waterrights.application.service.extraction.HierarchicalSegmenter;
import com.example.waterrights.application.service.extraction.KeyValueGrouper;
import com.example.waterrights.application.service.extraction.TextBlockAssembler;
import com.example.waterrights.application.service.extraction.TextDecoder;
import com.example.waterrights.application.service.parse.WaterRightParser;
import com.example.waterrights.domain.exception.ReportFileRequiredException;
import com.example.waterrights.domain.exception.UnsupportedPdfFormatException;
import com.example.waterrights.domain.model.CadenzaTable;
import com.example.waterrights.domain.model.ReportParseResult;
import com.example.waterrights.domain.model.ReportWarning;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.domain.model.report.DrawingEvent;
import com.example.waterrights.domain.model.report.GroupedRecord;
import com.example.waterrights.domain.model.report.KeyValuePair;
import com.example.waterrights.domain.model.report.TextBlock;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import com.example.waterrights.infrastructure.pdf.PdfBoxDrawingEventReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service running the whole pipeline for one report:
 * drawing events, text blocks, key-value pairs, sections, water right, enrichment and post-processing.
 * Stages run strictly one after another and share no state with other reports.
 */
@Service
public class WaterRightReportService {

    private static final Logger log = LoggerFactory.getLogger(WaterRightReportService.class);

    private final PdfBoxDrawingEventReader drawingEventReader;
    private final TextDecoder textDecoder;
    private final TextBlockAssembler textBlockAssembler;
    private final KeyValueGrouper keyValueGrouper;
    private final HierarchicalSegmenter segmenter;
    private final WaterRightParser waterRightParser;
    private final CadenzaEnricher cadenzaEnricher;
    private final WaterRightPostProcessor postProcessor;

    public WaterRightReportService(PdfBoxDrawingEventReader drawingEventReader,
                                   TextDecoder textDecoder,
                                   TextBlockAssembler textBlockAssembler,
                                   KeyValueGrouper keyValueGrouper,
                                   HierarchicalSegmenter segmenter,
                                   WaterRightParser waterRightParser,
                                   CadenzaEnricher cadenzaEnricher,
                                   WaterRightPostProcessor postProcessor) {
        this.drawingEventReader = drawingEventReader;
        this.textDecoder = textDecoder;
        this.textBlockAssembler = textBlockAssembler;
        this.keyValueGrouper = keyValueGrouper;
        this.segmenter = segmenter;
        this.waterRightParser = waterRightParser;
        this.cadenzaEnricher = cadenzaEnricher;
        this.postProcessor = postProcessor;
    }

    /**
     * Parses an uploaded report without spreadsheet enrichment.
     *
     * @param waterRightNo number of the water right the report describes
     * @param file         uploaded PDF
     * @return parsed water right with its warnings
     * @throws ReportFileRequiredException   when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when the upload cannot be read
     */
    public ReportParseResult parse(long waterRightNo, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ReportFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        try {
            return parse(waterRightNo, file.getBytes(), CadenzaTable.empty());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded report.", e);
        }
    }

    /**
     * @param waterRightNo number of the water right the report describes
     * @param pdfBytes     raw PDF
     * @param cadenzaTable spreadsheet rows used for enrichment
     * @return parsed water right with its warnings
     * @throws PdfProcessingException when PDFBox cannot load the report
     */
    public ReportParseResult parse(long waterRightNo, byte[] pdfBytes, CadenzaTable cadenzaTable) {
        requireValidNo(waterRightNo);
        return parsePages(waterRightNo, drawingEventReader.read(pdfBytes), cadenzaTable);
    }

    /**
     * Runs the pipeline from already read drawing events.
     *
     * @param waterRightNo number of the water right the report describes
     * @param pages        drawing events per page
     * @param cadenzaTable spreadsheet rows used for enrichment
     * @return parsed water right with its warnings
     */
    public ReportParseResult parsePages(long waterRightNo, List<List<DrawingEvent>> pages, CadenzaTable cadenzaTable) {
        requireValidNo(waterRightNo);
        List<List<TextBlock>> blocks = textBlockAssembler.assemble(pages, textDecoder);
        List<KeyValuePair> pairs = keyValueGrouper.group(blocks);
        log.debug("Water right {}: {} pages, {} pairs", waterRightNo, pages.size(), pairs.size());
        return parsePairs(waterRightNo, pairs, cadenzaTable);
    }

    /**
     * Runs the pipeline from the key-value stream onwards.
     *
     * @param waterRightNo number of the water right the report describes
     * @param pairs        key-value pairs in reading order
     * @param cadenzaTable spreadsheet rows used for enrichment
     * @return parsed water right with its warnings
     */
    public ReportParseResult parsePairs(long waterRightNo, List<KeyValuePair> pairs, CadenzaTable cadenzaTable) {
        requireValidNo(waterRightNo);
        GroupedRecord record = segmenter.segment(pairs);
        WaterRight waterRight = waterRightParser.parse(waterRightNo, record);

        List<ReportWarning> warnings = new ArrayList<>();
        boolean enriched = cadenzaEnricher.enrich(waterRight, cadenzaTable.rowsFor(waterRightNo), warnings);
        postProcessor.process(waterRight, warnings);

        log.debug("Water right {}: parsed {} departments, enriched={}, {} warnings",
                waterRightNo, waterRight.getLegalDepartments().size(), enriched, warnings.size());
        return new ReportParseResult(waterRightNo, waterRight, enriched, warnings);
    }

    private static void requireValidNo(long waterRightNo) {
        if (waterRightNo <= 0) {
            throw new UseCaseValidationException("Water right number must be positive: " + waterRightNo);
        }
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
