package com.example.waterrights.interfaces.api;

import com.example.waterrights.application.service.ReportUpload;
import com.example.waterrights.application.service.WaterRightBatchService;
import com.example.waterrights.application.service.WaterRightReportService;
import com.example.waterrights.domain.exception.ReportFileRequiredException;
import com.example.waterrights.domain.model.BatchParseReport;
import com.example.waterrights.domain.model.CadenzaRow;
import com.example.waterrights.domain.model.CadenzaTable;
import com.example.waterrights.domain.model.ReportParseResult;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Interfaces-layer REST controller accepting water right reports and returning the parsed records as JSON.
 */
@RestController
@RequestMapping(value = "/api/reports", produces = MediaType.APPLICATION_JSON_VALUE)
public class WaterRightReportController {

    private final WaterRightReportService reportService;
    private final WaterRightBatchService batchService;

    /**
     * @param reportService service parsing a single report
     * @param batchService  service parsing many reports in parallel
     */
    public WaterRightReportController(WaterRightReportService reportService, WaterRightBatchService batchService) {
        this.reportService = reportService;
        this.batchService = batchService;
    }

    /**
     * Parses one uploaded report.
     *
     * @param waterRightNo number of the water right the report describes
     * @param file         uploaded PDF
     * @return parsed water right and its warnings
     */
    @PostMapping("/{no}")
    public ResponseEntity<ReportParseResult> parseReport(@PathVariable("no") long waterRightNo,
                                                         @RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(reportService.parse(waterRightNo, file));
    }

    /**
     * Parses many reports, optionally enriched with spreadsheet rows.
     *
     * @param files   reports named {@code rep<no>.pdf}
     * @param cadenza spreadsheet rows (optional JSON part)
     * @return batch summary
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchParseReport> parseBatch(@RequestPart("files") List<MultipartFile> files,
                                                       @RequestPart(value = "cadenza", required = false) List<CadenzaRow> cadenza) {
        if (files == null || files.isEmpty()) {
            throw new ReportFileRequiredException();
        }
        List<ReportUpload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            uploads.add(toUpload(file));
        }
        return ResponseEntity.ok(batchService.parseAll(uploads, CadenzaTable.of(cadenza)));
    }

    private static ReportUpload toUpload(MultipartFile file) {
        try {
            return new ReportUpload(file.getOriginalFilename(), file.getBytes());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded report " + file.getOriginalFilename(), e);
        }
    }
}
