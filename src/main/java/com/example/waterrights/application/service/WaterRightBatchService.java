package com.example.waterrights.application.service;

import com.example.waterrights.config.ReportParserProperties;
import com.example.waterrights.domain.exception.DomainException;
import com.example.waterrights.domain.model.BatchParseReport;
import com.example.waterrights.domain.model.CadenzaTable;
import com.example.waterrights.domain.model.ReportFailure;
import com.example.waterrights.domain.model.ReportParseResult;
import com.example.waterrights.domain.model.ReportWarning;
import com.example.waterrights.domain.model.WarningKind;
import com.example.waterrights.infrastructure.concurrent.ParserExecutors;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses many reports in parallel, one independent pipeline per report.
 * A report that fails never affects the others; it is reported as a {@link ReportFailure}.
 */
@Service
public class WaterRightBatchService {

    private static final Logger log = LoggerFactory.getLogger(WaterRightBatchService.class);

    private final WaterRightReportService reportService;
    private final ParserExecutors executors;
    private final Pattern reportFilePattern;

    public WaterRightBatchService(WaterRightReportService reportService,
                                  ParserExecutors executors,
                                  ReportParserProperties properties) {
        this.reportService = reportService;
        this.executors = executors;
        this.reportFilePattern = properties.compiledReportFilePattern();
    }

    /**
     * @param uploads      report files named like {@code rep<no>.pdf}
     * @param cadenzaTable spreadsheet rows shared read-only by all workers
     * @return results partitioned into fully parsed, parsed with warnings and failed reports
     */
    public BatchParseReport parseAll(List<ReportUpload> uploads, CadenzaTable cadenzaTable) {
        List<ReportWarning> unattributed = new ArrayList<>();
        List<CompletableFuture<Outcome>> tasks = new ArrayList<>();

        for (ReportUpload upload : uploads) {
            OptionalLong number = waterRightNo(upload.fileName());
            if (number.isEmpty()) {
                log.warn("Could not extract water right number from '{}', ignoring it", upload.fileName());
                unattributed.add(ReportWarning.unattributed(WarningKind.WATER_RIGHT_NO_NOT_FOUND,
                        "could not extract water right number from '" + upload.fileName() + "'"));
                continue;
            }
            long waterRightNo = number.getAsLong();
            tasks.add(CompletableFuture.supplyAsync(
                    () -> parseOne(waterRightNo, upload.content(), cadenzaTable),
                    executors.reportPool()));
        }
        log.info("Parsing {} reports", tasks.size());

        List<ReportParseResult> fullyParsed = new ArrayList<>();
        List<ReportParseResult> withWarnings = new ArrayList<>();
        List<ReportFailure> failed = new ArrayList<>();
        for (CompletableFuture<Outcome> task : tasks) {
            Outcome outcome = task.join();
            if (outcome.failure() != null) {
                failed.add(outcome.failure());
            } else if (outcome.result().hasWarnings()) {
                withWarnings.add(outcome.result());
            } else {
                fullyParsed.add(outcome.result());
            }
        }
        fullyParsed.sort(Comparator.comparingLong(ReportParseResult::waterRightNo));
        withWarnings.sort(Comparator.comparingLong(ReportParseResult::waterRightNo));
        failed.sort(Comparator.comparingLong(ReportFailure::waterRightNo));

        log.info("Parsed {} reports: {} fully, {} with warnings, {} failed, {} unattributed files",
                tasks.size(), fullyParsed.size(), withWarnings.size(), failed.size(), unattributed.size());
        return new BatchParseReport(fullyParsed, withWarnings, failed, unattributed);
    }

    /**
     * @param fileName report file name
     * @return number named by the file, empty when the name does not match or the number overflows a long
     */
    private OptionalLong waterRightNo(String fileName) {
        Matcher matcher = reportFilePattern.matcher(fileName == null ? "" : fileName);
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group("no")));
        } catch (NumberFormatException ex) {
            log.debug("Water right number in '{}' is out of range", fileName, ex);
            return OptionalLong.empty();
        }
    }

    private Outcome parseOne(long waterRightNo, byte[] content, CadenzaTable cadenzaTable) {
        try {
            return Outcome.parsed(reportService.parse(waterRightNo, content, cadenzaTable));
        } catch (PdfProcessingException ex) {
            log.warn("Water right {}: report could not be loaded, {}", waterRightNo, ex.getMessage());
            return Outcome.failed(new ReportFailure(waterRightNo, ReportFailure.Kind.BROKEN, describe(ex)));
        } catch (DomainException ex) {
            log.warn("Water right {}: could not parse report, {}", waterRightNo, ex.getMessage());
            return Outcome.failed(new ReportFailure(waterRightNo, ReportFailure.Kind.PARSE, ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Water right {}: unexpected failure while parsing", waterRightNo, ex);
            return Outcome.failed(new ReportFailure(waterRightNo, ReportFailure.Kind.PARSE, describe(ex)));
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error.getCause();
        if (cause != null && cause.getMessage() != null) {
            return error.getMessage() + " " + cause.getMessage();
        }
        return String.valueOf(error.getMessage());
    }

    private record Outcome(ReportParseResult result, ReportFailure failure) {
        static Outcome parsed(ReportParseResult result) {
            return new Outcome(result, null);
        }

        static Outcome failed(ReportFailure failure) {
            return new Outcome(null, failure);
        }
    }
}
