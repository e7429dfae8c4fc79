package com.example.waterrights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Tunables of the report pipeline, bound from {@code water-rights.parser.*}.
 *
 * @param labelFonts                      font resource names used for field labels
 * @param valueFonts                      font resource names used for field values
 * @param textEncoding                    single byte encoding of the text show operands
 * @param emitEmptyTrailingUsageLocation  whether a department ending on a usage location boundary
 *                                        yields an empty trailing usage location
 * @param workerThreads                   batch pool size, {@code 0} for the number of processors
 * @param reportFilePattern               file name pattern with a named group {@code no}
 */
@ConfigurationProperties(prefix = "water-rights.parser")
public record ReportParserProperties(
        List<String> labelFonts,
        List<String> valueFonts,
        String textEncoding,
        Boolean emitEmptyTrailingUsageLocation,
        Integer workerThreads,
        String reportFilePattern
) {

    public static final String DEFAULT_REPORT_FILE_PATTERN = "^rep(?<no>\\d+)\\.pdf$";

    public ReportParserProperties {
        labelFonts = labelFonts == null || labelFonts.isEmpty() ? List.of("F1") : List.copyOf(labelFonts);
        valueFonts = valueFonts == null || valueFonts.isEmpty() ? List.of("F2", "F3") : List.copyOf(valueFonts);
        textEncoding = textEncoding == null || textEncoding.isBlank() ? "WinAnsiEncoding" : textEncoding;
        emitEmptyTrailingUsageLocation = emitEmptyTrailingUsageLocation == null || emitEmptyTrailingUsageLocation;
        workerThreads = workerThreads == null || workerThreads < 0 ? 0 : workerThreads;
        reportFilePattern = reportFilePattern == null || reportFilePattern.isBlank()
                ? DEFAULT_REPORT_FILE_PATTERN
                : reportFilePattern;
    }

    /**
     * @return properties as they apply without any configuration
     */
    public static ReportParserProperties defaults() {
        return new ReportParserProperties(null, null, null, null, null, null);
    }

    public ReportParserProperties withEmitEmptyTrailingUsageLocation(boolean emit) {
        return new ReportParserProperties(labelFonts, valueFonts, textEncoding, emit, workerThreads, reportFilePattern);
    }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public Pattern compiledReportFilePattern() {
        return Pattern.compile(reportFilePattern);
    }
}
