package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Non-fatal anomaly tied to the report it was found in.
 *
 * @param waterRightNo water right number, {@code null} when the report could not be attributed
 * @param kind         anomaly category
 * @param message      human readable details
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportWarning(Long waterRightNo, WarningKind kind, String message) {

    public static ReportWarning of(long waterRightNo, WarningKind kind, String message) {
        return new ReportWarning(waterRightNo, kind, message);
    }

    public static ReportWarning unattributed(WarningKind kind, String message) {
        return new ReportWarning(null, kind, message);
    }
}
