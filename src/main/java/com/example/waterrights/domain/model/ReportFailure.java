package com.example.waterrights.domain.model;

/**
 * A report that did not produce a water right.
 *
 * @param waterRightNo water right number taken from the report name
 * @param kind         whether the file itself or its content was at fault
 * @param message      failure description
 */
public record ReportFailure(long waterRightNo, Kind kind, String message) {

    public enum Kind {
        /** The document could not be loaded at all. */
        BROKEN,
        /** The document loaded but violates the report structure. */
        PARSE
    }
}
