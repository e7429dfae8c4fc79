package com.example.waterrights.domain.model;

import java.util.List;

/**
 * Outcome of parsing one report: the water right plus the warnings raised on the way.
 *
 * @param waterRightNo number of the parsed water right
 * @param waterRight   parsed and post-processed water right
 * @param enriched     whether spreadsheet rows existed for this water right
 * @param warnings     soft anomalies, in the order they were found
 */
public record ReportParseResult(long waterRightNo, WaterRight waterRight, boolean enriched, List<ReportWarning> warnings) {

    public ReportParseResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
