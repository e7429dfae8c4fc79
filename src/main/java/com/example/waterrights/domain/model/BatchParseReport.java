package com.example.waterrights.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Summary of a batch run, partitioned into fully parsed, parsed with warnings and failed reports.
 * Every list is sorted by water right number.
 *
 * @param fullyParsed          results without warnings
 * @param parsedWithWarnings   results carrying at least one warning
 * @param failed               reports that produced no water right
 * @param unattributedWarnings warnings that could not be tied to a water right number
 */
public record BatchParseReport(
        List<ReportParseResult> fullyParsed,
        List<ReportParseResult> parsedWithWarnings,
        List<ReportFailure> failed,
        List<ReportWarning> unattributedWarnings
) {

    public BatchParseReport {
        fullyParsed = List.copyOf(fullyParsed);
        parsedWithWarnings = List.copyOf(parsedWithWarnings);
        failed = List.copyOf(failed);
        unattributedWarnings = List.copyOf(unattributedWarnings);
    }

    public int total() {
        return fullyParsed.size() + parsedWithWarnings.size() + failed.size();
    }

    public List<ReportWarning> warningsFor(long waterRightNo) {
        return parsedWithWarnings.stream()
                .filter(result -> result.waterRightNo() == waterRightNo)
                .flatMap(result -> result.warnings().stream())
                .toList();
    }

    public Optional<ReportFailure> failureFor(long waterRightNo) {
        return failed.stream()
                .filter(failure -> failure.waterRightNo() == waterRightNo)
                .findFirst();
    }
}
