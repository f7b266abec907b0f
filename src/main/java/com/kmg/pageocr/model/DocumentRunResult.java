package com.kmg.pageocr.model;

import java.nio.file.Path;
import java.util.List;

public record DocumentRunResult(
        SourceDocument document,
        Path outputDir,
        PageRange workRange,
        int pendingPages,
        RunTally tally,
        List<ReportOutcome> reports
) {
    public DocumentRunResult {
        reports = List.copyOf(reports);
    }
}
