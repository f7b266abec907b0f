package com.kmg.pageocr.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one aggregation pass.
 *
 * @param pass         pass name, e.g. {@code combine}
 * @param path         written artifact, null unless {@link ReportStatus#WRITTEN}
 * @param pagesUsed    pages whose text contributed to the artifact
 * @param skippedPages pages left out because they were missing, failure-marked or unreadable
 */
public record ReportOutcome(String pass, ReportStatus status, Path path, int pagesUsed,
                            List<Integer> skippedPages, String detail) {

    public ReportOutcome {
        skippedPages = List.copyOf(skippedPages);
    }

    public static ReportOutcome written(String pass, Path path, int pagesUsed, List<Integer> skippedPages) {
        return new ReportOutcome(pass, ReportStatus.WRITTEN, path, pagesUsed, skippedPages, null);
    }

    public static ReportOutcome empty(String pass, List<Integer> skippedPages, String detail) {
        return new ReportOutcome(pass, ReportStatus.EMPTY, null, 0, skippedPages, detail);
    }

    public static ReportOutcome skipped(String pass, String detail) {
        return new ReportOutcome(pass, ReportStatus.SKIPPED, null, 0, List.of(), detail);
    }

    public static ReportOutcome failed(String pass, String detail) {
        return new ReportOutcome(pass, ReportStatus.FAILED, null, 0, List.of(), detail);
    }
}
