package com.kmg.pageocr.model;

public enum ReportStatus {
    WRITTEN,
    /** Nothing to report, e.g. every page in range failed or held no words. */
    EMPTY,
    /** The pass could not run at all, e.g. no entity model is installed. */
    SKIPPED,
    FAILED
}
