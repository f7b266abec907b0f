package com.kmg.pageocr.model;

public enum PageStatus {
    SUCCESS,
    FAILURE,
    SKIPPED_ALREADY_DONE
}
