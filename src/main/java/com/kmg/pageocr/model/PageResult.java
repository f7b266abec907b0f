package com.kmg.pageocr.model;

public record PageResult(int pageIndex, PageStatus status, String errorDetail) {

    public static PageResult success(int pageIndex) {
        return new PageResult(pageIndex, PageStatus.SUCCESS, null);
    }

    public static PageResult failure(int pageIndex, String errorDetail) {
        return new PageResult(pageIndex, PageStatus.FAILURE, errorDetail);
    }

    public static PageResult skipped(int pageIndex) {
        return new PageResult(pageIndex, PageStatus.SKIPPED_ALREADY_DONE, null);
    }
}
