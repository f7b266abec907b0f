package com.kmg.pageocr.model;

public record BatchOutcome(String documentName, boolean success, String errorDetail) {

    public static BatchOutcome succeeded(String documentName) {
        return new BatchOutcome(documentName, true, null);
    }

    public static BatchOutcome failed(String documentName, String errorDetail) {
        return new BatchOutcome(documentName, false, errorDetail);
    }
}
