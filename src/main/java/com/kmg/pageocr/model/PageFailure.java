package com.kmg.pageocr.model;

public record PageFailure(int pageIndex, String message) {
}
