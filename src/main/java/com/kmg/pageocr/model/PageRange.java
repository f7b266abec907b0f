package com.kmg.pageocr.model;

import java.util.stream.IntStream;

/**
 * Inclusive, 1-based page range. A range whose start lies past its end is empty.
 */
public record PageRange(int start, int end) {

    public PageRange {
        if (start < 1) {
            throw new IllegalArgumentException("Page range must start at 1 or later: " + start);
        }
    }

    public static PageRange of(int start, int end) {
        return new PageRange(start, end);
    }

    public boolean isEmpty() {
        return start > end;
    }

    public int size() {
        return isEmpty() ? 0 : end - start + 1;
    }

    public IntStream pages() {
        return IntStream.rangeClosed(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
