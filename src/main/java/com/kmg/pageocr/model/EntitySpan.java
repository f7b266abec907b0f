package com.kmg.pageocr.model;

/**
 * A recognized entity name with its character offsets in the source text.
 */
public record EntitySpan(String name, int start, int end) {
}
