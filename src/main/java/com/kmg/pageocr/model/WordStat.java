package com.kmg.pageocr.model;

import java.util.List;

/**
 * @param pages ascending page indices, never empty
 */
public record WordStat(String word, int totalOccurrences, List<Integer> pages) {
}
