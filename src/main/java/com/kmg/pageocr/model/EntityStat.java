package com.kmg.pageocr.model;

import java.util.List;

/**
 * @param pages ascending page indices, never empty
 */
public record EntityStat(String name, int totalOccurrences, List<Integer> pages) {
}
