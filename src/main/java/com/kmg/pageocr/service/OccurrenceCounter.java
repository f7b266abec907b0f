package com.kmg.pageocr.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Counts occurrences of keys and the pages they were seen on. Keys keep the order in which they
 * were first added, which makes ranking ties deterministic. Not thread-safe.
 */
class OccurrenceCounter {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    void add(String key, int pageIndex) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        entry.count++;
        entry.pages.add(pageIndex);
    }

    /**
     * Entries by descending count; equal counts stay in first-seen order.
     */
    List<Ranked> ranked() {
        List<Ranked> ranked = new ArrayList<>();
        entries.forEach((key, entry) -> ranked.add(new Ranked(key, entry.count, List.copyOf(entry.pages))));
        ranked.sort(Comparator.comparingInt(Ranked::count).reversed());
        return ranked;
    }

    static String formatPages(List<Integer> pages) {
        return pages.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }

    record Ranked(String key, int count, List<Integer> pages) {
    }

    private static final class Entry {
        private int count;
        private final TreeSet<Integer> pages = new TreeSet<>();
    }
}
