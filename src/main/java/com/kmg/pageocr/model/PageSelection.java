package com.kmg.pageocr.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Which pages a single-document run should cover. Resolved against the document before any
 * work is scheduled.
 */
public record PageSelection(SelectionMode mode, int start, int end) {
    private static final Pattern RANGE = Pattern.compile("\\s*(\\d+)\\s*-\\s*(\\d+)\\s*");

    public static PageSelection all() {
        return new PageSelection(SelectionMode.ALL, 0, 0);
    }

    public static PageSelection resume() {
        return new PageSelection(SelectionMode.RESUME, 0, 0);
    }

    public static PageSelection range(int start, int end) {
        return new PageSelection(SelectionMode.RANGE, start, end);
    }

    /**
     * Builds a selection from the textual mode and optional {@code START-END} range. A range
     * without an explicit mode implies {@link SelectionMode#RANGE}.
     */
    public static PageSelection parse(String mode, String range) {
        SelectionMode selected = (mode == null || mode.isBlank()) && range != null && !range.isBlank()
                ? SelectionMode.RANGE
                : SelectionMode.parse(mode);

        return switch (selected) {
            case ALL -> all();
            case RESUME -> resume();
            case RANGE -> {
                if (range == null || range.isBlank()) {
                    throw new IllegalArgumentException("Mode 'range' requires --range=START-END.");
                }
                Matcher matcher = RANGE.matcher(range);
                if (!matcher.matches()) {
                    throw new IllegalArgumentException("Invalid page range '" + range + "'. Use START-END, e.g. 5-10.");
                }
                try {
                    yield range(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid page range '" + range + "'.", e);
                }
            }
        };
    }

    /**
     * Pages to schedule. For {@link SelectionMode#RESUME} this starts after the highest completed
     * page and is empty when the whole document is already done.
     */
    public PageRange workRange(int totalPages, int lastCompletedPage) {
        return switch (mode) {
            case ALL -> PageRange.of(1, totalPages);
            case RESUME -> PageRange.of(Math.max(1, lastCompletedPage + 1), totalPages);
            case RANGE -> {
                if (start < 1 || start > end || end > totalPages) {
                    throw new IllegalArgumentException("Invalid page range '" + start + "-" + end
                            + "'. Range must be between 1 and " + totalPages + ".");
                }
                yield PageRange.of(start, end);
            }
        };
    }

    /**
     * Pages the aggregation passes read. A resumed run reports over the whole document so the
     * reports include pages finished by earlier invocations.
     */
    public PageRange reportRange(int totalPages) {
        if (mode == SelectionMode.RANGE) {
            return PageRange.of(start, end);
        }
        return PageRange.of(1, totalPages);
    }
}
