package com.kmg.pageocr.model;

import java.time.Duration;
import java.util.List;

/**
 * @param outcomes one entry per document, in processing order
 */
public record BatchSummary(List<BatchOutcome> outcomes, Duration elapsed) {

    public BatchSummary {
        outcomes = List.copyOf(outcomes);
    }

    public List<String> successful() {
        return outcomes.stream()
                .filter(BatchOutcome::success)
                .map(BatchOutcome::documentName)
                .toList();
    }

    public List<BatchOutcome> failed() {
        return outcomes.stream()
                .filter(outcome -> !outcome.success())
                .toList();
    }
}
