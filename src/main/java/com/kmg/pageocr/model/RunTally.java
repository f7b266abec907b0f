package com.kmg.pageocr.model;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome counters for one scheduler run. Safe to record into from several threads; the
 * failure list is reported in page order regardless of completion order.
 */
public class RunTally {
    private final int submitted;
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger skippedCount = new AtomicInteger();
    private final ConcurrentLinkedQueue<PageFailure> failures = new ConcurrentLinkedQueue<>();
    private volatile Duration elapsed = Duration.ZERO;

    public RunTally(int submitted) {
        this.submitted = submitted;
    }

    public void record(PageResult result) {
        switch (result.status()) {
            case SUCCESS -> successCount.incrementAndGet();
            case SKIPPED_ALREADY_DONE -> skippedCount.incrementAndGet();
            case FAILURE -> {
                failureCount.incrementAndGet();
                failures.add(new PageFailure(result.pageIndex(), result.errorDetail()));
            }
        }
    }

    public void finish(Duration elapsed) {
        this.elapsed = elapsed;
    }

    public int submitted() {
        return submitted;
    }

    public int successCount() {
        return successCount.get();
    }

    public int failureCount() {
        return failureCount.get();
    }

    public int skippedCount() {
        return skippedCount.get();
    }

    public int recordedCount() {
        return successCount() + failureCount() + skippedCount();
    }

    public Duration elapsed() {
        return elapsed;
    }

    public List<PageFailure> failures() {
        return failures.stream()
                .sorted(Comparator.comparingInt(PageFailure::pageIndex))
                .toList();
    }
}
