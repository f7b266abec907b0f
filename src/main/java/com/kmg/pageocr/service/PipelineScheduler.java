package com.kmg.pageocr.service;

import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.model.PageResult;
import com.kmg.pageocr.model.PageUnit;
import com.kmg.pageocr.model.RunTally;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs page workers on a fixed pool and drains their results in completion order. A single
 * consumer records into the tally, so counts do not depend on which page finishes first.
 */
@Service
public class PipelineScheduler {
    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PageWorker pageWorker;

    public PipelineScheduler(PageWorker pageWorker) {
        this.pageWorker = pageWorker;
    }

    public RunTally run(List<PageUnit> units, PipelineConfig config) {
        RunTally tally = new RunTally(units.size());
        if (units.isEmpty()) {
            return tally;
        }

        long startedAt = System.nanoTime();
        int poolSize = Math.min(config.concurrency(), units.size());
        log.info("Processing {} page(s) with {} worker(s)", units.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        CompletionService<PageResult> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<PageResult>, PageUnit> submitted = new HashMap<>();

        try {
            for (PageUnit unit : units) {
                submitted.put(completionService.submit(() -> pageWorker.process(unit, config)), unit);
            }

            for (int done = 0; done < units.size(); done++) {
                Future<PageResult> future = completionService.take();
                PageResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    result = PageResult.failure(submitted.get(future).pageIndex(), ExceptionClassifier.describe(cause));
                }
                tally.record(result);
                logProgress(result, done + 1, units.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for page workers", e);
        } finally {
            executor.shutdownNow();
            tally.finish(Duration.ofNanos(System.nanoTime() - startedAt));
        }

        return tally;
    }

    private void logProgress(PageResult result, int done, int total) {
        switch (result.status()) {
            case SUCCESS -> log.info("[SUCCESS] Page {} ({}/{})", result.pageIndex(), done, total);
            case SKIPPED_ALREADY_DONE -> log.info("[SKIPPED] Page {} already processed ({}/{})", result.pageIndex(), done, total);
            case FAILURE -> log.warn("[FAILURE] Page {} ({}/{}): {}", result.pageIndex(), done, total, result.errorDetail());
        }
    }
}
