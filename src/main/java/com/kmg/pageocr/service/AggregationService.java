package com.kmg.pageocr.service;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.ReportOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the post-passes over a document's text artifacts. Passes are independent: one that
 * throws is reported as failed and the others still run.
 */
@Service
public class AggregationService {
    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    private final CombinedTextService combinedTextService;
    private final WordStatisticsService wordStatisticsService;
    private final EntityStatisticsService entityStatisticsService;

    public AggregationService(CombinedTextService combinedTextService, WordStatisticsService wordStatisticsService,
                              EntityStatisticsService entityStatisticsService) {
        this.combinedTextService = combinedTextService;
        this.wordStatisticsService = wordStatisticsService;
        this.entityStatisticsService = entityStatisticsService;
    }

    public List<ReportOutcome> aggregate(ArtifactLayout layout, PageRange range) {
        log.info("Aggregating pages {}", range);
        return List.of(
                runPass(CombinedTextService.PASS, () -> combinedTextService.combine(layout, range)),
                runPass(WordStatisticsService.PASS, () -> wordStatisticsService.generate(layout, range)),
                runPass(EntityStatisticsService.PASS, () -> entityStatisticsService.generate(layout, range))
        );
    }

    private ReportOutcome runPass(String pass, Pass action) {
        try {
            ReportOutcome outcome = action.run();
            if (!outcome.skippedPages().isEmpty()) {
                log.warn("Pass '{}' left out page(s) {}", pass, outcome.skippedPages());
            }
            return outcome;
        } catch (Exception e) {
            log.warn("Pass '{}' failed: {}", pass, ExceptionClassifier.describe(e));
            return ReportOutcome.failed(pass, ExceptionClassifier.describe(e));
        }
    }

    @FunctionalInterface
    private interface Pass {
        ReportOutcome run() throws Exception;
    }
}
