package com.kmg.pageocr.service;

import com.kmg.pageocr.engine.PersonEntityExtractor;
import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.EntitySpan;
import com.kmg.pageocr.model.EntityStat;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageText;
import com.kmg.pageocr.model.ReportOutcome;
import com.kmg.pageocr.repo.PageArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Person-name report. Runs only when an entity extractor with a loaded model is installed.
 */
@Service
public class EntityStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(EntityStatisticsService.class);

    public static final String PASS = "entities";

    private final PageArtifactRepository artifactRepository;
    private final PersonEntityExtractor extractor;
    private final CsvReportWriter csvWriter;

    public EntityStatisticsService(PageArtifactRepository artifactRepository, PersonEntityExtractor extractor,
                                   CsvReportWriter csvWriter) {
        this.artifactRepository = artifactRepository;
        this.extractor = extractor;
        this.csvWriter = csvWriter;
    }

    public ReportOutcome generate(ArtifactLayout layout, PageRange range) throws IOException {
        if (!extractor.isAvailable()) {
            log.info("Entity extraction model not available, skipping proper names report");
            return ReportOutcome.skipped(PASS, "entity extractor unavailable");
        }

        List<Integer> skipped = new ArrayList<>();
        List<EntityStat> stats = analyze(artifactRepository.readPages(layout, range), skipped);
        int pagesUsed = range.size() - skipped.size();
        if (stats.isEmpty()) {
            return ReportOutcome.empty(PASS, skipped, "no person names found in " + range);
        }

        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"=== PROPER NAMES REPORT ==="});
        rows.add(new String[]{"Name", "Total Occurrences", "Pages"});
        for (EntityStat stat : stats) {
            rows.add(new String[]{stat.name(), String.valueOf(stat.totalOccurrences()),
                    OccurrenceCounter.formatPages(stat.pages())});
        }
        csvWriter.write(layout.entityReportPath(), rows);
        log.info("Proper names report: {} name(s), written to {}", stats.size(), layout.entityReportPath());
        return ReportOutcome.written(PASS, layout.entityReportPath(), pagesUsed, skipped);
    }

    /**
     * Counts person names per page. Unusable pages, and pages the extractor
     * fails on, are appended to {@code skipped}.
     */
    List<EntityStat> analyze(List<PageText> pages, List<Integer> skipped) {
        OccurrenceCounter counter = new OccurrenceCounter();
        for (PageText page : pages) {
            if (!page.usable()) {
                skipped.add(page.pageIndex());
                continue;
            }
            List<String> names;
            try {
                names = extractNames(page.content());
            } catch (RuntimeException e) {
                log.warn("Entity extraction failed on page {}: {}", page.pageIndex(), ExceptionClassifier.describe(e));
                skipped.add(page.pageIndex());
                continue;
            }
            names.forEach(name -> counter.add(name, page.pageIndex()));
        }
        return counter.ranked().stream()
                .map(ranked -> new EntityStat(ranked.key(), ranked.count(), ranked.pages()))
                .toList();
    }

    private List<String> extractNames(String content) {
        List<String> names = new ArrayList<>();
        for (String chunk : chunks(content, extractor.maxTextLength())) {
            for (EntitySpan span : extractor.extractPersonEntities(chunk)) {
                String name = span.name() == null ? "" : span.name().strip();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    static List<String> chunks(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length(); start += maxLength) {
            chunks.add(text.substring(start, Math.min(text.length(), start + maxLength)));
        }
        return chunks;
    }
}
