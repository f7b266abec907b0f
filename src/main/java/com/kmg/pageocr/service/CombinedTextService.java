package com.kmg.pageocr.service;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageText;
import com.kmg.pageocr.model.ReportOutcome;
import com.kmg.pageocr.repo.PageArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates recognized page texts in page order into {@code combined.txt}.
 */
@Service
public class CombinedTextService {
    private static final Logger log = LoggerFactory.getLogger(CombinedTextService.class);

    public static final String PASS = "combine";

    private final PageArtifactRepository artifactRepository;

    public CombinedTextService(PageArtifactRepository artifactRepository) {
        this.artifactRepository = artifactRepository;
    }

    public ReportOutcome combine(ArtifactLayout layout, PageRange range) throws IOException {
        StringBuilder combined = new StringBuilder();
        List<Integer> skipped = new ArrayList<>();
        int used = 0;

        for (PageText page : artifactRepository.readPages(layout, range)) {
            if (!page.usable()) {
                log.debug("Combine skips page {}: {}", page.pageIndex(), page.detail());
                skipped.add(page.pageIndex());
                continue;
            }
            combined.append("--- Page ").append(page.pageIndex()).append(" ---\n")
                    .append(page.content())
                    .append("\n\n");
            used++;
        }

        if (used == 0) {
            return ReportOutcome.empty(PASS, skipped, "no recognized pages in " + range);
        }

        Files.writeString(layout.combinedPath(), combined, StandardCharsets.UTF_8);
        log.info("Combined text of {} page(s) written to {}", used, layout.combinedPath());
        return ReportOutcome.written(PASS, layout.combinedPath(), used, skipped);
    }
}
