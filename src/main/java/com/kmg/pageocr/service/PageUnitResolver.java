package com.kmg.pageocr.service;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageUnit;
import com.kmg.pageocr.model.SourceDocument;
import com.kmg.pageocr.repo.PageArtifactRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides which pages still need work by inspecting the artifacts on disk. Never writes.
 */
@Service
public class PageUnitResolver {
    private final PageArtifactRepository artifactRepository;

    public PageUnitResolver(PageArtifactRepository artifactRepository) {
        this.artifactRepository = artifactRepository;
    }

    /**
     * Pages in {@code range}, ascending, that are not yet complete. An empty range yields nothing.
     */
    public List<PageUnit> pendingUnits(SourceDocument document, ArtifactLayout layout, PageRange range) {
        if (range.isEmpty()) {
            return List.of();
        }
        return range.pages()
                .mapToObj(page -> layout.unit(document.path(), page))
                .filter(unit -> !artifactRepository.isComplete(unit))
                .toList();
    }

    public int lastCompletedPage(ArtifactLayout layout) {
        return artifactRepository.lastCompletedPage(layout);
    }
}
