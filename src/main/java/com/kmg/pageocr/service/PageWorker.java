package com.kmg.pageocr.service;

import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.engine.DiagnosticStreamSuppressor;
import com.kmg.pageocr.engine.DocumentHandle;
import com.kmg.pageocr.engine.PageRasterizer;
import com.kmg.pageocr.engine.TextRecognizer;
import com.kmg.pageocr.model.PageResult;
import com.kmg.pageocr.model.PageUnit;
import com.kmg.pageocr.repo.PageArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Renders, recognizes and persists one page. Every call returns exactly one {@link PageResult};
 * failures end up in the page's text artifact as a failure marker instead of propagating.
 */
@Service
public class PageWorker {
    private static final Logger log = LoggerFactory.getLogger(PageWorker.class);

    private final PageRasterizer rasterizer;
    private final TextRecognizer recognizer;
    private final PageArtifactRepository artifactRepository;
    private final DiagnosticStreamSuppressor suppressor;

    public PageWorker(PageRasterizer rasterizer, TextRecognizer recognizer,
                      PageArtifactRepository artifactRepository, DiagnosticStreamSuppressor suppressor) {
        this.rasterizer = rasterizer;
        this.recognizer = recognizer;
        this.artifactRepository = artifactRepository;
        this.suppressor = suppressor;
    }

    public PageResult process(PageUnit unit, PipelineConfig config) {
        if (artifactRepository.isComplete(unit)) {
            return PageResult.skipped(unit.pageIndex());
        }

        try {
            byte[] image;
            try (DocumentHandle handle = rasterizer.open(unit.document())) {
                image = handle.render(unit.pageIndex(), config.dpi(), config.imageFormat());
            }
            artifactRepository.writeImage(unit, image);

            String text;
            try (DiagnosticStreamSuppressor.Scope ignored = suppressor.suppress()) {
                text = recognizer.recognize(image, config.language());
            }
            artifactRepository.writeText(unit, text == null ? "" : text.strip());
            return PageResult.success(unit.pageIndex());
        } catch (Exception e) {
            String detail = ExceptionClassifier.describe(e);
            log.debug("Page {} of {} failed", unit.pageIndex(), unit.document().getFileName(), e);
            try {
                artifactRepository.writeFailure(unit, detail);
            } catch (IOException markerError) {
                log.warn("Could not write failure marker for page {}: {}", unit.pageIndex(), markerError.getMessage());
            }
            return PageResult.failure(unit.pageIndex(), detail);
        }
    }
}
