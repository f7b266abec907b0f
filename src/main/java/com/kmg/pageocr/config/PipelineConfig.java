package com.kmg.pageocr.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable settings for one pipeline run.
 *
 * @param outputRoot  base directory under which each document gets its own output folder
 * @param dpi         rasterization resolution
 * @param imageFormat image artifact format understood by ImageIO, also used as file extension
 * @param language    recognition language hint, e.g. {@code eng} or {@code eng+deu}
 * @param concurrency number of page workers, always positive
 */
public record PipelineConfig(Path outputRoot, int dpi, String imageFormat, String language, int concurrency) {

    public PipelineConfig {
        Objects.requireNonNull(outputRoot, "outputRoot");
        Objects.requireNonNull(language, "language");
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive: " + dpi);
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        imageFormat = imageFormat == null || imageFormat.isBlank() ? "png" : imageFormat.toLowerCase(Locale.ROOT);
    }

    public static int resolveConcurrency(int configured) {
        if (configured > 0) {
            return configured;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
