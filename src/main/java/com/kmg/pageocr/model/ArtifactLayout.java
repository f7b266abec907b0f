package com.kmg.pageocr.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Artifact locations under one document's output root. Every per-page path is a pure function
 * of the page index.
 */
public record ArtifactLayout(Path root, String imageExtension) {
    public static final String IMAGES_DIR = "images";
    public static final String TEXT_DIR = "text";
    public static final String COMBINED_FILE = "combined.txt";
    public static final String WORD_REPORT_FILE = "word_report.csv";
    public static final String ENTITY_REPORT_FILE = "entity_report.csv";
    public static final String RUN_REPORT_FILE = "run_report.json";

    public ArtifactLayout {
        imageExtension = imageExtension.toLowerCase(Locale.ROOT);
    }

    public static String pageName(int pageIndex) {
        return String.format("%04d", pageIndex);
    }

    public PageUnit unit(Path document, int pageIndex) {
        return new PageUnit(document, pageIndex, imagePath(pageIndex), textPath(pageIndex));
    }

    public Path imagesDir() {
        return root.resolve(IMAGES_DIR);
    }

    public Path textDir() {
        return root.resolve(TEXT_DIR);
    }

    public Path imagePath(int pageIndex) {
        return imagesDir().resolve(pageName(pageIndex) + "." + imageExtension);
    }

    public Path textPath(int pageIndex) {
        return textDir().resolve(pageName(pageIndex) + ".txt");
    }

    public Path combinedPath() {
        return root.resolve(COMBINED_FILE);
    }

    public Path wordReportPath() {
        return root.resolve(WORD_REPORT_FILE);
    }

    public Path entityReportPath() {
        return root.resolve(ENTITY_REPORT_FILE);
    }

    public Path runReportPath() {
        return root.resolve(RUN_REPORT_FILE);
    }
}
