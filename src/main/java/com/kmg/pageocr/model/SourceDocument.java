package com.kmg.pageocr.model;

import java.nio.file.Path;

public record SourceDocument(Path path, int pageCount, String languageHint, int dpi) {

    public String name() {
        return path.getFileName().toString();
    }
}
