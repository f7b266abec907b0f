package com.kmg.pageocr.model;

import java.nio.file.Path;

/**
 * One page of one document, together with the artifact locations derived from its index.
 * Identity is {@code (document, pageIndex)}.
 */
public record PageUnit(Path document, int pageIndex, Path imagePath, Path textPath) {
}
