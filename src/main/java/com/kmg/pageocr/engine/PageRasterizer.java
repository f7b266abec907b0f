package com.kmg.pageocr.engine;

import java.nio.file.Path;

public interface PageRasterizer {

    /**
     * Opens a fresh handle on the document. Each caller gets its own handle and must close it.
     *
     * @throws RenderException if the file is not a readable document
     */
    DocumentHandle open(Path document);

    class RenderException extends RuntimeException {
        public RenderException(String message) {
            super(message);
        }

        public RenderException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
