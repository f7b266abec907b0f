package com.kmg.pageocr.service;

/**
 * A document run cannot start: bad path, not a PDF, unreadable or empty document, or an invalid
 * page selection. Raised before any page is scheduled.
 */
public class PipelineSetupException extends RuntimeException {
    public PipelineSetupException(String message) {
        super(message);
    }

    public PipelineSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
