package com.kmg.pageocr.engine;

import com.kmg.pageocr.model.EntitySpan;

import java.util.List;

/**
 * Finds person names in recognized text. An extractor may be installed without a usable model;
 * callers check {@link #isAvailable()} before extracting.
 */
public interface PersonEntityExtractor {

    boolean isAvailable();

    /**
     * Longest input accepted by one {@link #extractPersonEntities(String)} call.
     */
    int maxTextLength();

    List<EntitySpan> extractPersonEntities(String text);
}
