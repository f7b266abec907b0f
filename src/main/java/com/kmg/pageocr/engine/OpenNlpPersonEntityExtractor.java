package com.kmg.pageocr.engine;

import com.kmg.pageocr.config.PageOcrProperties;
import com.kmg.pageocr.model.EntitySpan;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Person-name finder backed by an OpenNLP {@code TokenNameFinderModel}, e.g.
 * {@code en-ner-person.bin}. Unavailable when no model path is configured or the model fails
 * to load.
 */
@Component
public class OpenNlpPersonEntityExtractor implements PersonEntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(OpenNlpPersonEntityExtractor.class);
    private static final int MAX_TEXT_LENGTH = 1_000_000;

    private final NameFinderME nameFinder;

    public OpenNlpPersonEntityExtractor(PageOcrProperties properties) {
        this.nameFinder = loadModel(properties.getEntities().getModelPath());
    }

    private static NameFinderME loadModel(String modelPath) {
        if (modelPath == null || modelPath.isBlank()) {
            log.info("No person-name model configured (pageocr.entities.model-path); entity report disabled.");
            return null;
        }
        Path path = Path.of(modelPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Person-name model not found at {}; entity report disabled.", path);
            return null;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return new NameFinderME(new TokenNameFinderModel(in));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load person-name model {}: {}", path, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isAvailable() {
        return nameFinder != null;
    }

    @Override
    public int maxTextLength() {
        return MAX_TEXT_LENGTH;
    }

    @Override
    public synchronized List<EntitySpan> extractPersonEntities(String text) {
        if (nameFinder == null) {
            throw new IllegalStateException("Person-name model is not loaded.");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
        String[] tokens = Span.spansToStrings(tokenSpans, text);
        List<EntitySpan> entities = new ArrayList<>();
        try {
            for (Span name : nameFinder.find(tokens)) {
                int start = tokenSpans[name.getStart()].getStart();
                int end = tokenSpans[name.getEnd() - 1].getEnd();
                entities.add(new EntitySpan(text.substring(start, end), start, end));
            }
        } finally {
            // Pages are independent; adaptive data from one must not bias the next.
            nameFinder.clearAdaptiveData();
        }
        return entities;
    }
}
