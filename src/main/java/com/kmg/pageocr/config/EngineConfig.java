package com.kmg.pageocr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kmg.pageocr.engine.CloudVisionTextRecognizer;
import com.kmg.pageocr.engine.TesseractTextRecognizer;
import com.kmg.pageocr.engine.TextRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public TextRecognizer textRecognizer(PageOcrProperties properties) {
        PageOcrProperties.Recognizer recognizer = properties.getRecognizer();
        return switch (recognizer.getEngine()) {
            case TESSERACT -> {
                log.info("Text recognition: Tesseract (tessdata: {})",
                        recognizer.getTessdataPath() == null ? "default" : recognizer.getTessdataPath());
                yield new TesseractTextRecognizer(recognizer.getTessdataPath());
            }
            case CLOUD_VISION -> {
                if (recognizer.getCredentialsPath() == null || recognizer.getCredentialsPath().isBlank()) {
                    throw new IllegalStateException("pageocr.recognizer.credentials-path is required for CLOUD_VISION.");
                }
                log.info("Text recognition: Google Cloud Vision");
                yield new CloudVisionTextRecognizer(Path.of(recognizer.getCredentialsPath()));
            }
        };
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
