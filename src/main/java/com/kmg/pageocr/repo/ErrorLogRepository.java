package com.kmg.pageocr.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Appends one timestamped block per failed document to {@code error_log.txt} next to the source
 * document.
 */
@Repository
public class ErrorLogRepository {
    private static final Logger log = LoggerFactory.getLogger(ErrorLogRepository.class);

    public static final String ERROR_LOG_FILE = "error_log.txt";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String HEAVY_RULE = "=".repeat(70);
    private static final String LIGHT_RULE = "-".repeat(70);

    private final Clock clock;

    public ErrorLogRepository() {
        this(Clock.systemDefaultZone());
    }

    ErrorLogRepository(Clock clock) {
        this.clock = clock;
    }

    public static Path logFileFor(Path document) {
        return document.toAbsolutePath().getParent().resolve(ERROR_LOG_FILE);
    }

    /**
     * Appends the failure block. A log that cannot be written is reported as a warning only.
     *
     * @return the log file, whether or not the append succeeded
     */
    public Path append(Path document, String errorMessage) {
        Path logFile = logFileFor(document);
        String block = "\n" + HEAVY_RULE + "\n"
                + "[" + TIMESTAMP.format(LocalDateTime.now(clock)) + "] ERROR processing: " + document.getFileName() + "\n"
                + LIGHT_RULE + "\n"
                + errorMessage + "\n"
                + HEAVY_RULE + "\n\n";
        try {
            Files.writeString(logFile, block, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not write to error log {}: {}", logFile, e.getMessage());
        }
        return logFile;
    }
}
