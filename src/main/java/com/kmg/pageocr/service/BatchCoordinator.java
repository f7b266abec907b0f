package com.kmg.pageocr.service;

import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.model.BatchOutcome;
import com.kmg.pageocr.model.BatchSummary;
import com.kmg.pageocr.model.PageSelection;
import com.kmg.pageocr.repo.ErrorLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Processes every PDF in a directory, one document at a time. A failing document is logged and
 * recorded; the batch moves on to the next one.
 */
@Service
public class BatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final DocumentPipelineService documentPipelineService;
    private final ErrorLogRepository errorLogRepository;

    public BatchCoordinator(DocumentPipelineService documentPipelineService, ErrorLogRepository errorLogRepository) {
        this.documentPipelineService = documentPipelineService;
        this.errorLogRepository = errorLogRepository;
    }

    public BatchSummary processDirectory(Path directory, Path outputRoot, PipelineConfig config) {
        if (!Files.isDirectory(directory)) {
            throw new PipelineSetupException("Input directory not found: " + directory);
        }

        List<Path> documents = listDocuments(directory);
        log.info("Batch: {} PDF file(s) in {}", documents.size(), directory);

        long startedAt = System.nanoTime();
        List<BatchOutcome> outcomes = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();

        for (int i = 0; i < documents.size(); i++) {
            Path document = documents.get(i);
            String name = document.getFileName().toString();
            Path outputDir = outputRoot.resolve(uniqueName(DocumentPipelineService.outputNameFor(document), usedNames));
            log.info("[{}/{}] Processing {}", i + 1, documents.size(), name);
            try {
                documentPipelineService.run(document, outputDir, PageSelection.all(), config);
                outcomes.add(BatchOutcome.succeeded(name));
            } catch (Exception e) {
                String detail = ExceptionClassifier.describe(e);
                log.error("Failed to process {}: {}", name, detail);
                errorLogRepository.append(document, detail);
                outcomes.add(BatchOutcome.failed(name, detail));
            }
        }

        BatchSummary summary = new BatchSummary(outcomes, Duration.ofNanos(System.nanoTime() - startedAt));
        logSummary(summary, directory);
        return summary;
    }

    List<Path> listDocuments(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(DocumentPipelineService::isPdf)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new PipelineSetupException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
    }

    static String uniqueName(String candidate, Set<String> usedNames) {
        String name = candidate;
        int suffix = 2;
        while (!usedNames.add(name.toLowerCase(Locale.ROOT))) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }

    private void logSummary(BatchSummary summary, Path directory) {
        double seconds = summary.elapsed().toMillis() / 1000.0;
        StringBuilder report = new StringBuilder("BATCH PROCESSING SUMMARY");
        for (BatchOutcome outcome : summary.outcomes()) {
            report.append("\n  ").append(outcome.success() ? "SUCCESS" : "FAILURE").append(": ").append(outcome.documentName());
            if (!outcome.success()) {
                report.append(" (").append(outcome.errorDetail()).append(')');
            }
        }
        report.append("\n  Total: ").append(summary.outcomes().size())
                .append(", successful: ").append(summary.successful().size())
                .append(", failed: ").append(summary.failed().size())
                .append(String.format(Locale.ROOT, "\n  Elapsed: %.1f s (%.1f min)", seconds, seconds / 60.0));
        if (!summary.failed().isEmpty()) {
            report.append("\n  Error details: ").append(directory.toAbsolutePath().resolve(ErrorLogRepository.ERROR_LOG_FILE));
        }
        log.info(report.toString());
    }
}
