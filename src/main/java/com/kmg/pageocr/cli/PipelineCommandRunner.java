package com.kmg.pageocr.cli;

import com.kmg.pageocr.config.PageOcrProperties;
import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.model.BatchSummary;
import com.kmg.pageocr.model.DocumentRunResult;
import com.kmg.pageocr.model.PageSelection;
import com.kmg.pageocr.service.BatchCoordinator;
import com.kmg.pageocr.service.DocumentPipelineService;
import com.kmg.pageocr.service.PipelineSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point. A directory argument starts a batch over its PDFs, a file argument a
 * single-document run with an optional page selection.
 */
@Component
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PipelineCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: page-ocr <document.pdf | directory> [options]
              --output-dir=DIR       where per-document output folders are created (default: .)
              --dpi=N                rasterization resolution (default: 300)
              --lang=CODE            recognition language, e.g. eng or eng+deu (default: eng)
              --concurrency=N        page workers, 0 for one per processor (default: 0)
              --tessdata-path=DIR    Tesseract language data directory
              --engine=TESSERACT|CLOUD_VISION
              --credentials-path=F   service account key for CLOUD_VISION
              --entity-model=FILE    OpenNLP person name model for the proper names report
              --mode=all|range|resume
              --range=START-END      pages to process, implies --mode=range""";

    private final DocumentPipelineService documentPipelineService;
    private final BatchCoordinator batchCoordinator;
    private final PageOcrProperties properties;

    private int exitCode = EXIT_OK;

    public PipelineCommandRunner(DocumentPipelineService documentPipelineService, BatchCoordinator batchCoordinator,
                                 PageOcrProperties properties) {
        this.documentPipelineService = documentPipelineService;
        this.batchCoordinator = batchCoordinator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> targets = args.getNonOptionArgs();
        if (targets.size() != 1) {
            log.error("Expected exactly one document or directory argument, got {}", targets.size());
            log.info(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        Path target = Path.of(targets.get(0)).toAbsolutePath().normalize();
        try {
            PipelineConfig config = properties.toPipelineConfig();
            if (Files.isDirectory(target)) {
                runBatch(target, config);
            } else {
                PageSelection selection = PageSelection.parse(optionValue(args, "mode"), optionValue(args, "range"));
                runDocument(target, selection, config);
            }
            exitCode = EXIT_OK;
        } catch (PipelineSetupException | IllegalArgumentException e) {
            log.error("Error: {}", e.getMessage());
            exitCode = EXIT_SETUP_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runBatch(Path directory, PipelineConfig config) {
        BatchSummary summary = batchCoordinator.processDirectory(directory, config.outputRoot(), config);
        log.info("Batch finished: {} succeeded, {} failed", summary.successful().size(), summary.failed().size());
    }

    private void runDocument(Path document, PageSelection selection, PipelineConfig config) {
        Path outputDir = DocumentPipelineService.outputDirectoryFor(config.outputRoot(), document);
        DocumentRunResult result = documentPipelineService.run(document, outputDir, selection, config);
        log.info("Finished {}: {} succeeded, {} failed, {} skipped. Output in {}",
                result.document().name(), result.tally().successCount(), result.tally().failureCount(),
                result.tally().skippedCount(), result.outputDir());
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
