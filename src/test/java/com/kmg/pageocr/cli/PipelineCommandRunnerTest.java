package com.kmg.pageocr.cli;

import com.kmg.pageocr.config.PageOcrProperties;
import com.kmg.pageocr.model.BatchSummary;
import com.kmg.pageocr.model.DocumentRunResult;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageSelection;
import com.kmg.pageocr.model.RunTally;
import com.kmg.pageocr.model.SourceDocument;
import com.kmg.pageocr.service.BatchCoordinator;
import com.kmg.pageocr.service.DocumentPipelineService;
import com.kmg.pageocr.service.PipelineSetupException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineCommandRunnerTest {

    @TempDir
    Path tempDir;

    private DocumentPipelineService documentPipelineService;
    private BatchCoordinator batchCoordinator;
    private PipelineCommandRunner runner;

    @BeforeEach
    void setUp() {
        documentPipelineService = mock(DocumentPipelineService.class);
        batchCoordinator = mock(BatchCoordinator.class);
        PageOcrProperties properties = new PageOcrProperties();
        properties.getOutput().setDir(tempDir.resolve("out").toString());
        properties.getPipeline().setConcurrency(2);
        runner = new PipelineCommandRunner(documentPipelineService, batchCoordinator, properties);
    }

    @Test
    void missingArgumentPrintsUsage() {
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_USAGE);
        verifyNoInteractions(documentPipelineService, batchCoordinator);
    }

    @Test
    void setupErrorEndsWithNonZeroExit() {
        Path missing = tempDir.resolve("missing.pdf");
        when(documentPipelineService.run(any(), any(), any(), any()))
                .thenThrow(new PipelineSetupException("Input file not found: " + missing));

        runner.run(new DefaultApplicationArguments(missing.toString()));

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_SETUP_ERROR);
    }

    @Test
    void invalidModeIsRejectedBeforeAnyWork() {
        runner.run(new DefaultApplicationArguments(tempDir.resolve("a.pdf").toString(), "--mode=sometimes"));

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_SETUP_ERROR);
        verifyNoInteractions(documentPipelineService);
    }

    @Test
    void documentRunUsesSelectedRangeAndDerivedOutputDirectory() {
        Path pdf = tempDir.resolve("annual report.pdf");
        Path outputDir = tempDir.resolve("out").resolve("annual_report_processed");
        when(documentPipelineService.run(any(), any(), any(), any())).thenReturn(new DocumentRunResult(
                new SourceDocument(pdf, 5, "eng", 300), outputDir, PageRange.of(2, 3), 2, new RunTally(2), List.of()));

        runner.run(new DefaultApplicationArguments(pdf.toString(), "--range=2-3"));

        assertThat(runner.getExitCode()).isZero();
        verify(documentPipelineService).run(eq(pdf), eq(outputDir), eq(PageSelection.range(2, 3)), any());
    }

    @Test
    void directoryArgumentStartsBatch() throws IOException {
        Path inbox = Files.createDirectory(tempDir.resolve("inbox"));
        when(batchCoordinator.processDirectory(any(), any(), any()))
                .thenReturn(new BatchSummary(List.of(), Duration.ZERO));

        runner.run(new DefaultApplicationArguments(inbox.toString()));

        assertThat(runner.getExitCode()).isZero();
        verify(batchCoordinator).processDirectory(eq(inbox), eq(tempDir.resolve("out").toAbsolutePath().normalize()), any());
        verifyNoInteractions(documentPipelineService);
    }
}
