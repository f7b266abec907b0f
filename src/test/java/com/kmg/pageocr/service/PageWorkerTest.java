package com.kmg.pageocr.service;

import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageResult;
import com.kmg.pageocr.model.PageStatus;
import com.kmg.pageocr.model.PageUnit;
import com.kmg.pageocr.repo.PageArtifactRepository;
import com.kmg.pageocr.support.PipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PageWorkerTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;
    private ArtifactLayout layout;
    private PipelineConfig config;
    private Path document;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PipelineFixture();
        fixture.rasterizer.withDocument("scan.pdf", "first page", "FAIL here", "third page");
        document = tempDir.resolve("scan.pdf");
        layout = new ArtifactLayout(tempDir.resolve("scan_processed"), "png");
        config = PipelineFixture.config(tempDir);
        fixture.artifacts.prepare(layout);
    }

    @Test
    void successfulPageWritesImageAndTrimmedText() throws IOException {
        PageResult result = fixture.worker.process(unit(1), config);

        assertThat(result).isEqualTo(PageResult.success(1));
        assertThat(Files.readAllBytes(layout.imagePath(1))).isEqualTo("first page".getBytes());
        assertThat(Files.readString(layout.textPath(1))).isEqualTo("first page");
        assertThat(fixture.rasterizer.openHandles()).isZero();
    }

    @Test
    void completedPageIsSkippedWithoutOpeningTheDocument() {
        fixture.worker.process(unit(1), config);
        int opensAfterFirstRun = fixture.rasterizer.opens();

        PageResult second = fixture.worker.process(unit(1), config);

        assertThat(second.status()).isEqualTo(PageStatus.SKIPPED_ALREADY_DONE);
        assertThat(fixture.rasterizer.opens()).isEqualTo(opensAfterFirstRun);
        assertThat(fixture.recognizer.calls()).isEqualTo(1);
    }

    @Test
    void recognitionFailureIsMarkedAndReported() throws IOException {
        PageResult result = fixture.worker.process(unit(2), config);

        assertThat(result.status()).isEqualTo(PageStatus.FAILURE);
        assertThat(result.errorDetail()).isEqualTo("RecognitionException: Tesseract could not read the page");
        assertThat(Files.readString(layout.textPath(2)))
                .isEqualTo(PageArtifactRepository.FAILURE_MARKER + "RecognitionException: Tesseract could not read the page");
        assertThat(Files.exists(layout.imagePath(2))).isTrue();
        assertThat(fixture.artifacts.isComplete(unit(2))).isFalse();
        assertThat(fixture.rasterizer.openHandles()).isZero();
    }

    @Test
    void renderFailureLeavesNoImageAndReleasesTheHandle() throws IOException {
        fixture.rasterizer.failRenderingPage(3);

        PageResult result = fixture.worker.process(unit(3), config);

        assertThat(result.status()).isEqualTo(PageStatus.FAILURE);
        assertThat(result.errorDetail()).startsWith("RenderException: Failed to render page 3");
        assertThat(Files.exists(layout.imagePath(3))).isFalse();
        assertThat(Files.readString(layout.textPath(3))).startsWith(PageArtifactRepository.FAILURE_MARKER);
        assertThat(fixture.rasterizer.openHandles()).isZero();
    }

    @Test
    void unreadableDocumentIsAPageFailure() {
        PageUnit unit = layout.unit(tempDir.resolve("unknown.pdf"), 1);

        PageResult result = fixture.worker.process(unit, config);

        assertThat(result.status()).isEqualTo(PageStatus.FAILURE);
        assertThat(result.errorDetail()).startsWith("RenderException: Failed to open PDF unknown.pdf");
    }

    @Test
    void standardErrorIsRestoredAfterRecognition() {
        PrintStream before = System.err;

        fixture.worker.process(unit(1), config);
        fixture.worker.process(unit(2), config);

        assertThat(System.err).isSameAs(before);
    }

    private PageUnit unit(int page) {
        return layout.unit(document, page);
    }
}
