package com.kmg.pageocr.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.pageocr.config.PipelineConfig;
import com.kmg.pageocr.model.DocumentRunResult;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageSelection;
import com.kmg.pageocr.model.ReportOutcome;
import com.kmg.pageocr.model.ReportStatus;
import com.kmg.pageocr.support.PipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentPipelineServiceTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;
    private PipelineConfig config;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        config = PipelineFixture.config(tempDir.resolve("out"));
        outputDir = tempDir.resolve("out").resolve("minutes_processed");
    }

    @Test
    void fullRunProcessesPagesAndWritesReports() throws IOException {
        // Given
        Path pdf = pdf("minutes.pdf", "The board met today.", "FAIL smudged", "The board adjourned.");

        // When
        DocumentRunResult result = fixture.documents.run(pdf, outputDir, PageSelection.all(), config);

        // Then
        assertThat(result.document().pageCount()).isEqualTo(3);
        assertThat(result.workRange()).isEqualTo(PageRange.of(1, 3));
        assertThat(result.tally().successCount()).isEqualTo(2);
        assertThat(result.tally().failureCount()).isEqualTo(1);
        assertThat(result.reports()).extracting(ReportOutcome::status)
                .containsExactly(ReportStatus.WRITTEN, ReportStatus.WRITTEN, ReportStatus.SKIPPED);
        assertThat(result.reports().get(0).skippedPages()).containsExactly(2);
        assertThat(Files.readString(outputDir.resolve("combined.txt")))
                .contains("--- Page 1 ---\nThe board met today.")
                .doesNotContain("--- Page 2 ---");

        JsonNode runReport = new ObjectMapper().readTree(outputDir.resolve("run_report.json").toFile());
        assertThat(runReport.get("mode").asText()).isEqualTo("ALL");
        assertThat(runReport.get("tally").get("failure").asInt()).isEqualTo(1);
        assertThat(runReport.get("failures").get(0).get("page").asInt()).isEqualTo(2);
    }

    @Test
    void repeatedRunSkipsCompletedPagesAndRetriesFailedOnes() throws IOException {
        Path pdf = pdf("minutes.pdf", "alpha", "FAIL beta", "gamma");
        fixture.documents.run(pdf, outputDir, PageSelection.all(), config);
        int renders = fixture.rasterizer.renders();

        DocumentRunResult second = fixture.documents.run(pdf, outputDir, PageSelection.all(), config);

        assertThat(second.pendingPages()).isEqualTo(1);
        assertThat(second.tally().failureCount()).isEqualTo(1);
        assertThat(fixture.rasterizer.renders()).isEqualTo(renders + 1);
        assertThat(second.reports()).isEmpty();
    }

    @Test
    void resumeContinuesAfterLastCompletedPage() throws IOException {
        Path pdf = pdf("minutes.pdf", "one", "two", "three", "four");
        fixture.documents.run(pdf, outputDir, PageSelection.range(1, 2), config);

        DocumentRunResult resumed = fixture.documents.run(pdf, outputDir, PageSelection.resume(), config);

        assertThat(resumed.workRange()).isEqualTo(PageRange.of(3, 4));
        assertThat(resumed.tally().successCount()).isEqualTo(2);
        assertThat(Files.readString(outputDir.resolve("combined.txt")))
                .contains("--- Page 1 ---", "--- Page 4 ---");
    }

    @Test
    void resumeOfFinishedDocumentSchedulesNothing() throws IOException {
        Path pdf = pdf("minutes.pdf", "one", "two");
        fixture.documents.run(pdf, outputDir, PageSelection.all(), config);

        DocumentRunResult resumed = fixture.documents.run(pdf, outputDir, PageSelection.resume(), config);

        assertThat(resumed.workRange().isEmpty()).isTrue();
        assertThat(resumed.tally().submitted()).isZero();
    }

    @Test
    void rejectsInvalidInputBeforeScheduling() throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "not a pdf");
        Files.writeString(tempDir.resolve("corrupt.pdf"), "garbage");
        fixture.rasterizer.withCorruptDocument("corrupt.pdf");
        Path empty = pdf("empty.pdf");
        Path short2 = pdf("short.pdf", "one", "two");

        assertThatThrownBy(() -> fixture.documents.run(tempDir.resolve("absent.pdf"), outputDir, PageSelection.all(), config))
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("Input file not found");
        assertThatThrownBy(() -> fixture.documents.run(tempDir.resolve("notes.txt"), outputDir, PageSelection.all(), config))
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("Not a PDF file");
        assertThatThrownBy(() -> fixture.documents.run(tempDir.resolve("corrupt.pdf"), outputDir, PageSelection.all(), config))
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("Cannot read PDF corrupt.pdf");
        assertThatThrownBy(() -> fixture.documents.run(empty, outputDir, PageSelection.all(), config))
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("PDF contains 0 pages");
        assertThatThrownBy(() -> fixture.documents.run(short2, outputDir, PageSelection.range(2, 5), config))
                .isInstanceOf(PipelineSetupException.class)
                .hasMessageContaining("between 1 and 2");
        assertThat(fixture.rasterizer.renders()).isZero();
    }

    @Test
    void outputDirectoryNameIsSanitized() {
        Path root = tempDir.resolve("out");

        assertThat(DocumentPipelineService.outputDirectoryFor(root, Path.of("my report (v2).PDF")))
                .isEqualTo(root.resolve("my_report__v2__processed"));
        assertThat(DocumentPipelineService.outputDirectoryFor(root, Path.of("scan.2024-01.pdf")))
                .isEqualTo(root.resolve("scan.2024-01_processed"));
    }

    private Path pdf(String name, String... pages) throws IOException {
        fixture.rasterizer.withDocument(name, pages);
        return Files.writeString(tempDir.resolve(name), "%PDF-1.7");
    }
}
