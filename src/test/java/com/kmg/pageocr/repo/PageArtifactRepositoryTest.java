package com.kmg.pageocr.repo;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageText;
import com.kmg.pageocr.model.PageUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageArtifactRepositoryTest {

    @TempDir
    Path tempDir;

    private final PageArtifactRepository repository = new PageArtifactRepository();
    private ArtifactLayout layout;

    @BeforeEach
    void setUp() {
        layout = new ArtifactLayout(tempDir.resolve("report_processed"), "png");
    }

    @Test
    void artifactPathsUseFourDigitPageNames() {
        PageUnit unit = layout.unit(tempDir.resolve("report.pdf"), 7);

        assertThat(unit.imagePath()).isEqualTo(layout.root().resolve("images").resolve("0007.png"));
        assertThat(unit.textPath()).isEqualTo(layout.root().resolve("text").resolve("0007.txt"));
    }

    @Test
    void lastCompletedPageIsZeroWithoutOutput() {
        assertThat(repository.lastCompletedPage(layout)).isZero();
    }

    @Test
    void lastCompletedPageStopsBeforeFailureMarkedPage() throws IOException {
        // Given: pages 1-3 complete, page 4 carries the failure marker
        repository.prepare(layout);
        for (int page = 1; page <= 3; page++) {
            complete(page, "text of page " + page);
        }
        PageUnit failed = unit(4);
        repository.writeImage(failed, new byte[]{1});
        repository.writeFailure(failed, "RecognitionException: unreadable");

        // When / Then
        assertThat(repository.lastCompletedPage(layout)).isEqualTo(3);
        assertThat(repository.isComplete(failed)).isFalse();
    }

    @Test
    void oversizedNumericImageNameIsIgnored() throws IOException {
        repository.prepare(layout);
        complete(1, "one");
        complete(2, "two");
        Files.write(layout.imagesDir().resolve("99999999999.png"), new byte[]{1});

        assertThat(repository.lastCompletedPage(layout)).isEqualTo(2);
    }

    @Test
    void failedWriteRemovesTemporaryFile() throws IOException {
        // Given: the text artifact path is occupied by a non-empty directory
        repository.prepare(layout);
        Path blocked = Files.createDirectories(layout.textPath(1));
        Files.writeString(blocked.resolve("keep.txt"), "x");

        // When / Then
        assertThatThrownBy(() -> repository.writeText(unit(1), "hello")).isInstanceOf(IOException.class);
        assertThat(layout.textDir().resolve("0001.txt.tmp")).doesNotExist();
    }

    @Test
    void pageWithoutImageIsNotComplete() throws IOException {
        repository.prepare(layout);
        repository.writeText(unit(1), "text without image");

        assertThat(repository.isComplete(unit(1))).isFalse();
        assertThat(repository.lastCompletedPage(layout)).isZero();
    }

    @Test
    void readPageReportsEachState() throws IOException {
        repository.prepare(layout);
        complete(1, "hello");
        repository.writeFailure(unit(2), "RenderException: broken");

        List<PageText> pages = repository.readPages(layout, PageRange.of(1, 3));

        assertThat(pages).extracting(PageText::state).containsExactly(
                PageText.State.RECOGNIZED, PageText.State.FAILURE_MARKED, PageText.State.MISSING);
        assertThat(pages.get(0).content()).isEqualTo("hello");
        assertThat(pages.get(1).detail()).isEqualTo("RenderException: broken");
        assertThat(pages).filteredOn(PageText::usable).hasSize(1);
    }

    @Test
    void writesLeaveNoTemporaryFiles() throws IOException {
        repository.prepare(layout);
        complete(1, "first");
        complete(1, "second");

        try (Stream<Path> files = Files.list(layout.textDir())) {
            assertThat(files).extracting(path -> path.getFileName().toString()).containsExactly("0001.txt");
        }
        assertThat(Files.readString(layout.textPath(1))).isEqualTo("second");
    }

    private void complete(int page, String text) throws IOException {
        repository.writeImage(unit(page), new byte[]{1, 2, 3});
        repository.writeText(unit(page), text);
    }

    private PageUnit unit(int page) {
        return layout.unit(tempDir.resolve("report.pdf"), page);
    }
}
