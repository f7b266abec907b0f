package com.kmg.pageocr.repo;

import com.kmg.pageocr.model.ArtifactLayout;
import com.kmg.pageocr.model.PageRange;
import com.kmg.pageocr.model.PageText;
import com.kmg.pageocr.model.PageUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Per-page image and text artifacts on disk. A page is complete when its image exists and its
 * text artifact exists without the failure marker.
 */
@Repository
public class PageArtifactRepository {
    private static final Logger log = LoggerFactory.getLogger(PageArtifactRepository.class);

    public static final String FAILURE_MARKER = "OCR FAILED FOR THIS PAGE: ";

    public void prepare(ArtifactLayout layout) throws IOException {
        Files.createDirectories(layout.imagesDir());
        Files.createDirectories(layout.textDir());
    }

    public boolean isComplete(PageUnit unit) {
        return isComplete(unit.imagePath(), unit.textPath());
    }

    /**
     * Highest page index whose artifacts satisfy {@link #isComplete(PageUnit)}, or 0.
     */
    public int lastCompletedPage(ArtifactLayout layout) {
        if (!Files.isDirectory(layout.imagesDir()) || !Files.isDirectory(layout.textDir())) {
            return 0;
        }

        Pattern imageName = Pattern.compile("(\\d{1,9})\\." + Pattern.quote(layout.imageExtension()));
        try (Stream<Path> images = Files.list(layout.imagesDir())) {
            return images
                    .map(path -> imageName.matcher(path.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
                    .filter(page -> page > 0 && isComplete(layout.imagePath(page), layout.textPath(page)))
                    .max()
                    .orElse(0);
        } catch (IOException e) {
            log.warn("Failed to scan {}: {}", layout.imagesDir(), e.getMessage());
            return 0;
        }
    }

    public void writeImage(PageUnit unit, byte[] image) throws IOException {
        writeAtomically(unit.imagePath(), image);
    }

    public void writeText(PageUnit unit, String text) throws IOException {
        writeAtomically(unit.textPath(), text.getBytes(StandardCharsets.UTF_8));
    }

    public void writeFailure(PageUnit unit, String detail) throws IOException {
        writeText(unit, FAILURE_MARKER + detail);
    }

    public static boolean isFailureMarked(String content) {
        return content.startsWith(FAILURE_MARKER);
    }

    public List<PageText> readPages(ArtifactLayout layout, PageRange range) {
        return range.pages()
                .mapToObj(page -> readPage(layout, page))
                .toList();
    }

    public PageText readPage(ArtifactLayout layout, int pageIndex) {
        Path textPath = layout.textPath(pageIndex);
        if (!Files.isRegularFile(textPath)) {
            return new PageText(pageIndex, PageText.State.MISSING, null, "text artifact missing");
        }
        try {
            String content = Files.readString(textPath, StandardCharsets.UTF_8);
            if (isFailureMarked(content)) {
                return new PageText(pageIndex, PageText.State.FAILURE_MARKED, null, content.substring(FAILURE_MARKER.length()));
            }
            return new PageText(pageIndex, PageText.State.RECOGNIZED, content, null);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", textPath.getFileName(), e.getMessage());
            return new PageText(pageIndex, PageText.State.UNREADABLE, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private boolean isComplete(Path imagePath, Path textPath) {
        return Files.isRegularFile(imagePath)
                && Files.isRegularFile(textPath)
                && holdsRecognizedText(textPath);
    }

    private boolean holdsRecognizedText(Path textPath) {
        try {
            return !isFailureMarked(Files.readString(textPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Treating unreadable {} as incomplete: {}", textPath, e.getMessage());
            return false;
        }
    }

    // Readers never observe a half-written artifact: content lands in a sibling temp file first.
    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
