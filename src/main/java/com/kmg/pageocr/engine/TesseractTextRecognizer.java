package com.kmg.pageocr.engine;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;

/**
 * Tesseract via Tess4J. A new engine instance is created per call because {@link Tesseract}
 * holds native state that must not be shared between worker threads.
 */
public class TesseractTextRecognizer implements TextRecognizer {
    private static final String NULL_DEVICE =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL" : "/dev/null";

    private final String tessdataPath;

    public TesseractTextRecognizer(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    @Override
    public String recognize(byte[] image, String languageHint) {
        BufferedImage bitmap;
        try {
            bitmap = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new RecognitionException("Failed to decode page image: " + e.getMessage(), e);
        }
        if (bitmap == null) {
            throw new RecognitionException("Page image format is not readable.");
        }

        try {
            return newEngine(languageHint).doOCR(bitmap);
        } catch (TesseractException e) {
            throw new RecognitionException(e.getMessage(), e);
        } catch (UnsatisfiedLinkError e) {
            throw new RecognitionException("Tesseract native library is not available: " + e.getMessage(), e);
        } finally {
            bitmap.flush();
        }
    }

    private ITesseract newEngine(String languageHint) {
        Tesseract tesseract = new Tesseract();
        if (tessdataPath != null && !tessdataPath.isBlank()) {
            tesseract.setDatapath(tessdataPath);
        }
        tesseract.setLanguage(languageHint);
        // Tesseract writes its warnings to debug_file; keep them off the console.
        tesseract.setVariable("debug_file", NULL_DEVICE);
        return tesseract;
    }
}
