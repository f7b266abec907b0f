package com.kmg.pageocr.engine;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

@Component
public class PdfBoxPageRasterizer implements PageRasterizer {
    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageRasterizer.class);

    @Override
    public DocumentHandle open(Path document) {
        try {
            return new PdfBoxDocumentHandle(document, Loader.loadPDF(document.toFile()));
        } catch (IOException e) {
            throw new RenderException("Failed to open PDF " + document.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static final class PdfBoxDocumentHandle implements DocumentHandle {
        private final Path path;
        private final PDDocument document;
        private final PDFRenderer renderer;

        private PdfBoxDocumentHandle(Path path, PDDocument document) {
            this.path = path;
            this.document = document;
            this.renderer = new PDFRenderer(document);
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public byte[] render(int pageIndex, int dpi, String imageFormat) {
            if (pageIndex < 1 || pageIndex > pageCount()) {
                throw new RenderException("Page " + pageIndex + " is outside 1-" + pageCount() + " of " + path.getFileName());
            }

            BufferedImage image = null;
            try {
                image = renderer.renderImageWithDPI(pageIndex - 1, dpi, ImageType.RGB);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                if (!ImageIO.write(image, imageFormat, out)) {
                    throw new RenderException("No image writer available for format: " + imageFormat);
                }
                return out.toByteArray();
            } catch (IOException e) {
                throw new RenderException("Failed to render page " + pageIndex + ": " + e.getMessage(), e);
            } finally {
                if (image != null) {
                    image.flush();
                }
            }
        }

        @Override
        public void close() {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Failed to close PDF {}: {}", path.getFileName(), e.getMessage());
            }
        }
    }
}
