package com.kmg.pageocr.engine;

/**
 * An open document owned by exactly one caller. Not safe for concurrent use.
 */
public interface DocumentHandle extends AutoCloseable {

    int pageCount();

    /**
     * Renders a 1-based page and encodes it in the given ImageIO format.
     *
     * @throws PageRasterizer.RenderException if the page cannot be rendered or encoded
     */
    byte[] render(int pageIndex, int dpi, String imageFormat);

    @Override
    void close();
}
