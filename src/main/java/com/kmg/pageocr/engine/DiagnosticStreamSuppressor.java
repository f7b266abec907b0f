package com.kmg.pageocr.engine;

import org.springframework.stereotype.Component;

import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Silences {@code System.err} while recognition engines run. Scopes may overlap across worker
 * threads: the first open scope swaps the stream out and the last one to close puts the original
 * back.
 */
@Component
public class DiagnosticStreamSuppressor {
    private final Object lock = new Object();
    private int openScopes;
    private PrintStream original;

    public Scope suppress() {
        synchronized (lock) {
            if (openScopes == 0) {
                original = System.err;
                System.setErr(new PrintStream(OutputStream.nullOutputStream()));
            }
            openScopes++;
        }
        return new Scope();
    }

    private void release() {
        synchronized (lock) {
            openScopes--;
            if (openScopes == 0) {
                System.setErr(original);
                original = null;
            }
        }
    }

    public final class Scope implements AutoCloseable {
        private boolean closed;

        private Scope() {
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            release();
        }
    }
}
