package com.kmg.pageocr.engine;

public interface TextRecognizer {

    /**
     * Recognizes the text in an encoded page image.
     *
     * @param languageHint engine language code(s), several joined with {@code +}
     * @throws RecognitionException if the engine rejects the image or fails
     */
    String recognize(byte[] image, String languageHint);

    class RecognitionException extends RuntimeException {
        public RecognitionException(String message) {
            super(message);
        }

        public RecognitionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
