package com.kmg.pageocr.engine;

public enum RecognizerEngine {
    TESSERACT,
    CLOUD_VISION
}
