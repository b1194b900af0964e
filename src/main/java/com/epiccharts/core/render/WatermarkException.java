package com.epiccharts.core.render;

/**
 * Thrown when an image cannot be decoded or re-encoded while applying the watermark.
 */
public class WatermarkException extends RuntimeException {

    public WatermarkException(String message) {
        super(message);
    }

    public WatermarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
