package com.epiccharts.core.render;

/**
 * Thrown when the rendering engine fails to start, crashes, or times out mid-render.
 * No partial image is ever returned alongside it.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
