package com.epiccharts.core.render;

import java.time.Duration;

/**
 * A long-lived headless browser process that turns an HTML document into a bitmap.
 * <p>
 * Starting an engine is expensive; one instance is shared by every render and closed
 * once at shutdown. Each {@link #capture} call works on its own short-lived page.
 * Implementations: {@link PlaywrightRenderingEngine}.
 */
public interface RenderingEngine extends AutoCloseable {

    /**
     * Loads {@code html} into a fresh page of {@code width}x{@code height}, waits for it to
     * settle, and returns a PNG clipped to those bounds. The page is closed before returning.
     *
     * @throws RenderException on engine failure or when {@code timeout} elapses
     */
    byte[] capture(String html, int width, int height, Duration timeout);

    /**
     * Returns {@code true} while the underlying browser process is usable.
     */
    boolean isConnected();

    /**
     * Terminates the browser process.
     */
    @Override
    void close();
}
