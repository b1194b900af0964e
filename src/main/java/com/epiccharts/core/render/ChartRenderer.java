package com.epiccharts.core.render;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.DisplayConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Renders a chart to a PNG bitmap.
 * <p>
 * The headless browser is started on the first render and reused until {@link #shutdown()}.
 * If the browser process dies between renders it is relaunched on the next call.
 */
@Service
public class ChartRenderer {

    private static final Logger log = LoggerFactory.getLogger(ChartRenderer.class);

    private final Supplier<RenderingEngine> engineFactory;
    private final RenderProperties properties;
    private final ChartMarkupBuilder markupBuilder;

    private RenderingEngine engine;
    private boolean shutDown;

    public ChartRenderer(Supplier<RenderingEngine> engineFactory, RenderProperties properties) {
        this.engineFactory = engineFactory;
        this.properties = properties;
        this.markupBuilder = new ChartMarkupBuilder(properties.getWidth(), properties.getHeight());
    }

    public byte[] render(ChartData data, DisplayConfig config) {
        String html = markupBuilder.build(data, config);
        RenderingEngine current = engine();
        long start = System.currentTimeMillis();
        byte[] png = current.capture(html, properties.getWidth(), properties.getHeight(),
                Duration.ofSeconds(properties.getTimeoutSeconds()));
        log.info("Rendered {} chart ({} bytes, {}ms)",
                config.chartType().name().toLowerCase(), png.length, System.currentTimeMillis() - start);
        return png;
    }

    private synchronized RenderingEngine engine() {
        if (shutDown) {
            throw new RenderException("Renderer has been shut down");
        }
        if (engine != null && !engine.isConnected()) {
            log.warn("Headless browser disconnected, relaunching");
            closeQuietly(engine);
            engine = null;
        }
        if (engine == null) {
            log.info("Launching headless browser...");
            engine = engineFactory.get();
        }
        return engine;
    }

    public synchronized boolean isStarted() {
        return engine != null;
    }

    /**
     * {@code false} only when a started browser has lost its process.
     */
    public synchronized boolean isConnected() {
        return engine == null || engine.isConnected();
    }

    /**
     * Closes the browser if it was ever started. Safe to call more than once.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        if (engine != null) {
            log.info("Shutting down renderer");
            closeQuietly(engine);
            engine = null;
        }
    }

    private static void closeQuietly(RenderingEngine engine) {
        try {
            engine.close();
        } catch (RuntimeException e) {
            log.warn("Error closing rendering engine: {}", e.getMessage());
        }
    }
}
