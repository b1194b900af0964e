package com.epiccharts.core.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.ScreenshotType;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Playwright-driven headless Chromium.
 *
 * <p>The browser is launched with sandboxing and GPU disabled so it runs inside minimal
 * containers. A system Chromium is preferred when one is found (explicit property, then the
 * {@code PUPPETEER_EXECUTABLE_PATH} / {@code CHROMIUM_PATH} env vars, then well-known paths);
 * otherwise Playwright's bundled browser is used.
 *
 * <p>Playwright objects are not thread-safe, so all calls are serialized on this instance.
 */
public class PlaywrightRenderingEngine implements RenderingEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightRenderingEngine.class);

    private static final List<String> CHROMIUM_PATHS = List.of(
            "/usr/bin/chromium",
            "/usr/bin/chromium-browser",
            "/usr/bin/google-chrome",
            "/usr/bin/google-chrome-stable"
    );

    private static final List<String> LAUNCH_ARGS = List.of(
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu"
    );

    private final Playwright playwright;
    private final Browser browser;
    private boolean closed;

    private PlaywrightRenderingEngine(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    /**
     * Starts Playwright and launches Chromium. Takes seconds; call once and reuse.
     */
    public static PlaywrightRenderingEngine launch(RenderProperties properties) {
        Path executable = resolveExecutable(properties);
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new RenderException("Failed to start Playwright driver", e);
        }
        try {
            var options = new BrowserType.LaunchOptions()
                    .setHeadless(properties.isHeadless())
                    .setArgs(LAUNCH_ARGS);
            if (executable != null) {
                options.setExecutablePath(executable);
            }
            Browser browser = playwright.chromium().launch(options);
            log.info("Headless browser launched (executable: {}, version: {})",
                    executable != null ? executable : "bundled", browser.version());
            return new PlaywrightRenderingEngine(playwright, browser);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new RenderException("Failed to launch headless browser", e);
        }
    }

    @Override
    public synchronized byte[] capture(String html, int width, int height, Duration timeout) {
        if (closed) {
            throw new RenderException("Rendering engine already closed");
        }
        double timeoutMs = timeout.toMillis();
        Page page;
        try {
            page = browser.newPage(new Browser.NewPageOptions().setViewportSize(width, height));
        } catch (PlaywrightException e) {
            throw new RenderException("Could not open render page: " + e.getMessage(), e);
        }
        try {
            page.setDefaultTimeout(timeoutMs);
            page.setContent(html, new Page.SetContentOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(timeoutMs));
            return page.screenshot(new Page.ScreenshotOptions()
                    .setType(ScreenshotType.PNG)
                    .setClip(0, 0, width, height)
                    .setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            throw new RenderException("Render timed out after " + timeout.toSeconds() + "s", e);
        } catch (PlaywrightException e) {
            throw new RenderException("Rendering engine failed: " + e.getMessage(), e);
        } finally {
            try {
                page.close();
            } catch (PlaywrightException e) {
                log.debug("Render page already closed: {}", e.getMessage());
            }
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return !closed && browser.isConnected();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Error closing headless browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            log.warn("Error stopping Playwright driver: {}", e.getMessage());
        }
        log.info("Headless browser closed");
    }

    static Path resolveExecutable(RenderProperties properties) {
        if (properties.hasExecutablePath()) {
            return Path.of(properties.getExecutablePath());
        }
        for (String env : List.of("PUPPETEER_EXECUTABLE_PATH", "CHROMIUM_PATH")) {
            String value = System.getenv(env);
            if (value != null && !value.isBlank()) {
                return Path.of(value);
            }
        }
        for (String candidate : CHROMIUM_PATHS) {
            Path path = Path.of(candidate);
            if (Files.isExecutable(path)) {
                return path;
            }
        }
        return null;
    }
}
