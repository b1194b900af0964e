package com.epiccharts.core.render;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the shared headless browser.
 */
@Component
public class RendererHealthIndicator implements HealthIndicator {

    private final ChartRenderer renderer;

    public RendererHealthIndicator(ChartRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public Health health() {
        if (!renderer.isStarted()) {
            return Health.up().withDetail("browser", "idle (launches on first render)").build();
        }
        if (!renderer.isConnected()) {
            return Health.down().withDetail("browser", "disconnected").build();
        }
        return Health.up().withDetail("browser", "running").build();
    }
}
