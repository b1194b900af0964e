package com.epiccharts.core.health;

import com.epiccharts.core.render.ChartRenderer;
import com.epiccharts.core.vision.VisionProperties;
import com.epiccharts.twitter.TwitterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private TwitterProperties twitter;
    private VisionProperties vision;
    private ChartRenderer renderer;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        twitter = new TwitterProperties();
        vision = new VisionProperties();
        renderer = mock(ChartRenderer.class);
        service = new HealthCheckService(twitter, vision, renderer);
    }

    private HealthStatus component(List<HealthStatus> checks, String name) {
        return checks.stream().filter(c -> c.component().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reports feed, vision and renderer in that order")
    void components() {
        assertEquals(List.of("feed", "vision", "renderer"),
                service.checkAll().stream().map(HealthStatus::component).toList());
    }

    @Test
    @DisplayName("missing credentials and key are DOWN, idle renderer is UP")
    void unconfigured() {
        var checks = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(checks, "feed").status());
        assertEquals(HealthStatus.Status.DOWN, component(checks, "vision").status());
        assertEquals(HealthStatus.Status.UP, component(checks, "renderer").status());
        assertTrue(component(checks, "renderer").detail().startsWith("Idle"));
    }

    @Test
    @DisplayName("configured credentials and key are UP")
    void configured() {
        twitter.setApiKey("k");
        twitter.setApiSecret("s");
        twitter.setAccessToken("t");
        twitter.setAccessSecret("ts");
        vision.setApiKey("g");

        var checks = service.checkAll();

        assertEquals(HealthStatus.Status.UP, component(checks, "feed").status());
        assertEquals(HealthStatus.Status.UP, component(checks, "vision").status());
        assertEquals("gemini-2.0-flash", component(checks, "vision").metadata().get("model"));
    }

    @Test
    @DisplayName("a started but disconnected renderer is DEGRADED")
    void disconnectedRenderer() {
        when(renderer.isStarted()).thenReturn(true);
        when(renderer.isConnected()).thenReturn(false);

        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "renderer").status());
    }
}
