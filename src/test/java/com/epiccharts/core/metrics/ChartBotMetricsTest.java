package com.epiccharts.core.metrics;

import com.epiccharts.core.model.MentionOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChartBotMetricsTest {

    private SimpleMeterRegistry registry;
    private ChartBotMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ChartBotMetrics(registry);
    }

    @Test
    @DisplayName("recordPollCycle counts by result tag")
    void pollCycles() {
        metrics.recordPollCycle(true);
        metrics.recordPollCycle(true);
        metrics.recordPollCycle(false);

        assertEquals(2.0, registry.find("epiccharts.poll.cycles").tag("result", "ok").counter().count());
        assertEquals(1.0, registry.find("epiccharts.poll.cycles").tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("recordMentionsFound adds the batch size")
    void mentionsFound() {
        metrics.recordMentionsFound(3);
        metrics.recordMentionsFound(0);

        assertEquals(3.0, registry.find("epiccharts.mentions.found").counter().count());
    }

    @Test
    @DisplayName("recordOutcome tags with the lower-case outcome")
    void outcomes() {
        metrics.recordOutcome(MentionOutcome.SILENT_FAILURE);

        var counter = registry.find("epiccharts.mentions.outcome").tag("outcome", "silent_failure").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordStage records a timer per stage")
    void stages() {
        metrics.recordStage("render", 1500);
        metrics.recordStage("upload", 200);

        var render = registry.find("epiccharts.stage.duration").tag("stage", "render").timer();
        assertNotNull(render);
        assertEquals(1, render.count());
        assertEquals(1500.0, render.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordExtractionFallback increments")
    void fallbacks() {
        metrics.recordExtractionFallback();
        assertEquals(1.0, registry.find("epiccharts.extraction.fallbacks").counter().count());
    }
}
