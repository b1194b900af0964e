package com.epiccharts.core.metrics;

import com.epiccharts.core.model.MentionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the mention pipeline.
 */
@Service
public class ChartBotMetrics {

    private final MeterRegistry registry;

    public ChartBotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPollCycle(boolean succeeded) {
        Counter.builder("epiccharts.poll.cycles")
                .tag("result", succeeded ? "ok" : "failed")
                .register(registry)
                .increment();
    }

    public void recordMentionsFound(int count) {
        Counter.builder("epiccharts.mentions.found")
                .description("Mentions that passed the allow-list, trigger and reply filters")
                .register(registry)
                .increment(count);
    }

    public void recordOutcome(MentionOutcome outcome) {
        Counter.builder("epiccharts.mentions.outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordStage(String stage, long ms) {
        Timer.builder("epiccharts.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts extractions that had to download the image because the URL attempt failed.
     */
    public void recordExtractionFallback() {
        Counter.builder("epiccharts.extraction.fallbacks")
                .register(registry)
                .increment();
    }
}
