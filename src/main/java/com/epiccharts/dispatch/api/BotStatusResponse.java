package com.epiccharts.dispatch.api;

public record BotStatusResponse(
    boolean running,
    String cursor,
    int processedCount,
    long pollIntervalMs
) {}
