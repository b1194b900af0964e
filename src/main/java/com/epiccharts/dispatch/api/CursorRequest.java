package com.epiccharts.dispatch.api;

/**
 * Body of {@code PUT /api/v1/bot/cursor}.
 */
public record CursorRequest(String sinceId) {}
