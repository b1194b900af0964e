package com.epiccharts.core.model;

import java.util.Locale;

/**
 * Chart types the renderer can draw.
 */
public enum ChartType {
    BAR, LINE, AREA, PIE, RADAR, SCATTER;

    /**
     * Maps a model suggestion onto a renderable type. Anything unknown, blank, or not
     * drawable server-side ("table", "infographic") becomes {@link #BAR}.
     */
    public static ChartType fromSuggestion(String suggestion) {
        if (suggestion == null || suggestion.isBlank()) {
            return BAR;
        }
        try {
            return valueOf(suggestion.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BAR;
        }
    }
}
