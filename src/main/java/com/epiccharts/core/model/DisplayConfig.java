package com.epiccharts.core.model;

import java.io.Serializable;

/**
 * How a {@link ChartData} is drawn.
 */
public record DisplayConfig(
    ChartType chartType,
    ColorScheme colorScheme,
    StyleVariant styleVariant,
    boolean showGrid,
    boolean showLegend,
    boolean showValues,
    boolean animate,
    String title
) implements Serializable {

    /**
     * Derives the fixed configuration the bot uses for a reply: the model's suggested type
     * (clamped to {@link ChartType}), a legend only for multi-series data, no animation.
     */
    public static DisplayConfig defaultsFor(ChartData data) {
        return new DisplayConfig(
                ChartType.fromSuggestion(data.suggestedType()),
                ColorScheme.DEFAULT,
                StyleVariant.PROFESSIONAL,
                true,
                data.isMultiSeries(),
                false,
                false,
                data.suggestedTitle() != null ? data.suggestedTitle() : ""
        );
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
