package com.epiccharts.core.model;

import java.util.List;

/**
 * Series colour palettes. Colours are cycled when a chart has more series (or pie slices)
 * than the palette has entries.
 */
public enum ColorScheme {
    DEFAULT(List.of("#3b82f6", "#8b5cf6", "#06b6d4", "#10b981", "#f59e0b", "#ec4899")),
    MONOCHROME(List.of("#fafafa", "#a1a1aa", "#71717a", "#52525b", "#3f3f46", "#27272a")),
    WARM(List.of("#f97316", "#ef4444", "#eab308", "#f59e0b", "#dc2626", "#ca8a04")),
    COOL(List.of("#3b82f6", "#6366f1", "#06b6d4", "#0ea5e9", "#8b5cf6", "#14b8a6")),
    EDITORIAL(List.of("#1e3a5f", "#c9a227", "#7c3238", "#2d5a3c", "#5c4033", "#4a4a4a")),
    MUTED(List.of("#64748b", "#78716c", "#71717a", "#6b7280", "#737373", "#525252"));

    private final List<String> colors;

    ColorScheme(List<String> colors) {
        this.colors = colors;
    }

    public List<String> colors() {
        return colors;
    }

    public String colorAt(int index) {
        return colors.get(Math.floorMod(index, colors.size()));
    }
}
