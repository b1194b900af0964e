package com.epiccharts.core.model;

/**
 * Visual style presets applied on top of a colour scheme.
 */
public enum StyleVariant {
    PROFESSIONAL("Inter", 4, 0, 2.0, 4, GridStyle.DASHED, 0.06),
    PLAYFUL("Nunito", 20, 20, 3.0, 6, GridStyle.DOTTED, 0.08),
    EDITORIAL("Instrument Serif", 0, 0, 1.5, 0, GridStyle.SOLID, 0.04),
    MINIMALIST("DM Sans", 2, 0, 1.5, 0, GridStyle.NONE, 0.0),
    BOLD("Sora", 8, 0, 4.0, 8, GridStyle.DASHED, 0.1);

    public enum GridStyle { SOLID, DASHED, DOTTED, NONE }

    private final String fontFamily;
    private final int barTopRadius;
    private final int barBottomRadius;
    private final double strokeWidth;
    private final int dotRadius;
    private final GridStyle gridStyle;
    private final double gridOpacity;

    StyleVariant(String fontFamily, int barTopRadius, int barBottomRadius, double strokeWidth,
                 int dotRadius, GridStyle gridStyle, double gridOpacity) {
        this.fontFamily = fontFamily;
        this.barTopRadius = barTopRadius;
        this.barBottomRadius = barBottomRadius;
        this.strokeWidth = strokeWidth;
        this.dotRadius = dotRadius;
        this.gridStyle = gridStyle;
        this.gridOpacity = gridOpacity;
    }

    public String fontFamily() { return fontFamily; }
    public int barTopRadius() { return barTopRadius; }
    public int barBottomRadius() { return barBottomRadius; }
    public double strokeWidth() { return strokeWidth; }
    public int dotRadius() { return dotRadius; }
    public GridStyle gridStyle() { return gridStyle; }
    public double gridOpacity() { return gridOpacity; }
}
