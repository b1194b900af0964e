package com.epiccharts.core.render;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.ChartType;
import com.epiccharts.core.model.ColorScheme;
import com.epiccharts.core.model.DataSeries;
import com.epiccharts.core.model.DisplayConfig;
import com.epiccharts.core.model.StyleVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChartMarkupBuilderTest {

    private final ChartMarkupBuilder builder = new ChartMarkupBuilder(800, 600);

    private final ChartData twoSeries = new ChartData(List.of("Q1", "Q2", "Q3"), List.of(
            new DataSeries("Revenue", List.of(10.0, 20.0, 15.0)),
            new DataSeries("Costs", List.of(5.0, 8.0, 12.0))), "Quarterly", "bar");

    private DisplayConfig config(ChartType type, boolean legend, String title) {
        return new DisplayConfig(type, ColorScheme.DEFAULT, StyleVariant.PROFESSIONAL,
                true, legend, false, false, title);
    }

    @ParameterizedTest
    @EnumSource(ChartType.class)
    @DisplayName("every chart type produces a complete document on the gradient canvas")
    void everyType(ChartType type) {
        String html = builder.build(twoSeries, config(type, true, "Quarterly"));

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("width: 800px; height: 600px"));
        assertTrue(html.contains("linear-gradient(135deg, #0f0f0f 0%, #1a1a2e 50%, #16213e 100%)"));
        assertTrue(html.contains("<svg"));
        assertTrue(html.contains("</svg>"));
        assertTrue(html.contains(ColorScheme.DEFAULT.colorAt(0)));
        assertFalse(html.contains("NaN"), "no NaN coordinates for " + type);
    }

    @Test
    @DisplayName("title and legend appear only when configured")
    void titleAndLegend() {
        String with = builder.build(twoSeries, config(ChartType.BAR, true, "Quarterly"));
        assertTrue(with.contains(">Quarterly</h2>"));
        assertTrue(with.contains(">Revenue</text>"));
        assertTrue(with.contains(">Costs</text>"));

        String without = builder.build(twoSeries, config(ChartType.BAR, false, ""));
        assertFalse(without.contains("<h2"));
        assertFalse(without.contains(">Costs</text>"));
    }

    @Test
    @DisplayName("labels and titles are HTML-escaped")
    void escapes() {
        var data = new ChartData(List.of("<b>A&B</b>"), List.of(new DataSeries("S", List.of(1.0))));
        String html = builder.build(data, config(ChartType.BAR, false, "Profit & <Loss>"));

        assertTrue(html.contains("Profit &amp; &lt;Loss&gt;"));
        assertTrue(html.contains("&lt;b&gt;A&amp;B&lt;/b&gt;"));
        assertFalse(html.contains("<b>"));
    }

    @Test
    @DisplayName("grid uses the dashed style of the professional preset")
    void dashedGrid() {
        String html = builder.build(twoSeries, config(ChartType.LINE, false, ""));
        assertTrue(html.contains("stroke-dasharray=\"3 3\""));
        assertTrue(html.contains("rgba(255,255,255,0.1)"));
    }

    @Test
    @DisplayName("grid can be turned off")
    void noGrid() {
        var config = new DisplayConfig(ChartType.BAR, ColorScheme.WARM, StyleVariant.PROFESSIONAL,
                false, false, false, false, "");
        String html = builder.build(twoSeries, config);
        assertFalse(html.contains("stroke-dasharray"));
        assertTrue(html.contains(ColorScheme.WARM.colorAt(0)));
    }

    @Test
    @DisplayName("pie legend lists categories and values show percentages")
    void pieLabels() {
        var data = new ChartData(List.of("Yes", "No"), List.of(new DataSeries("Votes", List.of(75.0, 25.0))));
        var config = new DisplayConfig(ChartType.PIE, ColorScheme.DEFAULT, StyleVariant.PROFESSIONAL,
                false, true, true, false, "");
        String html = builder.build(data, config);
        assertTrue(html.contains("Yes (75%)"));
        assertTrue(html.contains(">No</text>"));
    }

    @Test
    @DisplayName("all-zero and negative data still render finite coordinates")
    void degenerateData() {
        var zeros = new ChartData(List.of("A", "B"), List.of(new DataSeries("S", List.of(0.0, 0.0))));
        var negative = new ChartData(List.of("A", "B"), List.of(new DataSeries("S", List.of(-27.0, 12.5))));
        for (ChartType type : ChartType.values()) {
            assertFalse(builder.build(zeros, config(type, false, "")).contains("NaN"), type.name());
            assertFalse(builder.build(negative, config(type, false, "")).contains("Infinity"), type.name());
        }
    }

    @Test
    @DisplayName("axis scale uses nice steps that include zero")
    void niceScale() {
        var scale = ChartMarkupBuilder.Scale.of(List.of(new DataSeries("S", List.of(3.0, 47.0))));
        assertEquals(0.0, scale.min());
        assertEquals(50.0, scale.max());
        assertEquals(10.0, scale.step());
        assertEquals(List.of(0.0, 10.0, 20.0, 30.0, 40.0, 50.0), scale.ticks());
    }

    @Test
    @DisplayName("formatValue drops trailing zeros")
    void formatValue() {
        assertEquals("20", ChartMarkupBuilder.formatValue(20.0));
        assertEquals("-27", ChartMarkupBuilder.formatValue(-27.0));
        assertEquals("2.5", ChartMarkupBuilder.formatValue(2.5));
        assertEquals("0.33", ChartMarkupBuilder.formatValue(1.0 / 3));
    }
}
