package com.epiccharts.core.render;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.ChartType;
import com.epiccharts.core.model.ColorScheme;
import com.epiccharts.core.model.DataSeries;
import com.epiccharts.core.model.DisplayConfig;
import com.epiccharts.core.model.StyleVariant;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Serializes a chart into a self-contained HTML document with an inline SVG drawing.
 * <p>
 * The document has no external resources, so it settles as soon as it is parsed. Layout
 * mirrors the web app's dark card: a gradient background, 40px padding, optional title,
 * and the plot below it.
 */
public class ChartMarkupBuilder {

    private static final int PADDING = 40;
    private static final int TITLE_BLOCK = 44;
    private static final int LEGEND_BLOCK = 32;
    private static final int AXIS_LEFT = 56;
    private static final int AXIS_BOTTOM = 32;
    private static final int PLOT_TOP = 10;
    private static final int PLOT_RIGHT = 16;
    private static final int TICK_COUNT = 5;

    private static final String AXIS_COLOR = "#444";
    private static final String TICK_COLOR = "#888";
    private static final String GRID_COLOR = "rgba(255,255,255,0.1)";

    private final int width;
    private final int height;

    public ChartMarkupBuilder(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public String build(ChartData data, DisplayConfig config) {
        int chartWidth = width - 2 * PADDING;
        int chartHeight = height - 2 * PADDING - (config.hasTitle() ? TITLE_BLOCK : 0);
        String font = fontStack(config.styleVariant());

        var html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<style>\n")
                .append("* { margin: 0; padding: 0; box-sizing: border-box; }\n")
                .append("body { background: #0f0f0f; font-family: ").append(font).append("; }\n")
                .append("</style>\n</head>\n<body>\n");
        html.append("<div id=\"root\" style=\"width: ").append(width).append("px; height: ").append(height)
                .append("px; background: linear-gradient(135deg, #0f0f0f 0%, #1a1a2e 50%, #16213e 100%); padding: ")
                .append(PADDING).append("px;\">\n");
        if (config.hasTitle()) {
            html.append("<h2 style=\"color: #ffffff; font-size: 24px; font-weight: 600; margin-bottom: 20px; ")
                    .append("text-align: center;\">").append(escape(config.title())).append("</h2>\n");
        }
        html.append(svg(data, config, chartWidth, chartHeight, font));
        html.append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    String svg(ChartData data, DisplayConfig config, int w, int h, String font) {
        var svg = new StringBuilder();
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(w)
                .append("\" height=\"").append(h).append("\" viewBox=\"0 0 ").append(w).append(' ').append(h)
                .append("\" font-family=\"").append(escape(font)).append("\" font-size=\"12\">\n");

        int plotHeight = h - (config.showLegend() ? LEGEND_BLOCK : 0);
        switch (config.chartType()) {
            case PIE -> pie(svg, data, config, w, plotHeight);
            case RADAR -> radar(svg, data, config, w, plotHeight);
            default -> cartesian(svg, data, config, w, plotHeight);
        }
        if (config.showLegend()) {
            legend(svg, legendNames(data, config), config.colorScheme(), w, h);
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    private void cartesian(StringBuilder svg, ChartData data, DisplayConfig config, int w, int h) {
        var plot = new Plot(AXIS_LEFT, PLOT_TOP, w - AXIS_LEFT - PLOT_RIGHT, h - PLOT_TOP - AXIS_BOTTOM);
        var scale = Scale.of(data.series());
        int n = data.labels().size();
        double band = plot.width / (double) Math.max(n, 1);
        StyleVariant style = config.styleVariant();

        if (config.showGrid() && style.gridStyle() != StyleVariant.GridStyle.NONE) {
            String dash = dashArray(style.gridStyle());
            for (double tick : scale.ticks()) {
                double y = plot.y(scale.fraction(tick));
                line(svg, plot.left, y, plot.right(), y, GRID_COLOR, 1, dash);
            }
            for (int i = 0; i <= n; i++) {
                double x = plot.left + i * band;
                line(svg, x, plot.top, x, plot.bottom(), GRID_COLOR, 1, dash);
            }
        }

        line(svg, plot.left, plot.bottom(), plot.right(), plot.bottom(), AXIS_COLOR, 1, null);
        line(svg, plot.left, plot.top, plot.left, plot.bottom(), AXIS_COLOR, 1, null);
        for (double tick : scale.ticks()) {
            double y = plot.y(scale.fraction(tick));
            text(svg, plot.left - 8, y + 4, "end", TICK_COLOR, formatValue(tick));
        }
        for (int i = 0; i < n; i++) {
            double x = plot.left + band * (i + 0.5);
            text(svg, x, plot.bottom() + 20, "middle", TICK_COLOR, data.labels().get(i));
        }

        switch (config.chartType()) {
            case LINE -> lines(svg, data, config, plot, scale, band, false);
            case AREA -> lines(svg, data, config, plot, scale, band, true);
            case SCATTER -> scatter(svg, data, config, plot, scale);
            default -> bars(svg, data, config, plot, scale, band);
        }
    }

    private void bars(StringBuilder svg, ChartData data, DisplayConfig config, Plot plot, Scale scale, double band) {
        int seriesCount = data.series().size();
        double groupWidth = band * 0.8;
        double barWidth = groupWidth / seriesCount;
        double zeroY = plot.y(scale.fraction(0));
        int radius = config.styleVariant().barTopRadius();

        for (int s = 0; s < seriesCount; s++) {
            DataSeries series = data.series().get(s);
            String color = config.colorScheme().colorAt(s);
            for (int i = 0; i < series.values().size(); i++) {
                double value = series.values().get(i);
                double x = plot.left + band * i + (band - groupWidth) / 2 + barWidth * s;
                double y = plot.y(scale.fraction(value));
                double top = Math.min(y, zeroY);
                double barHeight = Math.abs(zeroY - y);
                double r = value > 0 ? Math.min(radius, Math.min(barWidth / 2, barHeight)) : 0;
                svg.append("<path d=\"M").append(fmt(x)).append(',').append(fmt(top + barHeight))
                        .append(" L").append(fmt(x)).append(',').append(fmt(top + r))
                        .append(" Q").append(fmt(x)).append(',').append(fmt(top)).append(' ')
                        .append(fmt(x + r)).append(',').append(fmt(top))
                        .append(" L").append(fmt(x + barWidth - r)).append(',').append(fmt(top))
                        .append(" Q").append(fmt(x + barWidth)).append(',').append(fmt(top)).append(' ')
                        .append(fmt(x + barWidth)).append(',').append(fmt(top + r))
                        .append(" L").append(fmt(x + barWidth)).append(',').append(fmt(top + barHeight))
                        .append(" Z\" fill=\"").append(color).append("\"/>\n");
                if (config.showValues()) {
                    text(svg, x + barWidth / 2, top - 4, "middle", "#ccc", formatValue(value));
                }
            }
        }
    }

    private void lines(StringBuilder svg, ChartData data, DisplayConfig config, Plot plot, Scale scale,
                       double band, boolean filled) {
        StyleVariant style = config.styleVariant();
        double zeroY = plot.y(scale.fraction(Math.max(scale.min, Math.min(0, scale.max))));
        for (int s = 0; s < data.series().size(); s++) {
            DataSeries series = data.series().get(s);
            String color = config.colorScheme().colorAt(s);
            var points = new StringBuilder();
            for (int i = 0; i < series.values().size(); i++) {
                double x = plot.left + band * (i + 0.5);
                double y = plot.y(scale.fraction(series.values().get(i)));
                if (i > 0) points.append(' ');
                points.append(fmt(x)).append(',').append(fmt(y));
            }
            if (filled && !series.values().isEmpty()) {
                double firstX = plot.left + band * 0.5;
                double lastX = plot.left + band * (series.values().size() - 0.5);
                svg.append("<polygon points=\"").append(fmt(firstX)).append(',').append(fmt(zeroY)).append(' ')
                        .append(points).append(' ').append(fmt(lastX)).append(',').append(fmt(zeroY))
                        .append("\" fill=\"").append(color).append("\" fill-opacity=\"0.3\" stroke=\"none\"/>\n");
            }
            svg.append("<polyline points=\"").append(points).append("\" fill=\"none\" stroke=\"").append(color)
                    .append("\" stroke-width=\"").append(fmt(style.strokeWidth()))
                    .append("\" stroke-linejoin=\"round\"/>\n");
            if (!filled && style.dotRadius() > 0) {
                for (int i = 0; i < series.values().size(); i++) {
                    double x = plot.left + band * (i + 0.5);
                    double y = plot.y(scale.fraction(series.values().get(i)));
                    circle(svg, x, y, style.dotRadius(), color, 1.0);
                }
            }
            if (config.showValues()) {
                for (int i = 0; i < series.values().size(); i++) {
                    double value = series.values().get(i);
                    text(svg, plot.left + band * (i + 0.5), plot.y(scale.fraction(value)) - 8,
                            "middle", "#ccc", formatValue(value));
                }
            }
        }
    }

    private void scatter(StringBuilder svg, ChartData data, DisplayConfig config, Plot plot, Scale scale) {
        int n = data.labels().size();
        for (int s = 0; s < data.series().size(); s++) {
            DataSeries series = data.series().get(s);
            String color = config.colorScheme().colorAt(s);
            for (int i = 0; i < series.values().size(); i++) {
                double fx = n <= 1 ? 0.5 : i / (double) (n - 1);
                double x = plot.left + 12 + fx * (plot.width - 24);
                double y = plot.y(scale.fraction(series.values().get(i)));
                circle(svg, x, y, 5, color, 1.0);
            }
        }
    }

    private void pie(StringBuilder svg, ChartData data, DisplayConfig config, int w, int h) {
        List<Double> values = data.series().isEmpty() ? List.of() : data.series().get(0).values();
        double total = 0;
        for (double v : values) total += Math.max(0, v);

        double cx = w / 2.0;
        double cy = h / 2.0;
        double outer = Math.min(120, Math.min(w, h) / 2.0 - 30);
        double inner = outer / 2;
        if (total <= 0) {
            circle(svg, cx, cy, outer, AXIS_COLOR, 0.5);
            return;
        }

        double padding = Math.toRadians(2);
        double angle = -Math.PI / 2;
        for (int i = 0; i < values.size(); i++) {
            double value = Math.max(0, values.get(i));
            if (value == 0) continue;
            double sweep = value / total * 2 * Math.PI;
            double pad = sweep > padding * 2 ? padding / 2 : 0;
            double start = angle + pad;
            double end = angle + sweep - pad;
            int large = end - start > Math.PI ? 1 : 0;
            svg.append("<path d=\"M").append(fmt(cx + outer * Math.cos(start))).append(',')
                    .append(fmt(cy + outer * Math.sin(start)))
                    .append(" A").append(fmt(outer)).append(',').append(fmt(outer)).append(" 0 ").append(large)
                    .append(",1 ").append(fmt(cx + outer * Math.cos(end))).append(',')
                    .append(fmt(cy + outer * Math.sin(end)))
                    .append(" L").append(fmt(cx + inner * Math.cos(end))).append(',')
                    .append(fmt(cy + inner * Math.sin(end)))
                    .append(" A").append(fmt(inner)).append(',').append(fmt(inner)).append(" 0 ").append(large)
                    .append(",0 ").append(fmt(cx + inner * Math.cos(start))).append(',')
                    .append(fmt(cy + inner * Math.sin(start)))
                    .append(" Z\" fill=\"").append(config.colorScheme().colorAt(i)).append("\"/>\n");
            if (config.showValues()) {
                double mid = angle + sweep / 2;
                double lx = cx + (outer + 18) * Math.cos(mid);
                double ly = cy + (outer + 18) * Math.sin(mid);
                String anchor = Math.cos(mid) >= 0 ? "start" : "end";
                String label = data.labels().get(i) + " (" + Math.round(value / total * 100) + "%)";
                text(svg, lx, ly, anchor, "#ccc", label);
            }
            angle += sweep;
        }
    }

    private void radar(StringBuilder svg, ChartData data, DisplayConfig config, int w, int h) {
        int n = data.labels().size();
        double cx = w / 2.0;
        double cy = h / 2.0;
        double radius = Math.min(w, h) / 2.0 * 0.7;
        double max = 0;
        for (DataSeries s : data.series()) {
            for (double v : s.values()) max = Math.max(max, v);
        }
        if (max <= 0) max = 1;

        for (int level = 1; level <= TICK_COUNT; level++) {
            double r = radius * level / TICK_COUNT;
            svg.append("<polygon points=\"").append(radarPoints(n, cx, cy, i -> r))
                    .append("\" fill=\"none\" stroke=\"rgba(255,255,255,0.2)\"/>\n");
        }
        for (int i = 0; i < n; i++) {
            double a = radarAngle(i, n);
            line(svg, cx, cy, cx + radius * Math.cos(a), cy + radius * Math.sin(a), "rgba(255,255,255,0.2)", 1, null);
            double lx = cx + (radius + 16) * Math.cos(a);
            double ly = cy + (radius + 16) * Math.sin(a) + 4;
            String anchor = Math.abs(Math.cos(a)) < 0.1 ? "middle" : (Math.cos(a) > 0 ? "start" : "end");
            text(svg, lx, ly, anchor, "#aaa", data.labels().get(i));
        }

        final double scaleMax = max;
        for (int s = 0; s < data.series().size(); s++) {
            List<Double> values = data.series().get(s).values();
            String color = config.colorScheme().colorAt(s);
            svg.append("<polygon points=\"")
                    .append(radarPoints(n, cx, cy, i -> radius * Math.max(0, values.get(i)) / scaleMax))
                    .append("\" fill=\"").append(color).append("\" fill-opacity=\"0.3\" stroke=\"").append(color)
                    .append("\" stroke-width=\"").append(fmt(config.styleVariant().strokeWidth())).append("\"/>\n");
        }
    }

    private void legend(StringBuilder svg, List<String> names, ColorScheme scheme, int w, int h) {
        double itemWidth = 0;
        var widths = new ArrayList<Double>();
        for (String name : names) {
            double iw = 18 + name.length() * 7.0 + 16;
            widths.add(iw);
            itemWidth += iw;
        }
        double x = Math.max(0, (w - itemWidth) / 2);
        double y = h - LEGEND_BLOCK / 2.0;
        for (int i = 0; i < names.size(); i++) {
            svg.append("<rect x=\"").append(fmt(x)).append("\" y=\"").append(fmt(y - 5))
                    .append("\" width=\"10\" height=\"10\" rx=\"2\" fill=\"").append(scheme.colorAt(i)).append("\"/>\n");
            text(svg, x + 16, y + 4, "start", "#aaa", names.get(i));
            x += widths.get(i);
        }
    }

    private static List<String> legendNames(ChartData data, DisplayConfig config) {
        if (config.chartType() == ChartType.PIE) {
            return data.labels();
        }
        var names = new ArrayList<String>();
        for (DataSeries s : data.series()) names.add(s.name());
        return names;
    }

    private static String radarPoints(int n, double cx, double cy, java.util.function.IntToDoubleFunction radiusAt) {
        var points = new StringBuilder();
        for (int i = 0; i < n; i++) {
            double a = radarAngle(i, n);
            double r = radiusAt.applyAsDouble(i);
            if (i > 0) points.append(' ');
            points.append(fmt(cx + r * Math.cos(a))).append(',').append(fmt(cy + r * Math.sin(a)));
        }
        return points.toString();
    }

    private static double radarAngle(int i, int n) {
        return -Math.PI / 2 + 2 * Math.PI * i / Math.max(n, 1);
    }

    private static void line(StringBuilder svg, double x1, double y1, double x2, double y2,
                             String color, double width, String dash) {
        svg.append("<line x1=\"").append(fmt(x1)).append("\" y1=\"").append(fmt(y1))
                .append("\" x2=\"").append(fmt(x2)).append("\" y2=\"").append(fmt(y2))
                .append("\" stroke=\"").append(color).append("\" stroke-width=\"").append(fmt(width)).append('"');
        if (dash != null) {
            svg.append(" stroke-dasharray=\"").append(dash).append('"');
        }
        svg.append("/>\n");
    }

    private static void circle(StringBuilder svg, double cx, double cy, double r, String fill, double opacity) {
        svg.append("<circle cx=\"").append(fmt(cx)).append("\" cy=\"").append(fmt(cy)).append("\" r=\"").append(fmt(r))
                .append("\" fill=\"").append(fill).append("\" fill-opacity=\"").append(fmt(opacity)).append("\"/>\n");
    }

    private static void text(StringBuilder svg, double x, double y, String anchor, String color, String content) {
        svg.append("<text x=\"").append(fmt(x)).append("\" y=\"").append(fmt(y))
                .append("\" text-anchor=\"").append(anchor).append("\" fill=\"").append(color).append("\">")
                .append(escape(content)).append("</text>\n");
    }

    private static String dashArray(StyleVariant.GridStyle style) {
        return switch (style) {
            case DASHED -> "3 3";
            case DOTTED -> "1 3";
            default -> null;
        };
    }

    private static String fontStack(StyleVariant variant) {
        return "'" + variant.fontFamily() + "', -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif";
    }

    static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value).replaceAll("0+$", "").replaceAll("\\.$", "");
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value == null ? "" : value);
    }

    private record Plot(double left, double top, double width, double height) {
        double right() { return left + width; }
        double bottom() { return top + height; }
        double y(double fraction) { return bottom() - fraction * height; }
    }

    /**
     * Linear value axis with "nice" tick steps (1, 2, 5 x 10^n) that always includes zero.
     */
    record Scale(double min, double max, double step) {

        static Scale of(List<DataSeries> series) {
            double lo = 0;
            double hi = 0;
            for (DataSeries s : series) {
                for (double v : s.values()) {
                    lo = Math.min(lo, v);
                    hi = Math.max(hi, v);
                }
            }
            if (hi == lo) {
                hi = lo + 1;
            }
            double step = niceStep((hi - lo) / TICK_COUNT);
            return new Scale(Math.floor(lo / step) * step, Math.ceil(hi / step) * step, step);
        }

        static double niceStep(double raw) {
            double magnitude = Math.pow(10, Math.floor(Math.log10(raw)));
            double residual = raw / magnitude;
            double nice = residual <= 1 ? 1 : residual <= 2 ? 2 : residual <= 5 ? 5 : 10;
            return nice * magnitude;
        }

        double fraction(double value) {
            return (value - min) / (max - min);
        }

        List<Double> ticks() {
            var ticks = new ArrayList<Double>();
            for (double t = min; t <= max + step / 2; t += step) {
                ticks.add(Math.abs(t) < step / 1e6 ? 0.0 : t);
            }
            return ticks;
        }
    }
}
