package com.epiccharts.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured chart content extracted from an image.
 * <p>
 * Every series holds exactly one value per label. Instances coming from the vision model
 * are checked against that before they are built, so a {@code ChartData} is always
 * well-formed once constructed.
 *
 * @param labels          category labels along the x axis
 * @param series          one or more named value rows
 * @param suggestedTitle  title proposed by the model (nullable)
 * @param suggestedType   chart type proposed by the model, as free text (nullable)
 */
public record ChartData(
    List<String> labels,
    List<DataSeries> series,
    String suggestedTitle,
    String suggestedType
) implements Serializable {

    public ChartData {
        labels = List.copyOf(labels);
        series = List.copyOf(series);
        for (DataSeries s : series) {
            if (s.values().size() != labels.size()) {
                throw new IllegalArgumentException("Series '" + s.name() + "' has " + s.values().size()
                        + " values for " + labels.size() + " labels");
            }
        }
    }

    public ChartData(List<String> labels, List<DataSeries> series) {
        this(labels, series, null, null);
    }

    public boolean isMultiSeries() {
        return series.size() > 1;
    }
}
