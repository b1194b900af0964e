package com.epiccharts.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One named row of numbers in a chart, aligned index-by-index with {@link ChartData#labels()}.
 */
public record DataSeries(
    String name,
    List<Double> values
) implements Serializable {

    public DataSeries {
        values = List.copyOf(values);
    }
}
