package io.tiller.core.chart;

import java.util.Objects;

/// A template file of a chart.
///
/// @param name path of the template within the chart, not null
/// @param data template content, not null
public record ChartTemplate(String name, String data) {

    public ChartTemplate {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }
}
