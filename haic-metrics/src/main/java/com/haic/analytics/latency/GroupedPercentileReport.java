package com.haic.analytics.latency;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Chart-ready percentile matrix across session groups. {@code data} is series-major:
 * {@code data.get(series).get(label)}.
 */
@JsonPropertyOrder({"labels", "series", "data", "counts", "sla", "group_key"})
public final class GroupedPercentileReport {
    @JsonProperty("labels")
    public final List<String> labels;
    @JsonProperty("series")
    public final List<String> series;
    @JsonProperty("data")
    public final List<List<Double>> data;
    @JsonProperty("counts")
    public final Map<String, Integer> counts;
    @JsonProperty("sla")
    public final double sla;
    @JsonProperty("group_key")
    public final String groupKey;

    GroupedPercentileReport(List<String> labels, List<String> series, List<List<Double>> data,
            Map<String, Integer> counts, double sla, String groupKey) {
        this.labels = Collections.unmodifiableList(labels);
        this.series = Collections.unmodifiableList(series);
        this.data = Collections.unmodifiableList(data);
        this.counts = Collections.unmodifiableMap(counts);
        this.sla = sla;
        this.groupKey = groupKey;
    }

    public Double value(String seriesName, String label) {
        int s = series.indexOf(seriesName);
        int l = labels.indexOf(label);
        if (s < 0 || l < 0) {
            return null;
        }
        return data.get(s).get(l);
    }
}
