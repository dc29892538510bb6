/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.saimon.ad.constant.CommonMessages;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A time-ranged series of one metric as returned by the ingestion source.
 *
 * Timestamps are strictly increasing.
 */
public class MetricSeries {
    private final String metricName;
    private final List<DataPoint> points;
    private final Map<String, String> labels;

    public MetricSeries(String metricName, List<DataPoint> points, Map<String, String> labels) {
        this.metricName = Objects.requireNonNull(metricName, "metric name should be set");
        this.points = ImmutableList.copyOf(points);
        this.labels = labels == null ? Collections.emptyMap() : ImmutableMap.copyOf(labels);
        Instant previous = null;
        for (DataPoint point : this.points) {
            if (previous != null && !point.getTimestamp().isAfter(previous)) {
                throw new IllegalArgumentException(
                    CommonMessages.NON_INCREASING_TIMESTAMPS + ": " + metricName + " at " + point.getTimestamp()
                );
            }
            previous = point.getTimestamp();
        }
    }

    public MetricSeries(String metricName, List<DataPoint> points) {
        this(metricName, points, Collections.emptyMap());
    }

    public static MetricSeries empty(String metricName) {
        return new MetricSeries(metricName, Collections.emptyList());
    }

    public String getMetricName() {
        return metricName;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public DataPoint get(int index) {
        return points.get(index);
    }

    public double[] getValues() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        MetricSeries that = (MetricSeries) o;
        return Objects.equals(metricName, that.metricName) && Objects.equals(points, that.points) && Objects.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, points, labels);
    }
}
