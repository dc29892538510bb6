/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import io.saimon.ad.model.DataPoint;
import io.saimon.ad.model.MetricSeries;

public class TestHelpers {
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    public static final Instant NOW = Instant.parse("2024-01-08T00:00:00Z");
    public static final String METRIC = "node_cpu_usage";

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static MetricSeries seriesOf(String metricName, double... values) {
        return seriesOf(metricName, null, values);
    }

    public static MetricSeries seriesOf(String metricName, Map<String, String> labels, double... values) {
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(START.plus(Duration.ofMinutes(i)), values[i]));
        }
        return new MetricSeries(metricName, points, labels);
    }

    /**
     * Gaussian samples restricted to mean +- bound.
     */
    public static double[] truncatedNormal(int size, double mean, double std, double bound, long seed) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            double value;
            do {
                value = mean + std * random.nextGaussian();
            } while (Math.abs(value - mean) > bound);
            values[i] = value;
        }
        return values;
    }

    public static double[] normal(int size, double mean, double std, long seed) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = mean + std * random.nextGaussian();
        }
        return values;
    }

    /**
     * Rows drawn around the origin in every dimension.
     */
    public static double[][] gaussianRows(int rows, int columns, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                data[i][j] = random.nextGaussian();
            }
        }
        return data;
    }
}
