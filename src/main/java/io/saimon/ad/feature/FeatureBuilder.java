/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import io.saimon.ad.model.MetricSeries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Turns a metric series into a feature matrix: the raw value, then a rolling mean and a rolling
 * standard deviation per configured window.
 *
 * Rolling statistics use a minimum period of 1, so a row always has a value even before a full
 * window has accumulated. The standard deviation is the sample deviation (n - 1 denominator) and
 * is 0 while fewer than two points are in the window. Every configured window yields its two
 * columns whatever the series length, which keeps training and inference matrices the same shape.
 */
public class FeatureBuilder {
    public static final String VALUE_COLUMN_NAME = "value";
    public static final String ROLLING_MEAN_PREFIX = "rolling_mean_";
    public static final String ROLLING_STD_PREFIX = "rolling_std_";

    private final List<Integer> rollingWindows;
    private final List<String> columnNames;

    public FeatureBuilder(List<Integer> rollingWindows) {
        for (Integer window : rollingWindows) {
            Preconditions.checkArgument(window != null && window > 0, "rolling window must be positive: %s", window);
        }
        this.rollingWindows = ImmutableList.copyOf(rollingWindows);
        List<String> names = new ArrayList<>();
        names.add(VALUE_COLUMN_NAME);
        for (int window : this.rollingWindows) {
            names.add(ROLLING_MEAN_PREFIX + window);
            names.add(ROLLING_STD_PREFIX + window);
        }
        this.columnNames = ImmutableList.copyOf(names);
    }

    public int getFeatureCount() {
        return columnNames.size();
    }

    /**
     * Builds the feature matrix of a series.
     *
     * @param series metric series
     * @return the matrix, or empty when the series has no points
     */
    public Optional<FeatureMatrix> build(MetricSeries series) {
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        double[] values = series.getValues();
        int length = values.length;
        double[][] rows = new double[length][columnNames.size()];
        for (int i = 0; i < length; i++) {
            rows[i][FeatureMatrix.VALUE_COLUMN] = values[i];
        }
        int column = 1;
        for (int window : rollingWindows) {
            double[] mean = rollingMean(values, window);
            double[] std = rollingStd(values, window);
            for (int i = 0; i < length; i++) {
                rows[i][column] = mean[i];
                rows[i][column + 1] = std[i];
            }
            column += 2;
        }
        return Optional.of(new FeatureMatrix(rows, columnNames));
    }

    static double[] rollingMean(double[] values, int window) {
        double[] result = new double[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            int count = Math.min(i + 1, window);
            result[i] = sum / count;
        }
        return result;
    }

    // sample std, 0 for a single point
    static double[] rollingStd(double[] values, int window) {
        StandardDeviation std = new StandardDeviation(true);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - window + 1);
            result[i] = std.evaluate(values, start, i - start + 1);
        }
        return result;
    }
}
