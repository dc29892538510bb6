/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.dataprocessor;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import io.saimon.ad.constant.CommonMessages;

import com.google.common.base.Preconditions;

/**
 * Standardizes features to zero mean and unit variance per column.
 *
 * Uses the population variance. A column without variance is only centered.
 */
public class StandardScaler {
    private double[] mean;
    private double[] scale;

    // for Gson
    StandardScaler() {}

    private StandardScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    /**
     * Learns the per-column mean and standard deviation.
     *
     * @param data training rows, at least one
     * @return fitted scaler
     */
    public static StandardScaler fit(double[][] data) {
        Preconditions.checkArgument(data.length > 0, CommonMessages.EMPTY_TRAINING_MATRIX);
        int dimensions = data[0].length;
        SummaryStatistics[] columns = new SummaryStatistics[dimensions];
        for (int j = 0; j < dimensions; j++) {
            columns[j] = new SummaryStatistics();
        }
        for (double[] row : data) {
            for (int j = 0; j < dimensions; j++) {
                columns[j].addValue(row[j]);
            }
        }
        double[] mean = new double[dimensions];
        double[] scale = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            mean[j] = columns[j].getMean();
            double std = Math.sqrt(columns[j].getPopulationVariance());
            scale[j] = std > 0 ? std : 1.0;
        }
        return new StandardScaler(mean, scale);
    }

    public double[] transform(double[] row) {
        Preconditions.checkArgument(row.length == mean.length, CommonMessages.getDimensionMismatchMsg(mean.length, row.length));
        double[] scaled = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            scaled[j] = (row[j] - mean[j]) / scale[j];
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }

    public int getDimensions() {
        return mean.length;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }
}
