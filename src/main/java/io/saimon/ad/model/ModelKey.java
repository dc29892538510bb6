/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.model;

import java.util.Locale;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Identifies one trained model: a metric and the algorithm fitted on it.
 */
public class ModelKey implements Comparable<ModelKey> {
    private static final String MODEL_ID_PATTERN = "%s_%s";

    private final String metricName;
    private final Algorithm algorithm;

    public ModelKey(String metricName, Algorithm algorithm) {
        Preconditions.checkArgument(metricName != null && !metricName.isEmpty(), "metric name should be set");
        this.metricName = metricName;
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm should be set");
    }

    public String getMetricName() {
        return metricName;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * Human readable id, used in log lines and as the checkpoint file stem. Never parsed back.
     *
     * @return model id
     */
    public String getModelId() {
        return String.format(Locale.ROOT, MODEL_ID_PATTERN, metricName, algorithm.getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ModelKey that = (ModelKey) o;
        return Objects.equals(metricName, that.metricName) && algorithm == that.algorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, algorithm);
    }

    @Override
    public int compareTo(ModelKey other) {
        int byMetric = metricName.compareTo(other.metricName);
        return byMetric != 0 ? byMetric : algorithm.compareTo(other.algorithm);
    }

    @Override
    public String toString() {
        return getModelId();
    }
}
