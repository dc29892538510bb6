/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.collect.ImmutableMap;

/**
 * A point flagged by one algorithm. Immutable; handed to the anomaly sink and then dropped.
 */
public class AnomalyRecord {
    private final String metricName;
    private final Instant timestamp;
    private final double value;
    // only the z-score family knows what the point should have been
    private final Double expectedValue;
    private final double rawScore;
    private final double normalizedScore;
    private final Severity severity;
    private final Algorithm algorithm;
    private final Instant detectedAt;
    private final Map<String, String> labels;

    public AnomalyRecord(
        String metricName,
        Instant timestamp,
        double value,
        Double expectedValue,
        double rawScore,
        double normalizedScore,
        Severity severity,
        Algorithm algorithm,
        Instant detectedAt,
        Map<String, String> labels
    ) {
        this.metricName = metricName;
        this.timestamp = timestamp;
        this.value = value;
        this.expectedValue = expectedValue;
        this.rawScore = rawScore;
        this.normalizedScore = normalizedScore;
        this.severity = severity;
        this.algorithm = algorithm;
        this.detectedAt = detectedAt;
        this.labels = labels == null ? Collections.emptyMap() : ImmutableMap.copyOf(labels);
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public Optional<Double> getExpectedValue() {
        return Optional.ofNullable(expectedValue);
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getNormalizedScore() {
        return normalizedScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AnomalyRecord that = (AnomalyRecord) o;
        return Double.compare(value, that.value) == 0
            && Double.compare(rawScore, that.rawScore) == 0
            && Double.compare(normalizedScore, that.normalizedScore) == 0
            && Objects.equals(metricName, that.metricName)
            && Objects.equals(timestamp, that.timestamp)
            && Objects.equals(expectedValue, that.expectedValue)
            && severity == that.severity
            && algorithm == that.algorithm
            && Objects.equals(detectedAt, that.detectedAt)
            && Objects.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return Objects
            .hash(metricName, timestamp, value, expectedValue, rawScore, normalizedScore, severity, algorithm, detectedAt, labels);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("metricName", metricName)
            .append("timestamp", timestamp)
            .append("value", value)
            .append("expectedValue", expectedValue)
            .append("rawScore", rawScore)
            .append("normalizedScore", normalizedScore)
            .append("severity", severity)
            .append("algorithm", algorithm)
            .append("detectedAt", detectedAt)
            .toString();
    }
}
