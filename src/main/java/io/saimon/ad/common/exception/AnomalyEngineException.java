/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

/**
 * Base exception for exceptions thrown by the detection engine.
 */
public class AnomalyEngineException extends RuntimeException {

    private String metricName;
    // countedInStats will be used to tell whether the exception should be
    // counted in failure stats.
    private boolean countedInStats = true;

    public AnomalyEngineException(String message) {
        super(message);
    }

    /**
     * Constructor with a metric name and a message.
     *
     * @param metricName metric name
     * @param message message of the exception
     */
    public AnomalyEngineException(String metricName, String message) {
        super(message);
        this.metricName = metricName;
    }

    public AnomalyEngineException(String metricName, String message, Throwable cause) {
        super(message, cause);
        this.metricName = metricName;
    }

    public AnomalyEngineException(Throwable cause) {
        super(cause);
    }

    /**
     * Returns the name of the metric the failure belongs to.
     *
     * @return metric name, null if the failure is not tied to a metric
     */
    public String getMetricName() {
        return this.metricName;
    }

    /**
     * Returns if the exception should be counted in stats.
     *
     * @return true if should count the exception in stats; otherwise return false
     */
    public boolean isCountedInStats() {
        return countedInStats;
    }

    /**
     * Set if the exception should be counted in stats.
     *
     * @param countInStats count the exception in stats
     * @return the exception itself
     */
    public AnomalyEngineException countedInStats(boolean countInStats) {
        this.countedInStats = countInStats;
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(metricName);
        sb.append(' ');
        sb.append(super.toString());
        return sb.toString();
    }
}
