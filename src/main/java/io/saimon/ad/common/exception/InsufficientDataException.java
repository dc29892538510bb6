/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

/**
 * Not enough historical points to train models for a metric.
 */
public class InsufficientDataException extends AnomalyEngineException {

    private final int actualPoints;
    private final int requiredPoints;

    public InsufficientDataException(String metricName, String message, int actualPoints, int requiredPoints) {
        super(metricName, message);
        this.actualPoints = actualPoints;
        this.requiredPoints = requiredPoints;
        countedInStats(false);
    }

    public int getActualPoints() {
        return actualPoints;
    }

    public int getRequiredPoints() {
        return requiredPoints;
    }
}
