/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

/**
 * The ingestion source returned nothing usable for a metric. The metric is skipped for the current cycle.
 */
public class DataUnavailableException extends AnomalyEngineException {

    public DataUnavailableException(String metricName, String message) {
        super(metricName, message);
        countedInStats(false);
    }

    public DataUnavailableException(String metricName, String message, Throwable cause) {
        super(metricName, message, cause);
    }
}
