/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

/**
 * The anomaly sink could not accept a record. Records are not retried.
 */
public class SinkUnavailableException extends AnomalyEngineException {

    public SinkUnavailableException(String metricName, String message) {
        super(metricName, message);
    }

    public SinkUnavailableException(String metricName, String message, Throwable cause) {
        super(metricName, message, cause);
    }
}
