/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

/**
 * The external model registry rejected or could not receive a registration.
 * The locally persisted model stays valid.
 */
public class RegistryUnavailableException extends AnomalyEngineException {

    public RegistryUnavailableException(String metricName, String message) {
        super(metricName, message);
    }

    public RegistryUnavailableException(String metricName, String message, Throwable cause) {
        super(metricName, message, cause);
    }
}
