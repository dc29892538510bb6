/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.common.exception;

import io.saimon.ad.model.Algorithm;

/**
 * Fitting one algorithm for one metric failed. Other algorithms of the same metric are not affected.
 */
public class ModelFitException extends AnomalyEngineException {

    private final Algorithm algorithm;

    public ModelFitException(String metricName, Algorithm algorithm, String message) {
        super(metricName, message);
        this.algorithm = algorithm;
    }

    public ModelFitException(String metricName, Algorithm algorithm, String message, Throwable cause) {
        super(metricName, message, cause);
        this.algorithm = algorithm;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }
}
