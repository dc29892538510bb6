/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

/**
 * Fits models of one algorithm family.
 */
public interface AlgorithmTrainer {

    Algorithm getAlgorithm();

    /**
     * @return concrete model class, used to read checkpoints back
     */
    Class<? extends AnomalyModel> getModelClass();

    /**
     * Fits a model on a training matrix.
     *
     * @param features training matrix with at least one row
     * @return trained model
     */
    AnomalyModel train(FeatureMatrix features);
}
