/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Map;
import java.util.Optional;

import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

/**
 * A fitted model of one algorithm family.
 *
 * A model scores a feature matrix, returning one raw score per row, and knows how to bring its
 * raw scores onto the shared [0, 1] scale where higher means more anomalous. Models are immutable
 * once trained, so they can be read by inference while a newer model is being fitted.
 */
public interface AnomalyModel {

    /**
     * @return algorithm family of the model
     */
    Algorithm getAlgorithm();

    /**
     * @return number of feature columns the model was trained on
     */
    int getFeatureCount();

    /**
     * Computes the algorithm specific raw score of every row.
     *
     * @param features feature matrix built the same way as the training matrix
     * @return one raw score per row
     */
    double[] score(FeatureMatrix features);

    /**
     * Maps raw scores of one batch to [0, 1], higher is more anomalous.
     *
     * @param rawScores scores returned by {@link #score(FeatureMatrix)} for one batch
     * @return normalized scores, same length
     */
    double[] normalize(double[] rawScores);

    /**
     * @return the value the model considers normal, if the algorithm has such a notion
     */
    default Optional<Double> getExpectedValue() {
        return Optional.empty();
    }

    /**
     * @return parameters reported to the model registry
     */
    Map<String, Object> getConfig();
}
