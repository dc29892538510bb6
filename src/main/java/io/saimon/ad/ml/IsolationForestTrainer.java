/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.settings.AnomalyDetectorSettings;

public class IsolationForestTrainer implements AlgorithmTrainer {
    private final int numberOfTrees;
    // non-positive means auto
    private final int maxSamples;
    // NaN means auto
    private final double contamination;
    private final long seed;

    public IsolationForestTrainer(int numberOfTrees, String maxSamples, String contamination, long seed) {
        this.numberOfTrees = numberOfTrees;
        this.maxSamples = AnomalyDetectorSettings.AUTO.equals(maxSamples) ? 0 : Integer.parseInt(maxSamples);
        this.contamination = AnomalyDetectorSettings.AUTO.equals(contamination) ? Double.NaN : Double.parseDouble(contamination);
        this.seed = seed;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ISOLATION_FOREST;
    }

    @Override
    public Class<? extends AnomalyModel> getModelClass() {
        return IsolationForestModel.class;
    }

    @Override
    public AnomalyModel train(FeatureMatrix features) {
        return IsolationForestModel.fit(features.toArray(), numberOfTrees, maxSamples, contamination, seed);
    }
}
