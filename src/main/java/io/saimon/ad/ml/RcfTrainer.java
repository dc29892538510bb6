/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

public class RcfTrainer implements AlgorithmTrainer {
    private final int numberOfTrees;
    private final int sampleSize;
    private final long seed;

    public RcfTrainer(int numberOfTrees, int sampleSize, long seed) {
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.RANDOM_CUT_FOREST;
    }

    @Override
    public Class<? extends AnomalyModel> getModelClass() {
        return RcfModel.class;
    }

    @Override
    public AnomalyModel train(FeatureMatrix features) {
        return RcfModel.fit(features.toArray(), numberOfTrees, sampleSize, seed);
    }
}
