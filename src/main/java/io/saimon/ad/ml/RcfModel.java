/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Map;

import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.dataprocessor.StandardScaler;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

import com.amazon.randomcutforest.RandomCutForest;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Random cut forest over standardized features. The raw score is the forest's anomaly score,
 * higher is more anomalous.
 *
 * The forest is fed every training row once and never updated during inference.
 */
public class RcfModel implements AnomalyModel {

    private StandardScaler scaler;
    private RandomCutForest forest;

    // for Gson
    RcfModel() {}

    RcfModel(StandardScaler scaler, RandomCutForest forest) {
        this.scaler = scaler;
        this.forest = forest;
    }

    /**
     * Fits a forest.
     *
     * @param data training rows, unscaled
     * @param numberOfTrees number of trees
     * @param sampleSize points kept by each tree's reservoir sample
     * @param seed random seed
     * @return fitted model
     */
    public static RcfModel fit(double[][] data, int numberOfTrees, int sampleSize, long seed) {
        Preconditions.checkArgument(data.length > 0, CommonMessages.EMPTY_TRAINING_MATRIX);
        StandardScaler scaler = StandardScaler.fit(data);
        RandomCutForest forest = RandomCutForest
            .builder()
            .dimensions(scaler.getDimensions())
            .numberOfTrees(numberOfTrees)
            .sampleSize(sampleSize)
            .randomSeed(seed)
            .build();
        for (double[] row : scaler.transform(data)) {
            forest.update(row);
        }
        return new RcfModel(scaler, forest);
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.RANDOM_CUT_FOREST;
    }

    @Override
    public int getFeatureCount() {
        return scaler.getDimensions();
    }

    @Override
    public double[] score(FeatureMatrix features) {
        double[][] scaled = scaler.transform(features.toArray());
        double[] scores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            scores[i] = forest.getAnomalyScore(scaled[i]);
        }
        return scores;
    }

    @Override
    public double[] normalize(double[] rawScores) {
        return ScoreNormalizer.minMax(rawScores);
    }

    @Override
    public Map<String, Object> getConfig() {
        return ImmutableMap
            .of(
                CommonName.MODEL_TYPE_FIELD,
                getAlgorithm().getName(),
                "n_estimators",
                forest.getNumberOfTrees(),
                "sample_size",
                forest.getSampleSize(),
                "total_updates",
                forest.getTotalUpdates()
            );
    }

    RandomCutForest getForest() {
        return forest;
    }
}
