/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Map;
import java.util.Optional;

import io.saimon.ad.constant.CommonName;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

import com.google.common.collect.ImmutableMap;

/**
 * Parametric model of the raw value: mean and population standard deviation of the training
 * data plus a threshold multiplier.
 */
public class ZScoreModel implements AnomalyModel {
    private double mean;
    private double std;
    private double threshold;
    private int featureCount;

    // for Gson
    ZScoreModel() {}

    public ZScoreModel(double mean, double std, double threshold, int featureCount) {
        this.mean = mean;
        this.std = std;
        this.threshold = threshold;
        this.featureCount = featureCount;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ZSCORE;
    }

    @Override
    public int getFeatureCount() {
        return featureCount;
    }

    /**
     * Scores each row by its absolute z-score {@code |value - mean| / (std + epsilon)}.
     */
    @Override
    public double[] score(FeatureMatrix features) {
        double[] scores = new double[features.getRowCount()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = Math.abs(features.get(i, FeatureMatrix.VALUE_COLUMN) - mean) / (std + ScoreNormalizer.EPSILON);
        }
        return scores;
    }

    @Override
    public double[] normalize(double[] rawScores) {
        return ScoreNormalizer.clippedRatio(rawScores, threshold);
    }

    @Override
    public Optional<Double> getExpectedValue() {
        return Optional.of(mean);
    }

    @Override
    public Map<String, Object> getConfig() {
        return ImmutableMap.of(CommonName.MEAN_FIELD, mean, CommonName.STD_FIELD, std, CommonName.THRESHOLD_FIELD, threshold);
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getThreshold() {
        return threshold;
    }
}
