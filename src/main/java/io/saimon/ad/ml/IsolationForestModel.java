/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.dataprocessor.StandardScaler;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Isolation forest over standardized features.
 *
 * Anomalies are isolated by fewer random partitions than normal points. The raw score is the
 * decision value {@code scoreSamples - offset}: negative for points the forest considers
 * outliers, lower is more anomalous. The offset is the contamination quantile of the training
 * scores, or -0.5 when contamination is "auto".
 */
public class IsolationForestModel implements AnomalyModel {
    static final double AUTO_OFFSET = -0.5;

    private StandardScaler scaler;
    private IsolationTree[] trees;
    // number of samples used to grow each tree
    private int maxSamples;
    private double offset;
    private double contamination;

    // for Gson
    IsolationForestModel() {}

    IsolationForestModel(StandardScaler scaler, IsolationTree[] trees, int maxSamples, double offset, double contamination) {
        this.scaler = scaler;
        this.trees = trees;
        this.maxSamples = maxSamples;
        this.offset = offset;
        this.contamination = contamination;
    }

    /**
     * Fits a forest.
     *
     * @param data training rows, unscaled
     * @param numberOfTrees number of trees
     * @param maxSamples samples per tree, capped at the number of rows; non-positive means min(256, rows)
     * @param contamination expected outlier proportion in (0, 0.5], or NaN for "auto"
     * @param seed random seed
     * @return fitted model
     */
    public static IsolationForestModel fit(double[][] data, int numberOfTrees, int maxSamples, double contamination, long seed) {
        Preconditions.checkArgument(data.length > 0, CommonMessages.EMPTY_TRAINING_MATRIX);
        StandardScaler scaler = StandardScaler.fit(data);
        double[][] scaled = scaler.transform(data);
        int sampleSize = maxSamples > 0 ? Math.min(maxSamples, scaled.length) : Math.min(256, scaled.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

        Random random = new Random(seed);
        int[] indices = new int[scaled.length];
        IsolationTree[] trees = new IsolationTree[numberOfTrees];
        for (int t = 0; t < numberOfTrees; t++) {
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            // partial Fisher-Yates: the first sampleSize entries are a sample without replacement
            for (int i = 0; i < sampleSize; i++) {
                int j = i + random.nextInt(indices.length - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
            }
            trees[t] = IsolationTree.grow(scaled, Arrays.copyOf(indices, sampleSize), heightLimit, random);
        }

        IsolationForestModel model = new IsolationForestModel(scaler, trees, sampleSize, 0, contamination);
        if (Double.isNaN(contamination)) {
            model.offset = AUTO_OFFSET;
        } else {
            model.offset = percentile(model.scoreSamples(scaled), 100.0 * contamination);
        }
        return model;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ISOLATION_FOREST;
    }

    @Override
    public int getFeatureCount() {
        return scaler.getDimensions();
    }

    @Override
    public double[] score(FeatureMatrix features) {
        double[] scores = scoreSamples(scaler.transform(features.toArray()));
        for (int i = 0; i < scores.length; i++) {
            scores[i] -= offset;
        }
        return scores;
    }

    @Override
    public double[] normalize(double[] rawScores) {
        return ScoreNormalizer.invertedMinMax(rawScores);
    }

    @Override
    public Map<String, Object> getConfig() {
        return ImmutableMap
            .of(
                CommonName.MODEL_TYPE_FIELD,
                getAlgorithm().getName(),
                "n_estimators",
                trees.length,
                "max_samples",
                maxSamples,
                "contamination",
                Double.isNaN(contamination) ? "auto" : contamination,
                "offset",
                offset
            );
    }

    /**
     * Opposite of the anomaly score of the original isolation forest paper, in [-1, 0).
     */
    double[] scoreSamples(double[][] scaled) {
        double normalizer = IsolationTree.averagePathLength(maxSamples);
        double[] scores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            double total = 0;
            for (IsolationTree tree : trees) {
                total += tree.pathLength(scaled[i]);
            }
            double averageDepth = total / trees.length;
            scores[i] = normalizer > 0 ? -Math.pow(2, -averageDepth / normalizer) : AUTO_OFFSET;
        }
        return scores;
    }

    double getOffset() {
        return offset;
    }

    int getTreeCount() {
        return trees.length;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param percent in (0, 100]
     */
    static double percentile(double[] values, double percent) {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, percent);
    }
}
