/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

/**
 * Maps raw scores onto [0, 1] where higher means more anomalous.
 */
public final class ScoreNormalizer {
    public static final double EPSILON = 1e-10;

    private ScoreNormalizer() {}

    /**
     * Divides each score by a threshold and clips to [0, 1].
     *
     * @param rawScores non-negative scores
     * @param threshold the score that maps to 1
     * @return normalized scores
     */
    public static double[] clippedRatio(double[] rawScores, double threshold) {
        double[] normalized = new double[rawScores.length];
        for (int i = 0; i < rawScores.length; i++) {
            normalized[i] = clip(rawScores[i] / threshold);
        }
        return normalized;
    }

    /**
     * Min-max normalization within the batch for scores where lower is more anomalous: the lowest
     * score of the batch maps to 1 and the highest to 0. A batch whose scores span less than
     * {@link #EPSILON} maps to all zeros.
     *
     * The scale is relative to the batch, so the same raw score can normalize differently in two batches.
     *
     * @param rawScores decision scores, lower is more anomalous
     * @return normalized scores
     */
    public static double[] invertedMinMax(double[] rawScores) {
        double[] normalized = minMax(rawScores);
        if (range(rawScores) < EPSILON) {
            return normalized;
        }
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = 1.0 - normalized[i];
        }
        return normalized;
    }

    /**
     * Min-max normalization within the batch for scores where higher is more anomalous.
     * A batch whose scores span less than {@link #EPSILON} maps to all zeros.
     *
     * @param rawScores anomaly scores, higher is more anomalous
     * @return normalized scores
     */
    public static double[] minMax(double[] rawScores) {
        double[] normalized = new double[rawScores.length];
        double range = range(rawScores);
        if (range < EPSILON) {
            return normalized;
        }
        double min = min(rawScores);
        for (int i = 0; i < rawScores.length; i++) {
            normalized[i] = clip((rawScores[i] - min) / range);
        }
        return normalized;
    }

    static double clip(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }

    private static double range(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        return max(values) - min(values);
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }
}
