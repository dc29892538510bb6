/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import io.saimon.ad.model.Algorithm;

/**
 * Raw and normalized scores of one algorithm over one feature matrix, one entry per row.
 */
public class ScoringResult {
    private final Algorithm algorithm;
    private final double[] rawScores;
    private final double[] normalizedScores;

    public ScoringResult(Algorithm algorithm, double[] rawScores, double[] normalizedScores) {
        this.algorithm = algorithm;
        this.rawScores = rawScores;
        this.normalizedScores = normalizedScores;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public double[] getRawScores() {
        return rawScores.clone();
    }

    public double[] getNormalizedScores() {
        return normalizedScores.clone();
    }

    public double getRawScore(int row) {
        return rawScores[row];
    }

    public double getNormalizedScore(int row) {
        return normalizedScores[row];
    }

    public int size() {
        return rawScores.length;
    }
}
