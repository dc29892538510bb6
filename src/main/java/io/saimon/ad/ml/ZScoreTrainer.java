/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

import com.google.common.base.Preconditions;

public class ZScoreTrainer implements AlgorithmTrainer {
    private final double threshold;

    public ZScoreTrainer(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ZSCORE;
    }

    @Override
    public Class<? extends AnomalyModel> getModelClass() {
        return ZScoreModel.class;
    }

    /**
     * Mean and population standard deviation of the raw value column.
     */
    @Override
    public AnomalyModel train(FeatureMatrix features) {
        Preconditions.checkArgument(features.getRowCount() > 0, CommonMessages.EMPTY_TRAINING_MATRIX);
        double[] values = features.getColumn(FeatureMatrix.VALUE_COLUMN);
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values, mean);
        return new ZScoreModel(mean, std, threshold, features.getColumnCount());
    }
}
