/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

public class OneClassSvmTrainer implements AlgorithmTrainer {
    private final SvmKernel.Type kernel;
    private final String gamma;
    private final double nu;
    private final int degree;
    private final double coef0;

    public OneClassSvmTrainer(String kernel, String gamma, double nu, int degree, double coef0) {
        this.kernel = SvmKernel.Type.fromName(kernel);
        this.gamma = gamma;
        this.nu = nu;
        this.degree = degree;
        this.coef0 = coef0;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ONE_CLASS_SVM;
    }

    @Override
    public Class<? extends AnomalyModel> getModelClass() {
        return OneClassSvmModel.class;
    }

    @Override
    public AnomalyModel train(FeatureMatrix features) {
        return OneClassSvmModel.fit(features.toArray(), kernel, gamma, nu, degree, coef0);
    }
}
