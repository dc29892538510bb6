/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.moment.Variance;

import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.dataprocessor.StandardScaler;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.settings.AnomalyDetectorSettings;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Nu one-class SVM over standardized features.
 *
 * The raw score is the decision value {@code sum(alpha_i * K(sv_i, x)) - rho}: positive inside
 * the learned support of the data, negative outside, lower is more anomalous. Only support
 * vectors are kept.
 */
public class OneClassSvmModel implements AnomalyModel {

    private StandardScaler scaler;
    private SvmKernel kernel;
    private double[][] supportVectors;
    private double[] coefficients;
    private double rho;
    private double nu;

    // for Gson
    OneClassSvmModel() {}

    OneClassSvmModel(StandardScaler scaler, SvmKernel kernel, double[][] supportVectors, double[] coefficients, double rho, double nu) {
        this.scaler = scaler;
        this.kernel = kernel;
        this.supportVectors = supportVectors;
        this.coefficients = coefficients;
        this.rho = rho;
        this.nu = nu;
    }

    /**
     * Fits a model.
     *
     * @param data training rows, unscaled
     * @param kernelType kernel function
     * @param gamma kernel coefficient: a positive number, "scale" or "auto"
     * @param nu upper bound on the fraction of training errors, in (0, 1]
     * @param degree degree of the polynomial kernel
     * @param coef0 independent term of the polynomial and sigmoid kernels
     * @return fitted model
     */
    public static OneClassSvmModel fit(double[][] data, SvmKernel.Type kernelType, String gamma, double nu, int degree, double coef0) {
        Preconditions.checkArgument(data.length > 0, CommonMessages.EMPTY_TRAINING_MATRIX);
        Preconditions.checkArgument(nu > 0 && nu <= 1, "nu must be in (0, 1], got %s", nu);
        StandardScaler scaler = StandardScaler.fit(data);
        double[][] scaled = scaler.transform(data);
        SvmKernel kernel = new SvmKernel(kernelType, resolveGamma(gamma, scaled), degree, coef0);

        OneClassSvmSolver.Solution solution = new OneClassSvmSolver(scaled, kernel).solve(nu);

        List<double[]> vectors = new ArrayList<>();
        List<Double> alphas = new ArrayList<>();
        for (int i = 0; i < scaled.length; i++) {
            if (solution.alpha[i] > 0) {
                vectors.add(scaled[i]);
                alphas.add(solution.alpha[i]);
            }
        }
        double[] coefficients = new double[alphas.size()];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = alphas.get(i);
        }
        return new OneClassSvmModel(scaler, kernel, vectors.toArray(new double[0][]), coefficients, solution.rho, nu);
    }

    /**
     * "auto" is 1 / n_features, "scale" is 1 / (n_features * variance of all scaled values).
     */
    static double resolveGamma(String gamma, double[][] scaled) {
        int features = scaled[0].length;
        if (AnomalyDetectorSettings.AUTO.equals(gamma)) {
            return 1.0 / features;
        }
        if (AnomalyDetectorSettings.SCALE.equals(gamma)) {
            Variance variance = new Variance(false);
            for (double[] row : scaled) {
                variance.incrementAll(row);
            }
            double result = variance.getResult();
            return result > 0 ? 1.0 / (features * result) : 1.0;
        }
        return Double.parseDouble(gamma);
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.ONE_CLASS_SVM;
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
            scores[i] = decision(scaled[i]);
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
                "kernel",
                kernel.getType().name().toLowerCase(Locale.ROOT),
                "gamma",
                kernel.getGamma(),
                "degree",
                kernel.getDegree(),
                "coef0",
                kernel.getCoef0(),
                "nu",
                nu,
                "n_support_vectors",
                supportVectors.length
            );
    }

    double decision(double[] scaledPoint) {
        double sum = 0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * kernel.compute(supportVectors[i], scaledPoint);
        }
        return sum - rho;
    }

    int getSupportVectorCount() {
        return supportVectors.length;
    }

    double getRho() {
        return rho;
    }

    SvmKernel getKernel() {
        return kernel;
    }
}
