/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Locale;

/**
 * Kernel function of the one-class SVM with its resolved parameters.
 */
public class SvmKernel {

    public enum Type {
        LINEAR,
        POLY,
        RBF,
        SIGMOID;

        public static Type fromName(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    private Type type;
    private double gamma;
    private int degree;
    private double coef0;

    // for Gson
    SvmKernel() {}

    public SvmKernel(Type type, double gamma, int degree, double coef0) {
        this.type = type;
        this.gamma = gamma;
        this.degree = degree;
        this.coef0 = coef0;
    }

    public double compute(double[] a, double[] b) {
        switch (type) {
            case LINEAR:
                return dot(a, b);
            case POLY:
                return Math.pow(gamma * dot(a, b) + coef0, degree);
            case SIGMOID:
                return Math.tanh(gamma * dot(a, b) + coef0);
            case RBF:
            default:
                double squaredDistance = 0;
                for (int i = 0; i < a.length; i++) {
                    double diff = a[i] - b[i];
                    squaredDistance += diff * diff;
                }
                return Math.exp(-gamma * squaredDistance);
        }
    }

    public Type getType() {
        return type;
    }

    public double getGamma() {
        return gamma;
    }

    public int getDegree() {
        return degree;
    }

    public double getCoef0() {
        return coef0;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
