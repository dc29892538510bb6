/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sequential minimal optimization for the nu one-class SVM dual:
 *
 * <pre>
 *   min 0.5 a'Qa   subject to  0 &lt;= a_i &lt;= 1,  sum(a) = nu * l
 * </pre>
 *
 * Working pairs are chosen with second order information. Kernel columns are computed on
 * demand and kept in a bounded LRU cache.
 */
class OneClassSvmSolver {
    private static final Logger logger = LogManager.getLogger(OneClassSvmSolver.class);

    static final double TOLERANCE = 1e-3;
    private static final double TAU = 1e-12;
    private static final double UPPER_BOUND = 1.0;
    private static final long CACHE_BYTES = 64L * 1024 * 1024;

    private final double[][] data;
    private final SvmKernel kernel;
    private final int size;
    private final double[] diagonal;
    private final Map<Integer, double[]> columnCache;

    OneClassSvmSolver(double[][] data, SvmKernel kernel) {
        this.data = data;
        this.kernel = kernel;
        this.size = data.length;
        this.diagonal = new double[size];
        for (int i = 0; i < size; i++) {
            diagonal[i] = kernel.compute(data[i], data[i]);
        }
        int maxColumns = (int) Math.max(2, CACHE_BYTES / (8L * Math.max(size, 1)));
        this.columnCache = new LinkedHashMap<Integer, double[]>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                return size() > maxColumns;
            }
        };
    }

    /**
     * Solves the dual problem.
     *
     * @param nu upper bound on the fraction of training errors, lower bound on the fraction of support vectors
     * @return solution
     */
    Solution solve(double nu) {
        double[] alpha = new double[size];
        int full = (int) (nu * size);
        for (int i = 0; i < full && i < size; i++) {
            alpha[i] = UPPER_BOUND;
        }
        if (full < size) {
            alpha[full] = nu * size - full;
        }

        double[] gradient = new double[size];
        for (int i = 0; i < size; i++) {
            if (alpha[i] > 0) {
                double[] column = column(i);
                for (int k = 0; k < size; k++) {
                    gradient[k] += alpha[i] * column[k];
                }
            }
        }

        long maxIterations = Math.max(100_000L, 10L * size);
        long iteration = 0;
        while (iteration < maxIterations) {
            int i = -1;
            double gMax = Double.NEGATIVE_INFINITY;
            for (int t = 0; t < size; t++) {
                if (alpha[t] < UPPER_BOUND && -gradient[t] >= gMax) {
                    gMax = -gradient[t];
                    i = t;
                }
            }
            if (i == -1) {
                break;
            }
            double[] columnI = column(i);

            int j = -1;
            double gMax2 = Double.NEGATIVE_INFINITY;
            double minObjective = Double.POSITIVE_INFINITY;
            for (int t = 0; t < size; t++) {
                if (alpha[t] > 0) {
                    if (gradient[t] >= gMax2) {
                        gMax2 = gradient[t];
                    }
                    double gradientDiff = gMax + gradient[t];
                    if (gradientDiff > 0) {
                        double quadratic = diagonal[i] + diagonal[t] - 2.0 * columnI[t];
                        double objective = -(gradientDiff * gradientDiff) / (quadratic > 0 ? quadratic : TAU);
                        if (objective <= minObjective) {
                            minObjective = objective;
                            j = t;
                        }
                    }
                }
            }
            if (j == -1 || gMax + gMax2 < TOLERANCE) {
                break;
            }
            iteration++;
            double[] columnJ = column(j);

            double oldAlphaI = alpha[i];
            double oldAlphaJ = alpha[j];
            double quadratic = diagonal[i] + diagonal[j] - 2.0 * columnI[j];
            if (quadratic <= 0) {
                quadratic = TAU;
            }
            double delta = (gradient[i] - gradient[j]) / quadratic;
            double sum = alpha[i] + alpha[j];
            alpha[i] -= delta;
            alpha[j] += delta;
            if (sum > UPPER_BOUND) {
                if (alpha[i] > UPPER_BOUND) {
                    alpha[i] = UPPER_BOUND;
                    alpha[j] = sum - UPPER_BOUND;
                }
            } else {
                if (alpha[j] < 0) {
                    alpha[j] = 0;
                    alpha[i] = sum;
                }
            }
            if (sum > UPPER_BOUND) {
                if (alpha[j] > UPPER_BOUND) {
                    alpha[j] = UPPER_BOUND;
                    alpha[i] = sum - UPPER_BOUND;
                }
            } else {
                if (alpha[i] < 0) {
                    alpha[i] = 0;
                    alpha[j] = sum;
                }
            }

            double deltaI = alpha[i] - oldAlphaI;
            double deltaJ = alpha[j] - oldAlphaJ;
            for (int k = 0; k < size; k++) {
                gradient[k] += columnI[k] * deltaI + columnJ[k] * deltaJ;
            }
        }
        if (iteration >= maxIterations) {
            logger.warn("One-class SVM solver stopped after {} iterations without reaching tolerance {}", iteration, TOLERANCE);
        } else {
            logger.debug("One-class SVM solver converged after {} iterations", iteration);
        }
        return new Solution(alpha, computeRho(alpha, gradient));
    }

    private double computeRho(double[] alpha, double[] gradient) {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double freeSum = 0;
        int freeCount = 0;
        for (int i = 0; i < size; i++) {
            if (alpha[i] >= UPPER_BOUND) {
                lower = Math.max(lower, gradient[i]);
            } else if (alpha[i] <= 0) {
                upper = Math.min(upper, gradient[i]);
            } else {
                freeSum += gradient[i];
                freeCount++;
            }
        }
        return freeCount > 0 ? freeSum / freeCount : (upper + lower) / 2;
    }

    private double[] column(int i) {
        double[] column = columnCache.get(i);
        if (column == null) {
            column = new double[size];
            for (int k = 0; k < size; k++) {
                column[k] = kernel.compute(data[i], data[k]);
            }
            columnCache.put(i, column);
        }
        return column;
    }

    static class Solution {
        final double[] alpha;
        final double rho;

        Solution(double[] alpha, double rho) {
            this.alpha = alpha;
            this.rho = rho;
        }
    }
}
