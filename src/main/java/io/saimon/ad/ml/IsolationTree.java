/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.Arrays;
import java.util.Random;

/**
 * One isolation tree stored as flat node arrays. Node 0 is the root; a node with feature -1 is a leaf.
 */
public class IsolationTree {
    static final int LEAF = -1;

    private int[] feature;
    private double[] threshold;
    private int[] left;
    private int[] right;
    // number of training samples that reached the node
    private int[] size;

    // for Gson
    IsolationTree() {}

    private IsolationTree(int[] feature, double[] threshold, int[] left, int[] right, int[] size) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    /**
     * Grows a tree on the given rows with random feature and random split value at each node.
     *
     * @param data scaled training rows
     * @param rows indices of the rows sampled for this tree
     * @param heightLimit maximum depth
     * @param random source of randomness
     * @return grown tree
     */
    static IsolationTree grow(double[][] data, int[] rows, int heightLimit, Random random) {
        Builder builder = new Builder(rows.length * 2);
        builder.build(data, rows, 0, rows.length, 0, heightLimit, random);
        return builder.toTree();
    }

    /**
     * Path length of a point: the depth of the leaf it falls into plus the average path
     * length of an unbuilt subtree holding that leaf's training samples.
     *
     * @param point scaled row
     * @return path length
     */
    double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (feature[node] != LEAF) {
            node = point[feature[node]] <= threshold[node] ? left[node] : right[node];
            depth++;
        }
        return depth + averagePathLength(size[node]);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of n nodes.
     *
     * @param n number of samples
     * @return c(n)
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + 0.5772156649015329) - 2.0 * (n - 1.0) / n;
    }

    private static class Builder {
        private int[] feature;
        private double[] threshold;
        private int[] left;
        private int[] right;
        private int[] size;
        private int count;

        Builder(int capacity) {
            feature = new int[capacity];
            threshold = new double[capacity];
            left = new int[capacity];
            right = new int[capacity];
            size = new int[capacity];
        }

        int build(double[][] data, int[] rows, int from, int to, int depth, int heightLimit, Random random) {
            int node = newNode(to - from);
            if (depth >= heightLimit || to - from <= 1) {
                return node;
            }
            int dimensions = data[rows[from]].length;
            double[] min = new double[dimensions];
            double[] max = new double[dimensions];
            Arrays.fill(min, Double.POSITIVE_INFINITY);
            Arrays.fill(max, Double.NEGATIVE_INFINITY);
            for (int i = from; i < to; i++) {
                double[] row = data[rows[i]];
                for (int j = 0; j < dimensions; j++) {
                    min[j] = Math.min(min[j], row[j]);
                    max[j] = Math.max(max[j], row[j]);
                }
            }
            int[] splittable = new int[dimensions];
            int candidates = 0;
            for (int j = 0; j < dimensions; j++) {
                if (max[j] > min[j]) {
                    splittable[candidates++] = j;
                }
            }
            if (candidates == 0) {
                return node;
            }
            int splitFeature = splittable[random.nextInt(candidates)];
            double splitValue = min[splitFeature] + random.nextDouble() * (max[splitFeature] - min[splitFeature]);

            // partition rows[from, to) so that rows going left come first
            int boundary = from;
            for (int i = from; i < to; i++) {
                if (data[rows[i]][splitFeature] <= splitValue) {
                    int tmp = rows[boundary];
                    rows[boundary] = rows[i];
                    rows[i] = tmp;
                    boundary++;
                }
            }
            feature[node] = splitFeature;
            threshold[node] = splitValue;
            int leftChild = build(data, rows, from, boundary, depth + 1, heightLimit, random);
            int rightChild = build(data, rows, boundary, to, depth + 1, heightLimit, random);
            left[node] = leftChild;
            right[node] = rightChild;
            return node;
        }

        private int newNode(int sampleCount) {
            if (count == feature.length) {
                int capacity = feature.length * 2;
                feature = Arrays.copyOf(feature, capacity);
                threshold = Arrays.copyOf(threshold, capacity);
                left = Arrays.copyOf(left, capacity);
                right = Arrays.copyOf(right, capacity);
                size = Arrays.copyOf(size, capacity);
            }
            feature[count] = LEAF;
            threshold[count] = 0;
            left[count] = LEAF;
            right[count] = LEAF;
            size[count] = sampleCount;
            return count++;
        }

        IsolationTree toTree() {
            return new IsolationTree(
                Arrays.copyOf(feature, count),
                Arrays.copyOf(threshold, count),
                Arrays.copyOf(left, count),
                Arrays.copyOf(right, count),
                Arrays.copyOf(size, count)
            );
        }
    }
}
