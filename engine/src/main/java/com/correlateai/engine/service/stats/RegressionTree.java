package com.correlateai.engine.service.stats;

import java.util.Arrays;
import java.util.Comparator;

/**
 * CART regression tree grown on variance reduction. Tracks the weighted impurity
 * decrease contributed by each feature.
 */
final class RegressionTree {

    private final int maxDepth;
    private final int minSamplesLeaf;
    private final double[] impurityDecrease;
    private Node root;

    RegressionTree(int features, int maxDepth, int minSamplesLeaf) {
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.impurityDecrease = new double[features];
    }

    void fit(double[][] x, double[] y, int[] sample) {
        root = grow(x, y, sample, 0);
    }

    double predict(double[] row) {
        Node node = root;
        while (!node.isLeaf()) {
            node = row[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    /**
     * Impurity decrease per feature, normalized to sum to 1; all zeros when the tree never split.
     */
    double[] featureImportances() {
        double total = Arrays.stream(impurityDecrease).sum();
        double[] normalized = new double[impurityDecrease.length];
        if (total <= 0) {
            return normalized;
        }
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = impurityDecrease[i] / total;
        }
        return normalized;
    }

    private Node grow(double[][] x, double[] y, int[] sample, int depth) {
        double mean = 0.0;
        for (int idx : sample) {
            mean += y[idx];
        }
        mean /= sample.length;
        double sse = 0.0;
        for (int idx : sample) {
            double d = y[idx] - mean;
            sse += d * d;
        }

        if (depth >= maxDepth || sample.length < 2 * minSamplesLeaf || sse <= 1e-12) {
            return Node.leaf(mean);
        }

        Split best = findBestSplit(x, y, sample, sse);
        if (best == null) {
            return Node.leaf(mean);
        }

        int[] left = Arrays.stream(sample).filter(idx -> x[idx][best.feature] <= best.threshold).toArray();
        int[] right = Arrays.stream(sample).filter(idx -> x[idx][best.feature] > best.threshold).toArray();
        impurityDecrease[best.feature] += best.gain;

        Node node = new Node();
        node.feature = best.feature;
        node.threshold = best.threshold;
        node.left = grow(x, y, left, depth + 1);
        node.right = grow(x, y, right, depth + 1);
        return node;
    }

    private Split findBestSplit(double[][] x, double[] y, int[] sample, double parentSse) {
        int n = sample.length;
        Split best = null;
        Integer[] order = new Integer[n];
        for (int feature = 0; feature < impurityDecrease.length; feature++) {
            for (int i = 0; i < n; i++) {
                order[i] = sample[i];
            }
            final int f = feature;
            Arrays.sort(order, Comparator.comparingDouble(idx -> x[idx][f]));

            double totalSum = 0.0;
            double totalSq = 0.0;
            for (int idx : sample) {
                totalSum += y[idx];
                totalSq += y[idx] * y[idx];
            }

            double leftSum = 0.0;
            double leftSq = 0.0;
            for (int i = 0; i < n - 1; i++) {
                double yi = y[order[i]];
                leftSum += yi;
                leftSq += yi * yi;
                int leftCount = i + 1;
                int rightCount = n - leftCount;
                double current = x[order[i]][f];
                double next = x[order[i + 1]][f];
                if (current == next || leftCount < minSamplesLeaf || rightCount < minSamplesLeaf) {
                    continue;
                }
                double rightSum = totalSum - leftSum;
                double rightSq = totalSq - leftSq;
                double leftSse = leftSq - leftSum * leftSum / leftCount;
                double rightSse = rightSq - rightSum * rightSum / rightCount;
                double gain = parentSse - (leftSse + rightSse);
                if (gain > 1e-12 && (best == null || gain > best.gain)) {
                    best = new Split(f, (current + next) / 2.0, gain);
                }
            }
        }
        return best;
    }

    private record Split(int feature, double threshold, double gain) {}

    private static final class Node {
        int feature = -1;
        double threshold;
        double value;
        Node left;
        Node right;

        static Node leaf(double value) {
            Node node = new Node();
            node.value = value;
            return node;
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
