package com.correlateai.engine.service.stats;

import java.util.Random;

/**
 * Bagged ensemble of regression trees. Bootstrap draws come from a seeded
 * {@link Random}, so identical input and seed give identical fits.
 */
final class RegressionForest {

    private final RegressionTree[] trees;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final long seed;
    private int features;

    RegressionForest(int treeCount, int maxDepth, int minSamplesLeaf, long seed) {
        this.trees = new RegressionTree[treeCount];
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.seed = seed;
    }

    RegressionForest fit(double[][] x, double[] y) {
        int n = x.length;
        features = x[0].length;
        Random random = new Random(seed);
        for (int t = 0; t < trees.length; t++) {
            int[] sample = new int[n];
            for (int i = 0; i < n; i++) {
                sample[i] = random.nextInt(n);
            }
            RegressionTree tree = new RegressionTree(features, maxDepth, minSamplesLeaf);
            tree.fit(x, y, sample);
            trees[t] = tree;
        }
        return this;
    }

    double predict(double[] row) {
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(row);
        }
        return sum / trees.length;
    }

    /**
     * Averages the importances of trees that split at least once, renormalized to sum to 1.
     */
    double[] featureImportances() {
        double[] total = new double[features];
        for (RegressionTree tree : trees) {
            double[] importances = tree.featureImportances();
            for (int i = 0; i < features; i++) {
                total[i] += importances[i];
            }
        }
        double sum = 0.0;
        for (double v : total) {
            sum += v;
        }
        if (sum <= 0) {
            return new double[features];
        }
        for (int i = 0; i < features; i++) {
            total[i] /= sum;
        }
        return total;
    }
}
