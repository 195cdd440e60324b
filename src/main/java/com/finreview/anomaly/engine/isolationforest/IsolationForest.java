package com.finreview.anomaly.engine.isolationforest;

import com.finreview.anomaly.exception.ModelFitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Immutable Isolation Forest fitted on the periods of one bucket.
 *
 * Anomaly score s(x) = 2^(-E[h(x)] / c(psi)), where h is the path length of x
 * in one tree and psi the per-tree sample size. Scores near 1 mean x is
 * isolated after very few splits; scores well below 0.5 mean x sits in a
 * dense region.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double normalizer;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
        this.normalizer = IsolationNode.averagePathLength(sampleSize);
    }

    /**
     * Fit a forest on the given feature matrix.
     *
     * @param data       one feature row per period
     * @param numTrees   number of trees, typically 100
     * @param sampleSize rows drawn (without replacement) per tree, capped at the row count
     * @param seed       seed of the only random source used for sampling and splitting
     * @throws ModelFitException if the matrix is empty, ragged or holds non-finite values
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        checkMatrix(data);
        if (numTrees < 1) {
            throw new ModelFitException("numTrees must be >= 1, got " + numTrees);
        }

        int psi = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.build(drawSample(data, psi, random), heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    /** Score in (0, 1]; above 0.5 suggests an outlier. */
    public double anomalyScore(double[] point) {
        if (normalizer <= 0) return 0.0;
        double totalPath = 0.0;
        for (IsolationTree tree : trees) {
            totalPath += tree.pathLength(point);
        }
        return Math.pow(2.0, -(totalPath / trees.size()) / normalizer);
    }

    /**
     * Drop in anomaly score when each feature is replaced by its column mean.
     * A large drop means that feature is what made the point unusual.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double score = anomalyScore(point);
        double[] contributions = new double[point.length];
        double[] probe = point.clone();
        for (int f = 0; f < point.length; f++) {
            probe[f] = featureMeans[f];
            contributions[f] = Math.max(0.0, score - anomalyScore(probe));
            probe[f] = point[f];
        }
        return contributions;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private static void checkMatrix(double[][] data) {
        if (data == null || data.length < 2) {
            throw new ModelFitException("at least two samples are required");
        }
        int width = data[0] == null ? 0 : data[0].length;
        if (width == 0) {
            throw new ModelFitException("feature vectors must not be empty");
        }
        for (int r = 0; r < data.length; r++) {
            double[] row = data[r];
            if (row == null || row.length != width) {
                throw new ModelFitException("row " + r + " has " + (row == null ? 0 : row.length)
                        + " features, expected " + width);
            }
            for (int f = 0; f < width; f++) {
                if (!Double.isFinite(row[f])) {
                    throw new ModelFitException("non-finite value at row " + r + ", feature " + f);
                }
            }
        }
    }

    // Partial Fisher-Yates: the first `size` slots of the permutation form the sample
    private static double[][] drawSample(double[][] data, int size, Random random) {
        if (size >= data.length) {
            return data.clone();
        }
        double[][] pool = data.clone();
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            double[] swap = pool[i];
            pool[i] = pool[j];
            pool[j] = swap;
        }
        double[][] sample = new double[size][];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }
}
