package com.finreview.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        // Only split on features that still vary within this node
        int numFeatures = data[0].length;
        int[] candidates = new int[numFeatures];
        double[] mins = new double[numFeatures];
        double[] maxs = new double[numFeatures];
        int candidateCount = 0;
        for (int f = 0; f < numFeatures; f++) {
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double[] row : data) {
                if (row[f] < min) min = row[f];
                if (row[f] > max) max = row[f];
            }
            if (min < max) {
                candidates[candidateCount] = f;
                mins[candidateCount] = min;
                maxs[candidateCount] = max;
                candidateCount++;
            }
        }

        // All remaining points identical: cannot be separated further
        if (candidateCount == 0) {
            return IsolationNode.externalNode(n);
        }

        int pick = random.nextInt(candidateCount);
        int featureIdx = candidates[pick];
        double min = mins[pick];
        double max = maxs[pick];
        double splitValue = min + random.nextDouble() * (max - min);
        if (splitValue <= min) {
            // nextDouble() may return 0.0; keep at least one point on the left
            splitValue = Math.nextUp(min);
        }

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, left, right);
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    IsolationNode getRoot() { return root; }
}
