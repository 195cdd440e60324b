package com.finreview.anomaly.engine.isolationforest;

public class IsolationNode {

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size; // samples that reached this node (leaf nodes only)
    private final boolean external;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right,
                          int size, boolean external) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.external = external;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0, false);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, 0.0, null, null, size, true);
    }

    public double pathLength(double[] point, int currentDepth) {
        if (external) {
            return currentDepth + averagePathLength(size);
        }
        if (point[splitFeature] < splitValue) {
            return left.pathLength(point, currentDepth + 1);
        }
        return right.pathLength(point, currentDepth + 1);
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public boolean isExternal() { return external; }
    public int getSize() { return size; }
}
