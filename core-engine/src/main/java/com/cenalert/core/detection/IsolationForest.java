package com.cenalert.core.detection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over one-dimensional samples.
 *
 * <p>
 * Every tree is grown on the full sample by splitting at a uniformly random
 * point between the node's minimum and maximum until a node holds one
 * distinct value or the depth limit {@code ceil(log2(n))} is reached. The
 * score of a point is {@code 2^(−E[h(x)] / c(n))}: close to 1 for points
 * isolated early, around 0.5 or below for inliers.
 * </p>
 *
 * <p>
 * Training is seeded, so fitting the same sample twice yields the same
 * forest.
 * </p>
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<Node> trees;
    private final int sampleSize;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data     training sample; at least two values
     * @param numTrees number of trees
     * @param seed     random seed
     * @return the fitted forest
     * @throws IllegalArgumentException if the sample has fewer than two values
     */
    static IsolationForest fit(double[] data, int numTrees, long seed) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 2 samples, got: " + data.length);
        }
        int maxDepth = (int) Math.ceil(Math.log(data.length) / Math.log(2));
        Random random = new Random(seed);
        List<Node> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(grow(data.clone(), 0, maxDepth, random));
        }
        return new IsolationForest(trees, data.length);
    }

    /**
     * @param x the point to score
     * @return anomaly score in (0, 1]
     */
    double score(double x) {
        double total = 0;
        for (Node tree : trees) {
            total += tree.pathLength(x, 0);
        }
        double c = averagePathLength(sampleSize);
        return c <= 0 ? 0.0 : Math.pow(2.0, -(total / trees.size()) / c);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static Node grow(double[] sample, int depth, int maxDepth, Random random) {
        double min = Arrays.stream(sample).min().orElse(0);
        double max = Arrays.stream(sample).max().orElse(0);
        if (depth >= maxDepth || sample.length <= 1 || min == max) {
            return Node.leaf(sample.length);
        }

        double split = min + random.nextDouble() * (max - min);
        double[] left = Arrays.stream(sample).filter(v -> v < split).toArray();
        double[] right = Arrays.stream(sample).filter(v -> v >= split).toArray();
        return Node.split(split,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    private static final class Node {
        private final double split;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node split(double split, Node left, Node right) {
            return new Node(split, left, right, 0);
        }

        double pathLength(double x, int depth) {
            if (left == null) {
                return depth + averagePathLength(size);
            }
            return x < split ? left.pathLength(x, depth + 1) : right.pathLength(x, depth + 1);
        }
    }
}
