package com.motaz.insight.engine.analysis.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest whose every random draw comes from one seeded
 * {@link Random}, so a given seed and input always produce the same trees.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649;

    private final List<Node> trees;
    private final int subsampleSize;

    private IsolationForest(List<Node> trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    public static IsolationForest fit(double[][] data, int treeCount, int subsampleSize, long seed) {
        Random random = new Random(seed);
        int psi = Math.min(subsampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        List<Node> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            trees.add(build(sample(data, psi, random), 0, heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    /** {@code 2^(-E[h(x)] / c(psi))}, in (0, 1]. */
    public double score(double[] point) {
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(tree, point, 0);
        }
        double expected = total / trees.size();
        return Math.pow(2.0, -expected / averagePathLength(subsampleSize));
    }

    public int size() {
        return trees.size();
    }

    /** Average path length of an unsuccessful BST search over n points. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static double[][] sample(double[][] data, int size, Random random) {
        int[] index = new int[data.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int pick = i + random.nextInt(index.length - i);
            int swap = index[i];
            index[i] = index[pick];
            index[pick] = swap;
            sample[i] = data[index[i]];
        }
        return sample;
    }

    private static Node build(double[][] points, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || points.length <= 1) {
            return Node.leaf(points.length);
        }
        int dims = points[0].length;
        List<Integer> spread = new ArrayList<>();
        double[] mins = new double[dims];
        double[] maxs = new double[dims];
        for (int j = 0; j < dims; j++) {
            mins[j] = Double.POSITIVE_INFINITY;
            maxs[j] = Double.NEGATIVE_INFINITY;
            for (double[] point : points) {
                mins[j] = Math.min(mins[j], point[j]);
                maxs[j] = Math.max(maxs[j], point[j]);
            }
            if (maxs[j] > mins[j]) {
                spread.add(j);
            }
        }
        if (spread.isEmpty()) {
            return Node.leaf(points.length);
        }
        int feature = spread.get(random.nextInt(spread.size()));
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] point : points) {
            (point[feature] < split ? left : right).add(point);
        }
        return Node.split(feature, split,
                build(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                build(right.toArray(new double[0][]), depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double[] point, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = point[node.feature] < node.split ? node.left : node.right;
        return pathLength(next, point, depth + 1);
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
