package com.chicu.aiforecast.ml.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * CART по сумме квадратов ошибок, несколько выходов сразу (для классификации — one-hot).
 * Случайное подмножество фич в каждом узле, если featureFraction &lt; 1.
 */
public class RegressionTreeBuilder {

    private final int maxDepth;
    private final int minSamplesLeaf;
    private final double featureFraction;

    public RegressionTreeBuilder(int maxDepth, int minSamplesLeaf, double featureFraction) {
        this.maxDepth = Math.max(1, maxDepth);
        this.minSamplesLeaf = Math.max(1, minSamplesLeaf);
        this.featureFraction = featureFraction <= 0 || featureFraction > 1 ? 1.0 : featureFraction;
    }

    public FlatTree build(double[][] x, double[][] targets, int[] sample, Random rnd) {
        if (sample.length == 0) throw new IllegalArgumentException("пустая выборка для дерева");

        List<Node> nodes = new ArrayList<>();
        grow(x, targets, sample, 0, nodes, rnd);

        int n = nodes.size();
        int[] feature = new int[n];
        double[] threshold = new double[n];
        int[] left = new int[n];
        int[] right = new int[n];
        double[][] value = new double[n][];
        double[] gain = new double[n];
        for (int i = 0; i < n; i++) {
            Node nd = nodes.get(i);
            feature[i] = nd.feature;
            threshold[i] = nd.threshold;
            left[i] = nd.left;
            right[i] = nd.right;
            value[i] = nd.value;
            gain[i] = nd.gain;
        }
        return new FlatTree(feature, threshold, left, right, value, gain);
    }

    private int grow(double[][] x, double[][] t, int[] idx, int depth, List<Node> nodes, Random rnd) {
        int id = nodes.size();
        Node node = new Node();
        node.value = mean(t, idx);
        nodes.add(node);

        if (depth >= maxDepth || idx.length < 2 * minSamplesLeaf) {
            return id;
        }

        Split best = bestSplit(x, t, idx, rnd);
        if (best == null) {
            return id;
        }

        int[] l = Arrays.stream(idx).filter(i -> x[i][best.feature] <= best.threshold).toArray();
        int[] r = Arrays.stream(idx).filter(i -> x[i][best.feature] > best.threshold).toArray();

        node.feature = best.feature;
        node.threshold = best.threshold;
        node.gain = best.gain;
        node.left = grow(x, t, l, depth + 1, nodes, rnd);
        node.right = grow(x, t, r, depth + 1, nodes, rnd);
        return id;
    }

    private Split bestSplit(double[][] x, double[][] t, int[] idx, Random rnd) {
        int features = x[idx[0]].length;
        int outputs = t[idx[0]].length;
        int n = idx.length;

        double[] total = new double[outputs];
        for (int i : idx) for (int k = 0; k < outputs; k++) total[k] += t[i][k];

        Split best = null;
        double bestGain = 1e-12;

        for (int f : candidateFeatures(features, rnd)) {
            Integer[] order = new Integer[n];
            for (int j = 0; j < n; j++) order[j] = idx[j];
            Arrays.sort(order, Comparator.comparingDouble(i -> x[i][f]));

            double[] leftSum = new double[outputs];
            for (int j = 0; j < n - 1; j++) {
                int i = order[j];
                for (int k = 0; k < outputs; k++) leftSum[k] += t[i][k];

                int nl = j + 1;
                int nr = n - nl;
                if (nl < minSamplesLeaf) continue;
                if (nr < minSamplesLeaf) break;

                double xv = x[i][f];
                double xn = x[order[j + 1]][f];
                if (xv == xn) continue;

                // уменьшение SSE = sum_k (L_k^2/nl + R_k^2/nr - T_k^2/n)
                double gain = 0;
                for (int k = 0; k < outputs; k++) {
                    double r = total[k] - leftSum[k];
                    gain += leftSum[k] * leftSum[k] / nl + r * r / nr - total[k] * total[k] / n;
                }
                if (gain > bestGain) {
                    bestGain = gain;
                    best = new Split(f, (xv + xn) / 2.0, gain);
                }
            }
        }
        return best;
    }

    private int[] candidateFeatures(int features, Random rnd) {
        if (featureFraction >= 1.0) {
            int[] all = new int[features];
            for (int i = 0; i < features; i++) all[i] = i;
            return all;
        }
        int k = Math.max(1, (int) Math.round(features * featureFraction));
        int[] perm = new int[features];
        for (int i = 0; i < features; i++) perm[i] = i;
        for (int i = features - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = perm[i];
            perm[i] = perm[j];
            perm[j] = tmp;
        }
        return Arrays.copyOf(perm, k);
    }

    private static double[] mean(double[][] t, int[] idx) {
        int outputs = t[idx[0]].length;
        double[] m = new double[outputs];
        for (int i : idx) for (int k = 0; k < outputs; k++) m[k] += t[i][k];
        for (int k = 0; k < outputs; k++) m[k] /= idx.length;
        return m;
    }

    private static final class Node {
        int feature = -1;
        double threshold;
        int left = -1;
        int right = -1;
        double[] value;
        double gain;
    }

    private record Split(int feature, double threshold, double gain) {}
}
