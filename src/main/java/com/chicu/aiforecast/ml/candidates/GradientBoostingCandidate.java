package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.ml.tree.FlatTree;
import com.chicu.aiforecast.ml.tree.RegressionTreeBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Градиентный бустинг неглубоких деревьев.
 * Регрессия: least squares, старт со среднего.
 * Классификация: softmax, каждое дерево приближает (one-hot - p) по всем классам сразу.
 */
public class GradientBoostingCandidate implements Candidate {

    public static final String ID = "gradient_boosting";

    private final TrainingProperties.Boosting cfg;

    public GradientBoostingCandidate(TrainingProperties.Boosting cfg) {
        this.cfg = cfg;
    }

    @Override
    public String algorithmId() {
        return ID;
    }

    @Override
    public boolean supports(TargetKind kind) {
        return true;
    }

    @Override
    public FittedModel fit(TrainingData data, long seed) {
        Random rnd = new Random(seed);
        RegressionTreeBuilder builder = new RegressionTreeBuilder(cfg.getMaxDepth(), cfg.getMinSamplesLeaf(), 1.0);

        double[][] x = data.x();
        double[][] t = data.targetMatrix();
        int n = data.samples();
        int outputs = t[0].length;
        double lr = cfg.getLearningRate();
        boolean softmax = data.classification();

        double[] init = softmax ? logPriors(t) : mean(t);

        double[][] f = new double[n][];
        for (int i = 0; i < n; i++) f[i] = init.clone();

        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;

        List<FlatTree> trees = new ArrayList<>();
        double[][] residual = new double[n][outputs];

        for (int round = 0; round < Math.max(1, cfg.getRounds()); round++) {
            for (int i = 0; i < n; i++) {
                double[] p = softmax ? Softmax.apply(f[i]) : f[i];
                for (int k = 0; k < outputs; k++) residual[i][k] = t[i][k] - p[k];
            }

            FlatTree tree = builder.build(x, residual, all, rnd);
            trees.add(tree);

            for (int i = 0; i < n; i++) {
                double[] v = tree.predict(x[i]);
                for (int k = 0; k < outputs; k++) f[i][k] += lr * v[k];
            }
        }

        return new TreeEnsembleModel(TreeEnsembleModel.Aggregation.BOOSTED, init, lr, softmax, trees);
    }

    private static double[] mean(double[][] t) {
        double[] m = new double[t[0].length];
        for (double[] row : t) for (int k = 0; k < m.length; k++) m[k] += row[k];
        for (int k = 0; k < m.length; k++) m[k] /= t.length;
        return m;
    }

    /**
     * log сглаженных частот классов (Лаплас), чтобы отсутствующий класс не давал -inf.
     */
    private static double[] logPriors(double[][] t) {
        int k = t[0].length;
        double[] counts = new double[k];
        for (double[] row : t) for (int c = 0; c < k; c++) counts[c] += row[c];
        double[] out = new double[k];
        for (int c = 0; c < k; c++) out[c] = Math.log((counts[c] + 1.0) / (t.length + k));
        return out;
    }
}
