package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.ml.tree.FlatTree;

import java.util.List;

/**
 * Ансамбль деревьев.
 * AVERAGE (random forest): среднее выходов деревьев.
 * BOOSTED (gradient boosting): init + shrinkage * сумма, для классификации — softmax.
 */
public record TreeEnsembleModel(
        Aggregation aggregation,
        double[] init,
        double shrinkage,
        boolean softmax,
        List<FlatTree> trees
) implements FittedModel {

    public enum Aggregation { AVERAGE, BOOSTED }

    @Override
    public double[] predictRaw(double[] x) {
        int outputs = init.length;
        double[] out = new double[outputs];

        if (aggregation == Aggregation.AVERAGE) {
            for (FlatTree t : trees) {
                double[] v = t.predict(x);
                for (int k = 0; k < outputs; k++) out[k] += v[k];
            }
            if (!trees.isEmpty()) {
                for (int k = 0; k < outputs; k++) out[k] /= trees.size();
            }
        } else {
            System.arraycopy(init, 0, out, 0, outputs);
            for (FlatTree t : trees) {
                double[] v = t.predict(x);
                for (int k = 0; k < outputs; k++) out[k] += shrinkage * v[k];
            }
        }
        return softmax ? Softmax.apply(out) : out;
    }

    /**
     * Суммарный gain сплитов по фиче, нормированный на весь ансамбль.
     * Ансамбль из одних листьев → пустой массив.
     */
    @Override
    public double[] featureImportance(int features) {
        double[] acc = new double[features];
        for (FlatTree t : trees) {
            t.accumulateGain(acc);
        }
        double total = 0;
        for (double v : acc) total += v;
        if (!(total > 0)) return new double[0];
        for (int f = 0; f < features; f++) acc[f] /= total;
        return acc;
    }
}
