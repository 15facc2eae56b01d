package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.ml.tree.FlatTree;
import com.chicu.aiforecast.ml.tree.RegressionTreeBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Бэггинг CART-деревьев со случайным подмножеством фич.
 * Для классификации листья хранят доли классов, предсказание — усреднённые вероятности.
 */
public class RandomForestCandidate implements Candidate {

    public static final String ID = "random_forest";

    private final TrainingProperties.Forest cfg;

    public RandomForestCandidate(TrainingProperties.Forest cfg) {
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
        RegressionTreeBuilder builder = new RegressionTreeBuilder(
                cfg.getMaxDepth(), cfg.getMinSamplesLeaf(), cfg.getFeatureFraction());

        double[][] t = data.targetMatrix();
        int n = data.samples();
        int trees = Math.max(1, cfg.getTrees());

        List<FlatTree> out = new ArrayList<>(trees);
        for (int m = 0; m < trees; m++) {
            int[] boot = new int[n];
            for (int i = 0; i < n; i++) boot[i] = rnd.nextInt(n);
            out.add(builder.build(data.x(), t, boot, rnd));
        }

        return new TreeEnsembleModel(
                TreeEnsembleModel.Aggregation.AVERAGE,
                new double[t[0].length],
                1.0,
                false,
                out
        );
    }
}
