package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;

/**
 * Softmax-регрессия, полный градиентный спуск с L2.
 */
public class LogisticRegressionCandidate implements Candidate {

    public static final String ID = "logistic_regression";

    private final int iterations;
    private final double learningRate;
    private final double l2;

    public LogisticRegressionCandidate(int iterations, double learningRate, double l2) {
        this.iterations = Math.max(1, iterations);
        this.learningRate = learningRate;
        this.l2 = Math.max(0, l2);
    }

    @Override
    public String algorithmId() {
        return ID;
    }

    @Override
    public boolean supports(TargetKind kind) {
        return kind == TargetKind.CLASSIFICATION;
    }

    @Override
    public FittedModel fit(TrainingData data, long seed) {
        if (!data.classification()) throw new IllegalArgumentException(ID + " требует классы");

        Standardizer st = Standardizer.fit(data.x());
        double[][] z = st.apply(data.x());
        double[][] t = data.targetMatrix();
        int n = z.length;
        int f = z[0].length;
        int k = data.numClasses();

        double[][] w = new double[k][f];
        double[] b = new double[k];

        for (int it = 0; it < iterations; it++) {
            double[][] gw = new double[k][f];
            double[] gb = new double[k];

            for (int i = 0; i < n; i++) {
                double[] logits = new double[k];
                for (int c = 0; c < k; c++) {
                    double s = b[c];
                    for (int j = 0; j < f; j++) s += w[c][j] * z[i][j];
                    logits[c] = s;
                }
                double[] p = Softmax.apply(logits);
                for (int c = 0; c < k; c++) {
                    double err = p[c] - t[i][c];
                    gb[c] += err;
                    for (int j = 0; j < f; j++) gw[c][j] += err * z[i][j];
                }
            }

            for (int c = 0; c < k; c++) {
                b[c] -= learningRate * gb[c] / n;
                for (int j = 0; j < f; j++) {
                    w[c][j] -= learningRate * (gw[c][j] / n + l2 * w[c][j]);
                }
            }
        }
        return new LinearModel(st.mean(), st.scale(), w, b, true);
    }
}
