package com.chicu.aiforecast.ml.candidates;

/**
 * Линейная модель на стандартизированных фичах.
 * weights[k] — веса выхода k; softmax=true → выходы нормируются в вероятности.
 */
public record LinearModel(
        double[] mean,
        double[] scale,
        double[][] weights,
        double[] bias,
        boolean softmax
) implements FittedModel {

    @Override
    public double[] predictRaw(double[] x) {
        double[] z = standardize(x, mean, scale);
        double[] out = new double[weights.length];
        for (int k = 0; k < weights.length; k++) {
            double s = bias[k];
            for (int j = 0; j < z.length; j++) s += weights[k][j] * z[j];
            out[k] = s;
        }
        return softmax ? Softmax.apply(out) : out;
    }

    static double[] standardize(double[] x, double[] mean, double[] scale) {
        double[] z = new double[x.length];
        for (int j = 0; j < x.length; j++) z[j] = (x[j] - mean[j]) / scale[j];
        return z;
    }
}
