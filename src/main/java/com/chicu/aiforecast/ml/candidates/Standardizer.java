package com.chicu.aiforecast.ml.candidates;

/**
 * z = (x - mean) / scale по колонкам; колонка-константа получает scale = 1.
 */
record Standardizer(double[] mean, double[] scale) {

    static Standardizer fit(double[][] x) {
        int n = x.length;
        int f = x[0].length;
        double[] mean = new double[f];
        double[] scale = new double[f];
        for (double[] row : x) for (int j = 0; j < f; j++) mean[j] += row[j];
        for (int j = 0; j < f; j++) mean[j] /= n;
        for (double[] row : x) for (int j = 0; j < f; j++) scale[j] += (row[j] - mean[j]) * (row[j] - mean[j]);
        for (int j = 0; j < f; j++) {
            double std = Math.sqrt(scale[j] / n);
            scale[j] = std > 1e-12 ? std : 1.0;
        }
        return new Standardizer(mean, scale);
    }

    double[][] apply(double[][] x) {
        double[][] z = new double[x.length][];
        for (int i = 0; i < x.length; i++) z[i] = apply(x[i]);
        return z;
    }

    double[] apply(double[] x) {
        return LinearModel.standardize(x, mean, scale);
    }
}
