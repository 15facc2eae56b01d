package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;

/**
 * Ridge-регрессия на стандартизированных фичах: (ZᵀZ + λn·I) w = Zᵀ(y - ȳ), bias = ȳ.
 */
public class LinearRegressionCandidate implements Candidate {

    public static final String ID = "linear_regression";

    private final double ridge;

    public LinearRegressionCandidate(double ridge) {
        this.ridge = Math.max(0, ridge);
    }

    @Override
    public String algorithmId() {
        return ID;
    }

    @Override
    public boolean supports(TargetKind kind) {
        return kind.isRegression();
    }

    @Override
    public FittedModel fit(TrainingData data, long seed) {
        Standardizer st = Standardizer.fit(data.x());
        double[][] z = st.apply(data.x());
        int n = z.length;
        int f = z[0].length;

        double yMean = 0;
        for (double v : data.y()) yMean += v;
        yMean /= n;

        double[][] a = new double[f][f + 1];
        for (int i = 0; i < n; i++) {
            double yc = data.y()[i] - yMean;
            for (int p = 0; p < f; p++) {
                for (int q = 0; q < f; q++) a[p][q] += z[i][p] * z[i][q];
                a[p][f] += z[i][p] * yc;
            }
        }
        double lambda = Math.max(ridge * n, 1e-9);
        for (int p = 0; p < f; p++) a[p][p] += lambda;

        double[] w = solve(a, f);
        return new LinearModel(st.mean(), st.scale(), new double[][]{w}, new double[]{yMean}, false);
    }

    /**
     * Гаусс с выбором главного элемента; a — расширенная матрица [f][f+1].
     */
    static double[] solve(double[][] a, int f) {
        for (int col = 0; col < f; col++) {
            int pivot = col;
            for (int r = col + 1; r < f; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) pivot = r;
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;

            double d = a[col][col];
            if (Math.abs(d) < 1e-12) continue;
            for (int r = col + 1; r < f; r++) {
                double factor = a[r][col] / d;
                if (factor == 0) continue;
                for (int c = col; c <= f; c++) a[r][c] -= factor * a[col][c];
            }
        }

        double[] w = new double[f];
        for (int r = f - 1; r >= 0; r--) {
            double d = a[r][r];
            if (Math.abs(d) < 1e-12) {
                w[r] = 0;
                continue;
            }
            double s = a[r][f];
            for (int c = r + 1; c < f; c++) s -= a[r][c] * w[c];
            w[r] = s / d;
        }
        return w;
    }
}
