package com.chicu.aiforecast.ml.candidates;

/**
 * Обучающая выборка кандидата. numClasses = 0 → регрессия, иначе y — индексы классов.
 */
public record TrainingData(
        double[][] x,
        double[] y,
        int numClasses
) {
    public TrainingData {
        if (x == null || y == null) throw new IllegalArgumentException("x/y = null");
        if (x.length != y.length) throw new IllegalArgumentException("x=" + x.length + " y=" + y.length);
        if (x.length == 0) throw new IllegalArgumentException("пустая выборка");
    }

    public int samples() {
        return x.length;
    }

    public int features() {
        return x[0].length;
    }

    public boolean classification() {
        return numClasses > 0;
    }

    public TrainingData subset(int[] idx) {
        double[][] sx = new double[idx.length][];
        double[] sy = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            sx[i] = x[idx[i]];
            sy[i] = y[idx[i]];
        }
        return new TrainingData(sx, sy, numClasses);
    }

    /**
     * Цели в виде матрицы [n][outputs]: регрессия — один столбец, классификация — one-hot.
     */
    double[][] targetMatrix() {
        int outputs = classification() ? numClasses : 1;
        double[][] t = new double[y.length][outputs];
        for (int i = 0; i < y.length; i++) {
            if (classification()) t[i][(int) y[i]] = 1.0;
            else t[i][0] = y[i];
        }
        return t;
    }
}
