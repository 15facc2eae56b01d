package com.chicu.aiforecast.ml.eval;

import com.chicu.aiforecast.ml.candidates.Candidate;
import com.chicu.aiforecast.ml.candidates.FittedModel;
import com.chicu.aiforecast.ml.candidates.TrainingData;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * k-fold с детерминированным перемешиванием (seed). Метрики считаются по объединённым
 * out-of-fold предсказаниям, плюс primary по каждому фолду отдельно.
 */
public class CrossValidator {

    private static final double EPS = 1e-15;

    private final int folds;
    private final long seed;

    public CrossValidator(int folds, long seed) {
        this.folds = Math.max(2, folds);
        this.seed = seed;
    }

    public CandidateMetrics evaluate(Candidate candidate, TrainingData data) {
        int n = data.samples();
        if (n < 2) throw new IllegalArgumentException("для кросс-валидации нужно >= 2 сэмплов, есть " + n);

        int k = Math.min(folds, n);
        int[] foldOf = assignFolds(n, k);

        double[][] oof = new double[n][];
        List<Double> foldScores = new ArrayList<>(k);

        for (int fold = 0; fold < k; fold++) {
            int[] train = indices(foldOf, fold, false);
            int[] test = indices(foldOf, fold, true);

            FittedModel model = candidate.fit(data.subset(train), seed + fold);
            for (int i : test) {
                oof[i] = model.predictRaw(data.x()[i]);
            }
            foldScores.add(primaryOn(data, oof, test));
        }

        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;

        if (data.classification()) {
            return CandidateMetrics.builder()
                    .primaryMetric("accuracy")
                    .primary(accuracy(data.y(), oof, all))
                    .secondaryMetric("log_loss")
                    .secondary(logLoss(data.y(), oof))
                    .foldScores(foldScores)
                    .folds(k)
                    .samples(n)
                    .build();
        }

        double[] pred = new double[n];
        for (int i = 0; i < n; i++) pred[i] = oof[i][0];
        return CandidateMetrics.builder()
                .primaryMetric("r2")
                .primary(r2(data.y(), pred, all))
                .secondaryMetric("rmse")
                .secondary(rmse(data.y(), pred))
                .mae(mae(data.y(), pred))
                .foldScores(foldScores)
                .folds(k)
                .samples(n)
                .build();
    }

    int[] assignFolds(int n, int k) {
        int[] perm = new int[n];
        for (int i = 0; i < n; i++) perm[i] = i;
        Random rnd = new Random(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = perm[i];
            perm[i] = perm[j];
            perm[j] = tmp;
        }
        int[] foldOf = new int[n];
        for (int pos = 0; pos < n; pos++) foldOf[perm[pos]] = pos % k;
        return foldOf;
    }

    private static int[] indices(int[] foldOf, int fold, boolean inFold) {
        int cnt = 0;
        for (int f : foldOf) if ((f == fold) == inFold) cnt++;
        int[] out = new int[cnt];
        int at = 0;
        for (int i = 0; i < foldOf.length; i++) {
            if ((foldOf[i] == fold) == inFold) out[at++] = i;
        }
        return out;
    }

    private static double primaryOn(TrainingData data, double[][] oof, int[] idx) {
        if (data.classification()) return accuracy(data.y(), oof, idx);
        double[] pred = new double[oof.length];
        for (int i : idx) pred[i] = oof[i][0];
        return r2(data.y(), pred, idx);
    }

    // ====== метрики ======

    static double r2(double[] y, double[] pred, int[] idx) {
        double mean = 0;
        for (int i : idx) mean += y[i];
        mean /= idx.length;
        double ssRes = 0, ssTot = 0;
        for (int i : idx) {
            ssRes += (y[i] - pred[i]) * (y[i] - pred[i]);
            ssTot += (y[i] - mean) * (y[i] - mean);
        }
        if (ssTot == 0) return ssRes == 0 ? 1.0 : 0.0;
        return 1 - ssRes / ssTot;
    }

    static double rmse(double[] y, double[] pred) {
        double s = 0;
        for (int i = 0; i < y.length; i++) s += (y[i] - pred[i]) * (y[i] - pred[i]);
        return Math.sqrt(s / y.length);
    }

    static double mae(double[] y, double[] pred) {
        double s = 0;
        for (int i = 0; i < y.length; i++) s += Math.abs(y[i] - pred[i]);
        return s / y.length;
    }

    static double accuracy(double[] y, double[][] proba, int[] idx) {
        int hit = 0;
        for (int i : idx) {
            if (argmax(proba[i]) == (int) y[i]) hit++;
        }
        return (double) hit / idx.length;
    }

    static double logLoss(double[] y, double[][] proba) {
        double s = 0;
        for (int i = 0; i < y.length; i++) {
            double p = proba[i][(int) y[i]];
            p = Math.min(1 - EPS, Math.max(EPS, p));
            s -= Math.log(p);
        }
        return s / y.length;
    }

    public static int argmax(double[] v) {
        int best = 0;
        for (int k = 1; k < v.length; k++) {
            if (v[k] > v[best]) best = k;
        }
        return best;
    }
}
