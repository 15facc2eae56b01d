package com.chicu.aiforecast.ml.eval;

import com.chicu.aiforecast.ml.candidates.LinearRegressionCandidate;
import com.chicu.aiforecast.ml.candidates.LogisticRegressionCandidate;
import com.chicu.aiforecast.ml.candidates.TrainingData;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CrossValidatorTest {

    @Test
    void evaluate_linearData_shouldScoreNearPerfectR2() {
        Random rnd = new Random(7);
        double[][] x = new double[60][2];
        double[] y = new double[60];
        for (int i = 0; i < 60; i++) {
            x[i][0] = rnd.nextDouble() * 10;
            x[i][1] = rnd.nextDouble() * 10;
            y[i] = 3 * x[i][0] - 2 * x[i][1] + 5;
        }

        CandidateMetrics m = new CrossValidator(5, 42L)
                .evaluate(new LinearRegressionCandidate(1e-6), new TrainingData(x, y, 0));

        assertEquals("r2", m.primaryMetric());
        assertEquals("rmse", m.secondaryMetric());
        assertTrue(m.primary() > 0.999, "r2=" + m.primary());
        assertEquals(5, m.folds());
        assertEquals(5, m.foldScores().size());
        assertEquals(60, m.samples());
    }

    @Test
    void evaluate_separableClasses_shouldReportAccuracyAndLogLoss() {
        double[][] x = new double[40][1];
        double[] y = new double[40];
        for (int i = 0; i < 40; i++) {
            x[i][0] = i < 20 ? -5 - i * 0.1 : 5 + i * 0.1;
            y[i] = i < 20 ? 0 : 1;
        }

        CandidateMetrics m = new CrossValidator(4, 42L)
                .evaluate(new LogisticRegressionCandidate(400, 0.5, 1e-3), new TrainingData(x, y, 2));

        assertEquals("accuracy", m.primaryMetric());
        assertEquals("log_loss", m.secondaryMetric());
        assertEquals(1.0, m.primary(), 1e-12);
        assertTrue(m.secondary() >= 0 && m.secondary() < 0.5, "log_loss=" + m.secondary());
    }

    @Test
    void argmax_tieShouldPickFirst() {
        assertEquals(1, CrossValidator.argmax(new double[]{0.1, 0.45, 0.45}));
    }
}
