package com.chicu.aiforecast.ml.eval;

import lombok.Builder;

import java.util.List;

/**
 * Метрики кандидата на out-of-fold предсказаниях.
 * primary: r2 / accuracy (больше — лучше), secondary: rmse / log_loss (меньше — лучше).
 */
@Builder
public record CandidateMetrics(
        String primaryMetric,
        double primary,
        String secondaryMetric,
        double secondary,
        Double mae,
        List<Double> foldScores,
        int folds,
        int samples
) {}
