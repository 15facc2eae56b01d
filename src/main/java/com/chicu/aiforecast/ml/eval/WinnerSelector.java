package com.chicu.aiforecast.ml.eval;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Победитель: primary по убыванию → secondary по возрастанию → порядок кандидатов.
 */
public final class WinnerSelector {

    private WinnerSelector() {
    }

    public static Optional<CandidateEvaluation> select(List<CandidateEvaluation> evaluations) {
        CandidateEvaluation best = null;
        Comparator<CandidateMetrics> cmp = Comparator
                .comparingDouble(CandidateMetrics::primary).reversed()
                .thenComparingDouble(CandidateMetrics::secondary);

        for (CandidateEvaluation e : evaluations) {
            if (!e.ok()) continue;
            if (!Double.isFinite(e.metrics().primary())) continue;
            // строго лучше — иначе остаётся кандидат, стоящий раньше
            if (best == null || cmp.compare(e.metrics(), best.metrics()) < 0) {
                best = e;
            }
        }
        return Optional.ofNullable(best);
    }
}
