package com.chicu.aiforecast.ml.eval;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WinnerSelectorTest {

    @Test
    void select_shouldPreferHigherPrimary() {
        CandidateEvaluation a = eval("a", 0.7, 1.0);
        CandidateEvaluation b = eval("b", 0.9, 2.0);

        assertEquals("b", WinnerSelector.select(List.of(a, b)).orElseThrow().algorithmId());
    }

    @Test
    void select_equalPrimary_shouldPreferLowerSecondary_thenEarlierCandidate() {
        CandidateEvaluation a = eval("a", 0.8, 2.0);
        CandidateEvaluation b = eval("b", 0.8, 1.0);
        CandidateEvaluation c = eval("c", 0.8, 1.0);

        assertEquals("b", WinnerSelector.select(List.of(a, b, c)).orElseThrow().algorithmId());
    }

    @Test
    void select_shouldSkipFailedCandidates() {
        CandidateEvaluation failed = CandidateEvaluation.builder().algorithmId("x").error("boom").build();

        assertTrue(WinnerSelector.select(List.of(failed)).isEmpty());
        assertEquals("a", WinnerSelector.select(List.of(failed, eval("a", 0.1, 9))).orElseThrow().algorithmId());
    }

    private static CandidateEvaluation eval(String id, double primary, double secondary) {
        return CandidateEvaluation.builder()
                .algorithmId(id)
                .metrics(CandidateMetrics.builder()
                        .primaryMetric("r2")
                        .primary(primary)
                        .secondaryMetric("rmse")
                        .secondary(secondary)
                        .build())
                .build();
    }
}
