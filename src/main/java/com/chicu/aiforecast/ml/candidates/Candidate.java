package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;

/**
 * Алгоритм-кандидат. Все кандидаты получают один и тот же упорядоченный вектор фич.
 */
public interface Candidate {

    String algorithmId();

    boolean supports(TargetKind kind);

    /**
     * @param seed зерно для случайности внутри алгоритма (бутстрап, подвыборка фич)
     */
    FittedModel fit(TrainingData data, long seed);
}
