package com.chicu.aiforecast.ml.candidates;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.config.TrainingProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Фиксированные наборы кандидатов. Порядок в списке — последний тай-брейк при выборе победителя.
 */
@Component
public class CandidateCatalog {

    private final List<Candidate> regression;
    private final List<Candidate> classification;

    public CandidateCatalog(TrainingProperties props) {
        this.regression = List.of(
                new LinearRegressionCandidate(props.getLinear().getRidge()),
                new RandomForestCandidate(props.getForest()),
                new GradientBoostingCandidate(props.getBoosting())
        );
        this.classification = List.of(
                new LogisticRegressionCandidate(
                        props.getLinear().getIterations(),
                        props.getLinear().getLearningRate(),
                        props.getLinear().getL2()),
                new RandomForestCandidate(props.getForest()),
                new GradientBoostingCandidate(props.getBoosting())
        );
    }

    public List<Candidate> forTarget(TargetKind kind) {
        return kind.isRegression() ? regression : classification;
    }
}
