package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.ml.candidates.FittedModel;
import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Опубликованная модель. Неизменяема: следующий успешный прогон заменяет её целиком.
 */
@Builder(toBuilder = true)
public record ModelArtifact(
        String modelName,
        TargetKind targetKind,
        String algorithmId,
        List<String> featureNames,
        String schemaHash,
        FittedModel params,
        CandidateMetrics metrics,
        List<CandidateEvaluation> candidateScores,
        List<String> classLabels,
        Map<String, Double> featureImportance,
        int sampleCount,
        Instant trainedAt,
        Instant sourceSnapshotAt
) {
    public ModelArtifact {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        candidateScores = candidateScores == null ? List.of() : List.copyOf(candidateScores);
        classLabels = classLabels == null ? List.of() : List.copyOf(classLabels);
        featureImportance = featureImportance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
    }
}
