package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.ml.candidates.FittedModel;
import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Содержимое {@code <model>.json}: всё, кроме параметров, плюс имя params-файла.
 */
public record ModelMetadata(
        String modelName,
        TargetKind targetKind,
        String algorithmId,
        List<String> featureNames,
        String schemaHash,
        CandidateMetrics metrics,
        List<CandidateEvaluation> candidateScores,
        List<String> classLabels,
        Map<String, Double> featureImportance,
        int sampleCount,
        Instant trainedAt,
        Instant sourceSnapshotAt,
        long generation,
        String paramsFile
) {

    public static ModelMetadata of(ModelArtifact a, long generation, String paramsFile) {
        return new ModelMetadata(
                a.modelName(),
                a.targetKind(),
                a.algorithmId(),
                a.featureNames(),
                a.schemaHash(),
                a.metrics(),
                a.candidateScores(),
                a.classLabels(),
                a.featureImportance(),
                a.sampleCount(),
                a.trainedAt(),
                a.sourceSnapshotAt(),
                generation,
                paramsFile
        );
    }

    public ModelArtifact toArtifact(FittedModel params) {
        return ModelArtifact.builder()
                .modelName(modelName)
                .targetKind(targetKind)
                .algorithmId(algorithmId)
                .featureNames(featureNames)
                .schemaHash(schemaHash)
                .params(params)
                .metrics(metrics)
                .candidateScores(candidateScores)
                .classLabels(classLabels)
                .featureImportance(featureImportance)
                .sampleCount(sampleCount)
                .trainedAt(trainedAt)
                .sourceSnapshotAt(sourceSnapshotAt)
                .build();
    }
}
