package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.ml.candidates.LinearModel;
import com.chicu.aiforecast.ml.candidates.TreeEnsembleModel;
import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import com.chicu.aiforecast.ml.tree.FlatTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    @TempDir
    Path tmp;

    @Test
    void publish_thenReload_shouldRestoreSameModel() {
        PipelineProperties props = TestData.pipelineProps(tmp);
        ModelRegistry registry = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        registry.publish(linear("covid_forecast", 1.0));

        ModelRegistry reloaded = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        reloaded.load();

        ModelArtifact a = reloaded.find("covid_forecast").orElseThrow();
        assertEquals("linear_regression", a.algorithmId());
        assertEquals(List.of("featureA", "featureB"), a.featureNames());
        assertEquals(0.93, a.metrics().primary(), 1e-12);
        assertEquals(TestData.NOW, a.trainedAt());
        assertEquals(1, a.candidateScores().size());
        assertArrayEquals(new double[]{5.0}, a.params().predictRaw(new double[]{1, 1}), 1e-12);
    }

    @Test
    void publish_twice_shouldReplaceModelAndDeleteOldParams() throws Exception {
        ModelRegistry registry = new ModelRegistry(TestData.pipelineProps(tmp), TestData.objectMapper(), TestData.clock());

        registry.publish(linear("m", 1.0));
        registry.publish(linear("m", 10.0));

        assertArrayEquals(new double[]{14.0}, registry.find("m").orElseThrow().params().predictRaw(new double[]{1, 1}), 1e-12);
        try (Stream<Path> files = Files.list(tmp.resolve("models"))) {
            long params = files.filter(p -> p.getFileName().toString().startsWith("m-params-")).count();
            assertEquals(1, params, "старый params-файл должен быть удалён");
        }
    }

    @Test
    void treeEnsemble_shouldSurviveJsonRoundTrip() {
        PipelineProperties props = TestData.pipelineProps(tmp);
        FlatTree stump = new FlatTree(
                new int[]{0, -1, -1},
                new double[]{0.5, 0, 0},
                new int[]{1, -1, -1},
                new int[]{2, -1, -1},
                new double[][]{{0}, {-1}, {1}},
                new double[]{4.0, 0, 0});
        TreeEnsembleModel params = new TreeEnsembleModel(
                TreeEnsembleModel.Aggregation.AVERAGE, new double[]{0}, 1.0, false, List.of(stump));

        new ModelRegistry(props, TestData.objectMapper(), TestData.clock()).publish(
                linear("stock_prediction", 0).toBuilder()
                        .algorithmId("random_forest")
                        .params(params)
                        .featureImportance(Map.of("featureA", 1.0, "featureB", 0.0))
                        .build());

        ModelRegistry reloaded = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        reloaded.load();

        ModelArtifact a = reloaded.find("stock_prediction").orElseThrow();
        assertInstanceOf(TreeEnsembleModel.class, a.params());
        assertEquals(1.0, a.params().predictRaw(new double[]{0.9})[0], 1e-12);
        assertEquals(-1.0, a.params().predictRaw(new double[]{0.1})[0], 1e-12);
        assertEquals(Map.of("featureA", 1.0, "featureB", 0.0), a.featureImportance());
        assertArrayEquals(new double[]{1.0, 0.0}, a.params().featureImportance(2), 1e-12, "gain сплитов пережил JSON");
    }

    @Test
    void load_withoutDirectory_shouldStartEmpty() {
        ModelRegistry registry = new ModelRegistry(TestData.pipelineProps(tmp), TestData.objectMapper(), TestData.clock());
        registry.load();

        assertTrue(registry.all().isEmpty());
        assertTrue(registry.find("covid_forecast").isEmpty());
    }

    private static ModelArtifact linear(String name, double bias) {
        CandidateMetrics metrics = CandidateMetrics.builder()
                .primaryMetric("r2").primary(0.93)
                .secondaryMetric("rmse").secondary(1.2)
                .mae(0.9)
                .foldScores(List.of(0.9, 0.95))
                .folds(2)
                .samples(30)
                .build();
        return ModelArtifact.builder()
                .modelName(name)
                .targetKind(TargetKind.FORECAST)
                .algorithmId("linear_regression")
                .featureNames(List.of("featureA", "featureB"))
                .schemaHash("abc")
                .params(new LinearModel(new double[]{0, 0}, new double[]{1, 1}, new double[][]{{2, 2}}, new double[]{bias}, false))
                .metrics(metrics)
                .candidateScores(List.of(CandidateEvaluation.builder().algorithmId("linear_regression").metrics(metrics).build()))
                .sampleCount(30)
                .trainedAt(TestData.NOW)
                .sourceSnapshotAt(TestData.NOW)
                .build();
    }
}
