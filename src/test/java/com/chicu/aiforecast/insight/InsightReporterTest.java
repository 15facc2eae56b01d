package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.common.enums.TrendDirection;
import com.chicu.aiforecast.config.InsightProperties;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.ml.candidates.TreeEnsembleModel;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.storage.DatasetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InsightReporterTest {

    @TempDir
    Path tmp;

    private DatasetStore store;
    private ModelRegistry registry;
    private InsightReporter reporter;

    @BeforeEach
    void setUp() {
        PipelineProperties props = TestData.pipelineProps(tmp);
        store = new DatasetStore(props, TestData.objectMapper());
        registry = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        reporter = new InsightReporter(store, registry, new InsightProperties(), new TrainingProperties(), TestData.clock());
    }

    @Test
    void getTrends_growingCases_shouldBeIncreasing() {
        commit(TestData.epidemicTable(12, 100, 10), TestData.NOW);

        TrendReport report = reporter.getTrends("epidemic", 30);

        MetricTrend cases = report.perMetric().get("cases");
        assertEquals(TrendDirection.INCREASING, cases.direction());
        assertEquals(10.0, cases.slope(), 1e-9);
        assertEquals(210.0, cases.currentValue(), 1e-9);
        assertEquals(12, cases.samples());
        assertEquals(TestData.NOW, report.to());
        assertEquals(List.of("cases", "deaths", "recovered"), List.copyOf(report.perMetric().keySet()));
    }

    @Test
    void getTrends_flatCases_shouldBeStable() {
        commit(TestData.epidemicTable(12, 100, 0), TestData.NOW);

        MetricTrend cases = reporter.getTrends("epidemic", 30).perMetric().get("cases");

        assertEquals(TrendDirection.STABLE, cases.direction());
        assertEquals(0.0, cases.magnitude(), 0.0);
    }

    @Test
    void getTrends_windowShouldLimitRecords() {
        commit(TestData.epidemicTable(12, 100, 10), TestData.NOW);

        TrendReport report = reporter.getTrends("epidemic", 3);

        assertEquals(4, report.perMetric().get("cases").samples(), "последние 3 дня включительно");
        assertEquals(TestData.NOW.minus(Duration.ofDays(3)), report.from());
    }

    @Test
    void getTrends_withoutSnapshot_shouldBeEmpty_andUnknownSourceRejected() {
        TrendReport report = reporter.getTrends("market", 30);

        assertTrue(report.perMetric().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> reporter.getTrends("crypto", 30));
    }

    @Test
    void getInsights_shouldSummariseAndRecommend() {
        commit(TestData.epidemicTable(12, 100, 10), TestData.NOW.minus(Duration.ofHours(48)));

        InsightReport report = reporter.getInsights();

        SourceSummary epidemic = report.perSourceSummary().get("epidemic");
        assertTrue(epidemic.available());
        assertTrue(epidemic.stale());
        assertEquals(12, epidemic.recordCount());
        assertEquals(155.0, epidemic.metrics().get("cases").mean(), 1e-9);
        assertFalse(report.perSourceSummary().get("weather").available());
        assertTrue(report.perModelSummary().isEmpty());

        assertTrue(has(report, "rerun_collection", "epidemic"), "устаревший снапшот");
        assertTrue(has(report, "rerun_collection", "weather"), "нет снапшота");
        assertTrue(has(report, "no_model", "covid_forecast"));
        assertTrue(has(report, "no_model", "weather_classification"));
        assertEquals(TestData.NOW, report.generatedAt());
    }

    @Test
    void getInsights_treeModel_shouldExposeFeatureImportance() {
        CandidateMetrics metrics = CandidateMetrics.builder()
                .primaryMetric("r2").primary(0.8)
                .secondaryMetric("rmse").secondary(2.0)
                .folds(3)
                .samples(40)
                .build();
        registry.publish(ModelArtifact.builder()
                .modelName("stock_prediction")
                .targetKind(TargetKind.FORECAST)
                .algorithmId("gradient_boosting")
                .featureNames(List.of("close", "volume"))
                .schemaHash("h")
                .params(new TreeEnsembleModel(TreeEnsembleModel.Aggregation.BOOSTED, new double[]{0}, 0.1, false, List.of()))
                .metrics(metrics)
                .featureImportance(Map.of("close", 0.75, "volume", 0.25))
                .sampleCount(40)
                .trainedAt(TestData.NOW)
                .build());

        ModelSummary summary = reporter.getInsights().perModelSummary().get("stock_prediction");

        assertNotNull(summary);
        assertEquals("gradient_boosting", summary.algorithmId());
        assertEquals(0.75, summary.featureImportance().get("close"), 1e-12);
        assertEquals(0.25, summary.featureImportance().get("volume"), 1e-12);
    }

    private void commit(FeatureTable table, Instant collectedAt) {
        store.commit(List.of(store.stage(table, List.of(), collectedAt, 0, false, null)));
    }

    private static boolean has(InsightReport report, String type, String target) {
        return report.recommendations().stream()
                .anyMatch(r -> r.type().equals(type) && r.target().equals(target));
    }

    @Test
    void sourceKindIds_shouldMatchSummaryKeys() {
        InsightReport report = reporter.getInsights();

        for (SourceKind k : SourceKind.values()) {
            assertTrue(report.perSourceSummary().containsKey(k.id()));
        }
    }
}
