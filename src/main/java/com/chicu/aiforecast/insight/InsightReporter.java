package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.config.InsightProperties;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.etl.features.ProcessedRecord;
import com.chicu.aiforecast.etl.normalize.SourceSchema;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.storage.DatasetSnapshot;
import com.chicu.aiforecast.storage.DatasetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Сводка по снапшотам и моделям + rule-based рекомендации; тренды метрик источника.
 * Только чтение DatasetStore и ModelRegistry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightReporter {

    private final DatasetStore datasetStore;
    private final ModelRegistry registry;
    private final InsightProperties props;
    private final TrainingProperties trainingProperties;
    private final Clock clock;

    public InsightReport getInsights() {
        Instant now = Instant.now(clock);

        Map<String, SourceSummary> sources = new LinkedHashMap<>();
        for (SourceKind kind : SourceKind.values()) {
            sources.put(kind.id(), summarize(kind, now));
        }

        Map<String, ModelSummary> models = new LinkedHashMap<>();
        for (ModelArtifact a : registry.all()) {
            models.put(a.modelName(), summarize(a));
        }

        List<Recommendation> recs = RecommendationRules.evaluate(
                sources, registry, trainingProperties, props.getNearMinimumFactor());

        log.info("📈 INSIGHTS sources={} models={} recommendations={}", sources.size(), models.size(), recs.size());

        return InsightReport.builder()
                .generatedAt(now)
                .perSourceSummary(sources)
                .perModelSummary(models)
                .recommendations(recs)
                .build();
    }

    /**
     * @param windowDays записи не старше windowDays от последней записи; &lt;= 0 → insights.default-window-days
     * @throws IllegalArgumentException неизвестный источник
     */
    public TrendReport getTrends(String source, int windowDays) {
        SourceKind kind = SourceKind.fromId(source);
        int days = windowDays > 0 ? windowDays : props.getDefaultWindowDays();

        Optional<FeatureTable> loaded = datasetStore.loadLatest(kind);
        if (loaded.isEmpty() || loaded.get().isEmpty()) {
            log.info("📈 TRENDS source={} нет снапшота", kind.id());
            return TrendReport.builder()
                    .source(kind.id())
                    .windowDays(days)
                    .perMetric(Map.of())
                    .build();
        }

        FeatureTable table = loaded.get();
        List<ProcessedRecord> recs = table.records();
        Instant to = recs.get(recs.size() - 1).timestamp();
        Instant from = to.minus(Duration.ofDays(days));

        List<ProcessedRecord> window = new ArrayList<>();
        for (ProcessedRecord r : recs) {
            if (!r.timestamp().isBefore(from)) window.add(r);
        }

        Map<String, MetricTrend> perMetric = new LinkedHashMap<>();
        for (String col : SourceSchema.of(kind).numericColumns()) {
            double[] y = new double[window.size()];
            for (int i = 0; i < y.length; i++) y[i] = window.get(i).value(col);
            perMetric.put(col, TrendAnalyzer.analyze(y, props.getStableThreshold()));
        }

        return TrendReport.builder()
                .source(kind.id())
                .windowDays(days)
                .from(window.get(0).timestamp())
                .to(to)
                .perMetric(perMetric)
                .build();
    }

    // =====================================================
    // helpers
    // =====================================================

    private SourceSummary summarize(SourceKind kind, Instant now) {
        try {
            Optional<DatasetSnapshot> snap = datasetStore.latest(kind);
            if (snap.isEmpty()) {
                return SourceSummary.builder().source(kind.id()).available(false).metrics(Map.of()).build();
            }
            DatasetSnapshot s = snap.get();

            Map<String, MetricSummary> metrics = new LinkedHashMap<>();
            Optional<FeatureTable> table = datasetStore.loadLatest(kind);
            if (table.isPresent()) {
                for (String col : SourceSchema.of(kind).numericColumns()) {
                    metrics.put(col, MetricSummary.of(table.get().column(col)));
                }
            }

            boolean stale = s.collectedAt() == null
                    || s.collectedAt().isBefore(now.minus(Duration.ofHours(props.getFreshnessHours())));

            return SourceSummary.builder()
                    .source(kind.id())
                    .available(true)
                    .recordCount(s.recordCount())
                    .droppedRecords(s.droppedRecords())
                    .collectedAt(s.collectedAt())
                    .degraded(s.degraded())
                    .degradedReason(s.degradedReason())
                    .stale(stale)
                    .metrics(metrics)
                    .build();

        } catch (PersistenceException e) {
            log.warn("⚠️ INSIGHTS source={} снапшот не читается: {}", kind.id(), e.getMessage());
            return SourceSummary.builder()
                    .source(kind.id())
                    .available(false)
                    .metrics(Map.of())
                    .error(e.getMessage())
                    .build();
        }
    }

    private static ModelSummary summarize(ModelArtifact a) {
        return ModelSummary.builder()
                .modelName(a.modelName())
                .targetKind(a.targetKind() != null ? a.targetKind().name() : null)
                .algorithmId(a.algorithmId())
                .primaryMetric(a.metrics() != null ? a.metrics().primaryMetric() : null)
                .primaryScore(a.metrics() != null ? a.metrics().primary() : Double.NaN)
                .sampleCount(a.sampleCount())
                .trainedAt(a.trainedAt())
                .candidateScores(a.candidateScores())
                .featureImportance(a.featureImportance())
                .build();
    }
}
