package com.chicu.aiforecast.ml;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.common.exception.InsufficientDataException;
import com.chicu.aiforecast.common.util.RunDeadline;
import com.chicu.aiforecast.config.FeatureProperties;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.etl.features.FeatureEngineer;
import com.chicu.aiforecast.etl.features.FeatureSchema;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.etl.features.ProcessedRecord;
import com.chicu.aiforecast.etl.normalize.Normalizer;
import com.chicu.aiforecast.ml.candidates.CandidateCatalog;
import com.chicu.aiforecast.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.ml.registry.PredictionResult;
import com.chicu.aiforecast.ml.registry.PredictionService;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.RawRecord;
import com.chicu.aiforecast.source.weather.WeatherConnector;
import com.chicu.aiforecast.storage.DatasetStore;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelTrainerTest {

    @TempDir
    Path tmp;

    private ExecutorService executor;
    private DatasetStore store;
    private ModelRegistry registry;
    private ModelTrainer trainer;

    @BeforeEach
    void setUp() {
        PipelineProperties props = TestData.pipelineProps(tmp);
        executor = Executors.newFixedThreadPool(2);
        store = new DatasetStore(props, TestData.objectMapper());
        registry = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        TrainingProperties training = fastTraining();
        trainer = new ModelTrainer(store, new TrainingDatasetBuilder(), new CandidateCatalog(training),
                registry, training, executor, TestData.clock());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void selectAndFit_linearRelation_shouldPickLinearRegression() {
        Random rnd = new Random(11);
        int n = 120;
        double[][] x = new double[n][2];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i][0] = rnd.nextDouble() * 10;
            x[i][1] = rnd.nextDouble() * 10;
            y[i] = 3 * x[i][0] - 2 * x[i][1] + 5 + rnd.nextGaussian() * 0.01;
        }
        TrainingDatasetBuilder.Dataset dataset = new TrainingDatasetBuilder.Dataset(
                "linear", new FeatureSchema(List.of("x1", "x2")), x, y, n, 2, List.of(), TestData.NOW);

        ModelArtifact artifact = trainer.selectAndFit("linear_test", TargetKind.FORECAST, dataset);

        assertEquals("linear_regression", artifact.algorithmId());
        assertEquals(3, artifact.candidateScores().size(), "оценены все кандидаты");
        for (CandidateEvaluation e : artifact.candidateScores()) {
            assertTrue(e.ok(), "кандидат " + e.algorithmId() + " упал: " + e.error());
            assertTrue(artifact.metrics().primary() >= e.metrics().primary());
        }
        assertTrue(artifact.metrics().primary() > 0.99);
        assertEquals(n, artifact.sampleCount());
        assertSame(artifact, registry.find("linear_test").orElseThrow());
        assertTrue(artifact.featureImportance().isEmpty(), "у линейной модели нет важности фич");

        PredictionResult p = new PredictionService(registry, TestData.clock())
                .predict("linear_test", Map.of("x1", 2.0, "x2", 1.0));
        assertEquals(9.0, p.prediction(), 0.05);
    }

    @Test
    void train_belowMinSamples_shouldThrowAndKeepRegistryUntouched() {
        store.commit(List.of(store.stage(TestData.epidemicTable(5, 100, 10), List.of(), TestData.NOW, 0, false, null)));

        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> trainer.train(ModelTarget.COVID_FORECAST));

        assertEquals(4, ex.getSamples());
        assertEquals(10, ex.getRequired());
        assertTrue(registry.find("covid_forecast").isEmpty());
    }

    @Test
    void train_belowMinSamples_shouldKeepPreviouslyPublishedModel() throws Exception {
        store.commit(List.of(store.stage(TestData.epidemicTable(40, 100, 10), List.of(), TestData.NOW, 0, false, null)));
        ModelArtifact published = trainer.train(ModelTarget.COVID_FORECAST);
        assertSame(published, registry.find("covid_forecast").orElseThrow());
        Map<String, byte[]> filesBefore = modelFiles();
        assertEquals(2, filesBefore.size(), "params + метаданные");

        store.commit(List.of(store.stage(TestData.epidemicTable(5, 100, 10), List.of(),
                TestData.NOW.plusSeconds(60), 0, false, null)));

        assertThrows(InsufficientDataException.class, () -> trainer.train(ModelTarget.COVID_FORECAST));

        assertSame(published, registry.find("covid_forecast").orElseThrow(), "старая модель продолжает обслуживаться");
        Map<String, byte[]> filesAfter = modelFiles();
        assertEquals(filesBefore.keySet(), filesAfter.keySet());
        for (Map.Entry<String, byte[]> e : filesBefore.entrySet()) {
            assertArrayEquals(e.getValue(), filesAfter.get(e.getKey()), "файл " + e.getKey() + " изменился");
        }
    }

    @Test
    void trainAll_withoutSnapshots_shouldReportEveryTargetAsFailed() {
        TrainingOutcome outcome = trainer.trainAll();

        assertTrue(outcome.trained().isEmpty());
        assertEquals(3, outcome.failed().size());
        assertTrue(outcome.failed().containsKey("weather_classification"));
        assertTrue(registry.all().isEmpty());
    }

    @Test
    void trainAll_weatherSnapshot_shouldPublishClassifierWithTemperatureLabels() {
        FeatureTable weather = weatherTable();
        store.commit(List.of(store.stage(weather, List.of(), TestData.NOW, 0, false, null)));

        TrainingOutcome outcome = trainer.trainAll();

        assertEquals(1, outcome.trained().size());
        ModelArtifact artifact = registry.find("weather_classification").orElseThrow();
        assertEquals(ModelTarget.TEMPERATURE_LABELS, artifact.classLabels());
        assertEquals(weather.size() - 1, artifact.sampleCount());
        assertEquals("accuracy", artifact.metrics().primaryMetric());

        ProcessedRecord last = weather.records().get(weather.size() - 1);
        Map<String, Double> features = new LinkedHashMap<>();
        for (String name : weather.schema().names()) features.put(name, last.value(name));

        PredictionResult p = new PredictionService(registry, TestData.clock())
                .predict("weather_classification", features);
        assertTrue(ModelTarget.TEMPERATURE_LABELS.contains(p.label()));
        assertNotNull(p.confidence());
    }

    @Test
    void minSamples_shouldHonourOverrides() {
        TrainingProperties training = fastTraining();
        training.getMinSamples().put("covid_forecast", 3);
        ModelTrainer custom = new ModelTrainer(store, new TrainingDatasetBuilder(), new CandidateCatalog(training),
                registry, training, executor, TestData.clock());

        assertEquals(3, custom.minSamples(ModelTarget.COVID_FORECAST));
        assertEquals(20, custom.minSamples(ModelTarget.STOCK_PREDICTION));
    }

    private static FeatureTable weatherTable() {
        SourceProperties sources = new SourceProperties();
        List<RawRecord> raw = new WeatherConnector(new OkHttpClient(), sources)
                .synthetic(new FetchContext(TestData.NOW, RunDeadline.after(Duration.ofSeconds(5))));
        return new FeatureEngineer(new FeatureProperties())
                .transform(new Normalizer(sources, new FeatureProperties()).normalize(SourceKind.WEATHER, raw));
    }

    private Map<String, byte[]> modelFiles() throws IOException {
        Map<String, byte[]> out = new TreeMap<>();
        try (Stream<Path> files = Files.list(tmp.resolve("models"))) {
            for (Path p : files.toList()) {
                out.put(p.getFileName().toString(), Files.readAllBytes(p));
            }
        }
        return out;
    }

    private static TrainingProperties fastTraining() {
        TrainingProperties t = new TrainingProperties();
        t.setFolds(3);
        t.getForest().setTrees(10);
        t.getBoosting().setRounds(30);
        return t;
    }
}
