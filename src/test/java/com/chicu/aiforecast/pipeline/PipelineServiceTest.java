package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.PipelinePhase;
import com.chicu.aiforecast.common.enums.RunStatus;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.SourceConnectionException;
import com.chicu.aiforecast.config.FeatureProperties;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.etl.features.FeatureEngineer;
import com.chicu.aiforecast.etl.normalize.Normalizer;
import com.chicu.aiforecast.ml.ModelTrainer;
import com.chicu.aiforecast.ml.candidates.CandidateCatalog;
import com.chicu.aiforecast.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.source.AbstractSourceConnector;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.RawRecord;
import com.chicu.aiforecast.source.SourceCollector;
import com.chicu.aiforecast.source.SourceConnector;
import com.chicu.aiforecast.source.epidemic.EpidemicConnector;
import com.chicu.aiforecast.source.market.MarketConnector;
import com.chicu.aiforecast.source.weather.WeatherConnector;
import com.chicu.aiforecast.storage.DatasetStore;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PipelineServiceTest {

    @TempDir
    Path tmp;

    private ExecutorService collectorPool;
    private ExecutorService trainingPool;
    private PipelineProperties props;
    private DatasetStore store;
    private ModelRegistry registry;
    private PipelineState state;

    private StubConnector epidemic;
    private PipelineService service;

    @BeforeEach
    void setUp() {
        collectorPool = Executors.newFixedThreadPool(3);
        trainingPool = Executors.newFixedThreadPool(2);
        props = TestData.pipelineProps(tmp);

        SourceProperties sources = new SourceProperties();
        OkHttpClient http = new OkHttpClient();
        epidemic = new StubConnector(new EpidemicConnector(http, sources));
        List<SourceConnector> connectors = List.of(
                epidemic,
                new StubConnector(new WeatherConnector(http, sources)),
                new StubConnector(new MarketConnector(http, sources)));

        TrainingProperties training = new TrainingProperties();
        training.setFolds(3);
        training.getForest().setTrees(8);
        training.getBoosting().setRounds(20);

        store = new DatasetStore(props, TestData.objectMapper());
        registry = new ModelRegistry(props, TestData.objectMapper(), TestData.clock());
        state = new PipelineState();
        ModelTrainer trainer = new ModelTrainer(store, new TrainingDatasetBuilder(), new CandidateCatalog(training),
                registry, training, trainingPool, TestData.clock());

        service = new PipelineService(
                new SourceCollector(connectors, sources, collectorPool),
                new Normalizer(sources, new FeatureProperties()),
                new FeatureEngineer(new FeatureProperties()),
                store,
                trainer,
                state,
                props,
                new RunReportWriter(props, TestData.objectMapper(), TestData.clock()),
                TestData.clock());
    }

    @AfterEach
    void tearDown() {
        collectorPool.shutdownNow();
        trainingPool.shutdownNow();
    }

    @Test
    void runEtl_failingSource_shouldDegradeButStillCommitEverySource() {
        epidemic.failing = true;

        EtlRunResult res = service.runEtl();

        assertEquals(RunStatus.SUCCESS, res.status());
        assertEquals(List.of("epidemic"), res.degradedSources());
        assertEquals(3, res.perSourceRecordCounts().size());
        assertEquals(res.perSourceRecordCounts().values().stream().mapToInt(Integer::intValue).sum(), res.totalRecords());
        assertTrue(store.latest(SourceKind.EPIDEMIC).orElseThrow().degraded());
        assertFalse(store.latest(SourceKind.MARKET).orElseThrow().degraded());
        assertEquals(PipelinePhase.IDLE, state.phase());
        assertFalse(state.isRunning());
        assertEquals(res, state.lastEtl());

        PipelineStatus st = state.status();
        assertEquals(List.of("epidemic", "market", "weather"), List.copyOf(st.lastSnapshots().keySet()));
        assertTrue(st.lastSnapshots().get("epidemic").degraded(), "в статусе снапшот epidemic помечен degraded");
        assertNull(st.lastTraining());
    }

    @Test
    void runEtl_storageFailure_shouldKeepPreviousSnapshotAndReportFailed() throws Exception {
        assertEquals(RunStatus.SUCCESS, service.runEtl().status());
        Path manifest = store.root().resolve("snapshots").resolve("weather.json");
        byte[] before = Files.readAllBytes(manifest);

        Path processed = store.root().resolve("processed");
        try (Stream<Path> walk = Files.walk(processed)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
        Files.writeString(processed, "blocked");

        EtlRunResult res = service.runEtl();

        assertEquals(RunStatus.FAILED, res.status());
        assertEquals(0, res.totalRecords());
        assertTrue(res.errors().stream().anyMatch(e -> e.startsWith("persistence:")));
        assertEquals(PipelinePhase.FAILED, state.phase());
        assertArrayEquals(before, Files.readAllBytes(manifest), "манифест прошлого снапшота не должен меняться");
    }

    @Test
    void runEtl_manifestSwapFailure_shouldRollBackAlreadySwappedSources() throws Exception {
        assertEquals(RunStatus.SUCCESS, service.runEtl().status());
        Path snapshots = store.root().resolve("snapshots");
        byte[] epiBefore = Files.readAllBytes(snapshots.resolve("epidemic.json"));
        byte[] weatherBefore = Files.readAllBytes(snapshots.resolve("weather.json"));
        long epiGen = store.latest(SourceKind.EPIDEMIC).orElseThrow().generation();
        long weatherGen = store.latest(SourceKind.WEATHER).orElseThrow().generation();

        // манифест market — непустой каталог: rename поверх него падает уже после stage
        Path market = snapshots.resolve("market.json");
        Files.delete(market);
        Files.createDirectories(market.resolve("blocker"));

        EtlRunResult res = service.runEtl();

        assertEquals(RunStatus.FAILED, res.status());
        assertTrue(res.perSourceRecordCounts().isEmpty());
        assertEquals(PipelinePhase.FAILED, state.phase());
        assertArrayEquals(epiBefore, Files.readAllBytes(snapshots.resolve("epidemic.json")),
                "упавший прогон не должен заменять снапшот epidemic");
        assertArrayEquals(weatherBefore, Files.readAllBytes(snapshots.resolve("weather.json")),
                "упавший прогон не должен заменять снапшот weather");
        assertTrue(store.loadLatest(SourceKind.EPIDEMIC).isPresent(), "файлы старого поколения epidemic на месте");
        assertTrue(store.loadLatest(SourceKind.WEATHER).isPresent(), "файлы старого поколения weather на месте");
        assertEquals(epiGen, state.status().lastSnapshots().get("epidemic").generation());
        assertEquals(weatherGen, state.status().lastSnapshots().get("weather").generation());

        try (Stream<Path> files = Files.list(store.root().resolve("processed"))) {
            assertEquals(3, files.count(), "файлы упавшего поколения удалены");
        }
        try (Stream<Path> files = Files.list(snapshots)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")), "temp-манифесты не остаются");
        }
    }

    @Test
    void runEtl_whileAnotherRunInFlight_shouldReturnBusy() {
        assertTrue(state.tryStart());

        EtlRunResult res = service.runEtl();

        assertEquals(RunStatus.BUSY, res.status());
        assertTrue(store.latest(SourceKind.WEATHER).isEmpty(), "занятый прогон ничего не пишет");
        assertEquals(RunStatus.BUSY, service.trainModels().status());
        state.finish();
    }

    @Test
    void runFull_shouldCollectThenPublishAllModels() {
        FullRunResult res = service.runFull();

        assertEquals(RunStatus.SUCCESS, res.etl().status());
        assertNotNull(res.training());
        assertEquals(RunStatus.SUCCESS, res.training().status(), "ошибки: " + res.training().errors());
        assertEquals(3, res.training().modelsTrained().size());
        assertEquals(3, registry.all().size());
        assertEquals(3, res.training().perModelMetrics().size());
        assertEquals(PipelinePhase.IDLE, state.phase());
        assertTrue(Files.isDirectory(store.root().resolve("reports")));
    }

    @Test
    void trainModels_withoutSnapshots_shouldFail() {
        TrainModelsResult res = service.trainModels();

        assertEquals(RunStatus.FAILED, res.status());
        assertEquals(3, res.failedModels().size());
        assertTrue(res.modelsTrained().isEmpty());
    }

    /**
     * Источник без сети: fetch отдаёт синтетику реального коннектора или падает по флагу.
     */
    static class StubConnector extends AbstractSourceConnector {

        private final SourceConnector delegate;
        volatile boolean failing;

        StubConnector(SourceConnector delegate) {
            super(settings());
            this.delegate = delegate;
        }

        @Override
        protected boolean requiresApiKey() {
            return false;
        }

        @Override
        public SourceKind kind() {
            return delegate.kind();
        }

        @Override
        public List<RawRecord> fetch(FetchContext ctx) {
            if (failing) {
                throw new SourceConnectionException(kind(), "connection refused");
            }
            return delegate.synthetic(ctx);
        }

        @Override
        public List<RawRecord> synthetic(FetchContext ctx) {
            return delegate.synthetic(ctx);
        }

        private static SourceProperties.Settings settings() {
            SourceProperties.Settings s = new SourceProperties.Settings();
            s.setMaxAttempts(1);
            s.setBackoffMs(0);
            return s;
        }
    }
}
