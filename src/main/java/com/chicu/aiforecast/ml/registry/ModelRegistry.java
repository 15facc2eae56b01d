package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.ml.candidates.FittedModel;
import com.chicu.aiforecast.storage.AtomicFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Текущая модель на каждое имя.
 * Диск: {@code <model>-params-<generation>.json} + {@code <model>.json} (метаданные, пишутся последними = commit).
 * Читатели берут ссылку из map и видят артефакт целиком; публикация — один писатель.
 */
@Slf4j
@Component
public class ModelRegistry {

    private static final String PARAMS_MARK = "-params-";

    private final Path dir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Entry> current = new ConcurrentHashMap<>();

    public ModelRegistry(PipelineProperties props, ObjectMapper objectMapper, Clock clock) {
        this.dir = Paths.get(props.getModelsDir()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // =====================================================
    // ✅ startup
    // =====================================================

    @PostConstruct
    public void load() {
        if (!Files.isDirectory(dir)) {
            log.info("📚 REGISTRY пуст: каталога {} нет", dir);
            return;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*.json")) {
            for (Path meta : ds) {
                if (meta.getFileName().toString().contains(PARAMS_MARK)) continue;
                try {
                    ModelMetadata m = objectMapper.readValue(meta.toFile(), ModelMetadata.class);
                    FittedModel params = objectMapper.readValue(dir.resolve(m.paramsFile()).toFile(), FittedModel.class);
                    current.put(m.modelName(), new Entry(m.toArtifact(params), m.generation(), m.paramsFile()));
                    log.info("📚 REGISTRY LOAD model={} algo={} trainedAt={}", m.modelName(), m.algorithmId(), m.trainedAt());
                } catch (IOException | RuntimeException e) {
                    log.warn("⚠️ REGISTRY модель из {} не загружена: {}", meta.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("⚠️ REGISTRY каталог {} не читается: {}", dir, e.getMessage());
        }
    }

    // =====================================================
    // ✅ read
    // =====================================================

    public Optional<ModelArtifact> find(String modelName) {
        if (modelName == null) return Optional.empty();
        Entry e = current.get(modelName);
        return e == null ? Optional.empty() : Optional.of(e.artifact());
    }

    public List<ModelArtifact> all() {
        List<ModelArtifact> out = new ArrayList<>();
        for (Entry e : current.values()) out.add(e.artifact());
        out.sort(Comparator.comparing(ModelArtifact::modelName));
        return out;
    }

    // =====================================================
    // ✅ publish (single writer)
    // =====================================================

    public synchronized void publish(ModelArtifact artifact) {
        if (artifact == null || artifact.modelName() == null || artifact.params() == null) {
            throw new IllegalArgumentException("artifact/modelName/params = null");
        }

        String name = artifact.modelName();
        Entry prev = current.get(name);
        long generation = Math.max(prev != null ? prev.generation() + 1 : 1L, clock.millis());
        String paramsFile = name + PARAMS_MARK + generation + ".json";

        Path paramsPath = dir.resolve(paramsFile);
        try {
            AtomicFiles.write(paramsPath, json(artifact.params()));
            AtomicFiles.write(dir.resolve(name + ".json"), json(ModelMetadata.of(artifact, generation, paramsFile)));
        } catch (PersistenceException e) {
            AtomicFiles.deleteQuietly(paramsPath);
            throw e;
        }

        current.put(name, new Entry(artifact, generation, paramsFile));

        if (prev != null && !prev.paramsFile().equals(paramsFile)) {
            AtomicFiles.deleteQuietly(dir.resolve(prev.paramsFile()));
        }

        log.info("🚀 PUBLISH model={} algo={} {}={} samples={}",
                name,
                artifact.algorithmId(),
                artifact.metrics() != null ? artifact.metrics().primaryMetric() : "-",
                artifact.metrics() != null ? artifact.metrics().primary() : null,
                artifact.sampleCount());
    }

    private byte[] json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("json encode failed: " + e.getMessage(), e);
        }
    }

    private record Entry(ModelArtifact artifact, long generation, String paramsFile) {}
}
