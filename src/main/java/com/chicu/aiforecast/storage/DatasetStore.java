package com.chicu.aiforecast.storage;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.etl.features.FeatureSchema;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.source.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Снапшоты источников на диске:
 * <pre>
 * raw/&lt;source&gt;-&lt;generation&gt;.csv
 * processed/&lt;source&gt;-&lt;generation&gt;.csv
 * snapshots/&lt;source&gt;.json   ← манифест, пишется последним
 * </pre>
 * Смена снапшота = stage (новые файлы поколения) → commit (замена манифестов) → удаление старого поколения.
 * Прогон, упавший до конца commit, оставляет предыдущие снапшоты всех источников нетронутыми.
 */
@Slf4j
@Component
public class DatasetStore {

    static final String RAW = "raw";
    static final String PROCESSED = "processed";
    static final String SNAPSHOTS = "snapshots";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final AtomicLong lastGeneration = new AtomicLong();

    public DatasetStore(PipelineProperties props, ObjectMapper objectMapper) {
        this.root = Paths.get(props.getDataDir()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    public Path root() {
        return root;
    }

    // =====================================================
    // ✅ WRITE
    // =====================================================

    public StagedSnapshot stage(FeatureTable table,
                                List<RawRecord> raw,
                                Instant collectedAt,
                                int dropped,
                                boolean degraded,
                                String degradedReason) {

        if (table == null) throw new IllegalArgumentException("table=null");

        SourceKind kind = table.source();
        long generation = nextGeneration(kind, collectedAt);

        String rawFile = RAW + "/" + fileName(kind, generation);
        String processedFile = PROCESSED + "/" + fileName(kind, generation);

        AtomicFiles.write(root.resolve(rawFile), bytes(CsvTables.renderRaw(raw)));
        AtomicFiles.write(root.resolve(processedFile), bytes(CsvTables.renderProcessed(table)));

        DatasetSnapshot snapshot = DatasetSnapshot.builder()
                .source(kind)
                .generation(generation)
                .collectedAt(collectedAt)
                .recordCount(table.size())
                .droppedRecords(dropped)
                .degraded(degraded)
                .degradedReason(degradedReason)
                .rawFile(rawFile)
                .processedFile(processedFile)
                .featureNames(table.schema().names())
                .schemaHash(table.schema().schemaHash())
                .build();

        log.info("💾 STAGE source={} generation={} records={}", kind.id(), generation, table.size());
        return new StagedSnapshot(snapshot);
    }

    /**
     * Коммит всех манифестов как одно целое:
     * temp-файлы всех манифестов → rename по очереди → уборка старых поколений.
     * Сбой любого rename возвращает уже заменённые манифесты к прежнему содержимому,
     * старые поколения при этом не удаляются.
     */
    public List<DatasetSnapshot> commit(List<StagedSnapshot> staged) {
        List<PendingManifest> pending = new ArrayList<>(staged.size());
        try {
            for (StagedSnapshot s : staged) {
                DatasetSnapshot snap = s.snapshot();
                Path target = manifestPath(snap.source());
                byte[] previous = previousManifest(target);
                pending.add(new PendingManifest(snap, target, previous, AtomicFiles.writeTemp(target, json(snap))));
            }
        } catch (PersistenceException e) {
            pending.forEach(p -> AtomicFiles.deleteQuietly(p.tmp()));
            throw e;
        }

        List<PendingManifest> swapped = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            PendingManifest p = pending.get(i);
            try {
                AtomicFiles.replace(p.tmp(), p.target());
                swapped.add(p);
            } catch (PersistenceException e) {
                for (int j = i + 1; j < pending.size(); j++) {
                    AtomicFiles.deleteQuietly(pending.get(j).tmp());
                }
                restore(swapped, e);
                throw e;
            }
        }

        List<DatasetSnapshot> out = new ArrayList<>(swapped.size());
        for (PendingManifest p : swapped) {
            DatasetSnapshot snap = p.snapshot();
            log.info("✅ COMMIT source={} generation={} records={} degraded={}",
                    snap.source().id(), snap.generation(), snap.recordCount(), snap.degraded());
            cleanupSuperseded(snap);
            out.add(snap);
        }
        return out;
    }

    /**
     * Откат незакоммиченных файлов после сбоя прогона.
     */
    public void discard(List<StagedSnapshot> staged) {
        for (StagedSnapshot s : staged) {
            DatasetSnapshot snap = s.snapshot();
            Optional<DatasetSnapshot> current = latestQuietly(snap.source());
            if (current.isPresent() && current.get().generation() == snap.generation()) {
                continue; // уже закоммичен
            }
            AtomicFiles.deleteQuietly(root.resolve(snap.rawFile()));
            AtomicFiles.deleteQuietly(root.resolve(snap.processedFile()));
            log.warn("🗑 DISCARD source={} generation={}", snap.source().id(), snap.generation());
        }
    }

    // =====================================================
    // ✅ READ
    // =====================================================

    public Optional<DatasetSnapshot> latest(SourceKind kind) {
        Path manifest = manifestPath(kind);
        if (!Files.isRegularFile(manifest)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(manifest.toFile(), DatasetSnapshot.class));
        } catch (IOException e) {
            throw new PersistenceException("manifest unreadable: " + manifest + ": " + e.getMessage(), e);
        }
    }

    public Optional<FeatureTable> loadLatest(SourceKind kind) {
        Optional<DatasetSnapshot> snap = latest(kind);
        if (snap.isEmpty()) return Optional.empty();

        DatasetSnapshot s = snap.get();
        Path file = root.resolve(s.processedFile());
        if (!Files.isRegularFile(file)) {
            throw new PersistenceException("processed file missing for " + kind.id() + ": " + file);
        }

        FeatureSchema schema = new FeatureSchema(s.featureNames());
        if (!schema.schemaHash().equals(s.schemaHash())) {
            throw new PersistenceException("schema hash mismatch in manifest of " + kind.id());
        }
        return Optional.of(CsvTables.readProcessed(file, kind, schema));
    }

    // =====================================================
    // helpers
    // =====================================================

    private Optional<DatasetSnapshot> latestQuietly(SourceKind kind) {
        try {
            return latest(kind);
        } catch (PersistenceException e) {
            log.warn("⚠️ манифест {} не читается: {}", kind.id(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Содержимое текущего манифеста; null, если манифеста нет.
     */
    private static byte[] previousManifest(Path target) {
        if (!Files.isRegularFile(target)) return null;
        try {
            return Files.readAllBytes(target);
        } catch (IOException e) {
            throw new PersistenceException("manifest unreadable: " + target + ": " + e.getMessage(), e);
        }
    }

    private void restore(List<PendingManifest> swapped, PersistenceException cause) {
        for (PendingManifest p : swapped) {
            try {
                if (p.previous() != null) {
                    AtomicFiles.write(p.target(), p.previous());
                } else {
                    Files.deleteIfExists(p.target());
                }
                log.warn("↩️ ROLLBACK manifest source={}", p.snapshot().source().id());
            } catch (IOException | PersistenceException e) {
                log.error("❌ ROLLBACK FAILED source={} : {}", p.snapshot().source().id(), e.getMessage(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private void cleanupSuperseded(DatasetSnapshot current) {
        Set<String> keep = Set.of(current.rawFile(), current.processedFile());
        String prefix = current.source().id() + "-";
        for (String sub : List.of(RAW, PROCESSED)) {
            Path dir = root.resolve(sub);
            if (!Files.isDirectory(dir)) continue;
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, prefix + "*.csv")) {
                for (Path p : ds) {
                    String rel = sub + "/" + p.getFileName();
                    if (!keep.contains(rel)) {
                        AtomicFiles.deleteQuietly(p);
                    }
                }
            } catch (IOException e) {
                log.warn("⚠️ уборка {} не удалась: {}", dir, e.getMessage());
            }
        }
    }

    /**
     * Поколение строго больше закоммиченного: файлы текущего снапшота никогда не перезаписываются.
     */
    private long nextGeneration(SourceKind kind, Instant collectedAt) {
        long committed = latestQuietly(kind).map(DatasetSnapshot::generation).orElse(0L);
        long candidate = Math.max(committed + 1, collectedAt != null ? collectedAt.toEpochMilli() : 0L);
        return lastGeneration.updateAndGet(prev -> Math.max(prev + 1, candidate));
    }

    private Path manifestPath(SourceKind kind) {
        return root.resolve(SNAPSHOTS).resolve(kind.id() + ".json");
    }

    private static String fileName(SourceKind kind, long generation) {
        return kind.id() + "-" + generation + ".csv";
    }

    private byte[] json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("json encode failed: " + e.getMessage(), e);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private record PendingManifest(DatasetSnapshot snapshot, Path target, byte[] previous, Path tmp) {
    }
}
