package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.storage.AtomicFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * JSON-отчёт каждого прогона в {@code <data-dir>/reports/pipeline-run-<timestamp>.json}.
 * Отчёт вспомогательный: ошибка записи логируется, прогон не валит.
 */
@Slf4j
@Component
public class RunReportWriter {

    private static final DateTimeFormatter TS = DateTimeFormatter
            .ofPattern("yyyyMMdd'T'HHmmssSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final PipelineProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunReportWriter(PipelineProperties props, ObjectMapper objectMapper, Clock clock) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public record RunReport(String mode, Instant generatedAt, EtlRunResult etl, TrainModelsResult training) {}

    public Optional<Path> write(String mode, EtlRunResult etl, TrainModelsResult training) {
        if (!props.isWriteRunReports()) return Optional.empty();

        Instant now = Instant.now(clock);
        Path file = Paths.get(props.getDataDir())
                .toAbsolutePath()
                .normalize()
                .resolve("reports")
                .resolve("pipeline-run-" + TS.format(now) + ".json");

        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new RunReport(mode, now, etl, training));
            AtomicFiles.write(file, json);
            log.info("📝 REPORT mode={} file={}", mode, file);
            prune(file.getParent());
            return Optional.of(file);
        } catch (JsonProcessingException | PersistenceException e) {
            log.warn("⚠️ REPORT не записан mode={} : {}", mode, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Оставляет reportRetention последних отчётов. Имена с UTC-меткой сортируются хронологически.
     */
    void prune(Path dir) {
        int keep = props.getReportRetention();
        if (keep <= 0) return;

        List<Path> reports = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "pipeline-run-*.json")) {
            ds.forEach(reports::add);
        } catch (IOException e) {
            log.warn("⚠️ REPORT уборка {} не удалась: {}", dir, e.getMessage());
            return;
        }
        if (reports.size() <= keep) return;

        reports.sort(Comparator.comparing(p -> p.getFileName().toString()));
        int removed = 0;
        for (Path old : reports.subList(0, reports.size() - keep)) {
            if (AtomicFiles.deleteQuietly(old)) removed++;
        }
        log.info("🧹 REPORT retention={} removed={}", keep, removed);
    }
}
