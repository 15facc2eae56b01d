package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.insight.InsightReport;
import com.chicu.aiforecast.pipeline.facade.PipelineFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Запуск из командной строки: {@code --mode=full|collect|train|insights}.
 * Без --mode контекст поднимается и ничего не запускает.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandRunner implements ApplicationRunner {

    private final PipelineFacade facade;

    @Override
    public void run(ApplicationArguments args) {
        List<String> modes = args.getOptionValues("mode");
        if (modes == null || modes.isEmpty()) {
            log.info("ℹ️ --mode не задан, прогон не запускается");
            return;
        }

        String mode = modes.get(0).trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "full" -> {
                FullRunResult r = facade.runFull();
                log.info("🏁 MODE full etl={} training={}",
                        r.etl().status().json(),
                        r.training() != null ? r.training().status().json() : "skipped");
            }
            case "collect" -> log.info("🏁 MODE collect status={}", facade.runEtl().status().json());
            case "train" -> log.info("🏁 MODE train status={}", facade.trainModels().status().json());
            case "insights" -> {
                InsightReport report = facade.getInsights();
                report.recommendations().forEach(rec ->
                        log.info("💡 {} [{}] {}", rec.type(), rec.target(), rec.message()));
                log.info("🏁 MODE insights sources={} models={}",
                        report.perSourceSummary().size(), report.perModelSummary().size());
            }
            default -> {
                log.warn("⚠️ неизвестный --mode={} (full|collect|train|insights)", mode);
                return;
            }
        }

        PipelineStatus st = facade.getStatus();
        log.info("📊 STATUS phase={} snapshots={} models={}",
                st.phase(), st.lastSnapshots().keySet(), st.lastPublishedModels());
}
}
