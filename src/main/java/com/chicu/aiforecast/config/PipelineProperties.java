package com.chicu.aiforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Корень снапшотов: raw/, processed/, snapshots/, reports/
     */
    private String dataDir = "./data";

    /**
     * Параметры и метаданные опубликованных моделей.
     */
    private String modelsDir = "./models";

    /**
     * Общий дедлайн стадии сбора. По истечении незавершённые вызовы отменяются.
     */
    private long runTimeoutMs = 60_000L;

    /**
     * Максимум одновременных вызовов к источникам.
     */
    private int maxConcurrentCalls = 3;

    /**
     * Писать JSON-отчёт каждого прогона в reports/.
     */
    private boolean writeRunReports = true;

    /**
     * Сколько последних отчётов хранить в reports/; &lt;= 0 — хранить все.
     */
    private int reportRetention = 20;
}
