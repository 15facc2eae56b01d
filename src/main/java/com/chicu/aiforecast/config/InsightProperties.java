package com.chicu.aiforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "insights")
public class InsightProperties {

    /**
     * Снапшот старше этого порога считается устаревшим.
     */
    private long freshnessHours = 24;

    /**
     * |slope| / |mean| ниже порога → stable.
     */
    private double stableThreshold = 0.01;

    /**
     * samples < factor * minSamples → рекомендация "мало данных".
     */
    private double nearMinimumFactor = 1.5;

    private int defaultWindowDays = 30;
}
