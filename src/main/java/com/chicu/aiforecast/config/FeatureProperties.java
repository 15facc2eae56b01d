package com.chicu.aiforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "features")
public class FeatureProperties {

    /**
     * Окно скользящего среднего (последние N записей, на старте — неполное окно).
     */
    private int movingAverageWindow = 7;

    /**
     * Полоса клиппинга выбросов: mean ± z * std.
     */
    private double zScoreClip = 3.0;

    private int rsiPeriod = 14;
    private int macdFast = 12;
    private int macdSlow = 26;
    private int macdSignal = 9;
    private int bollingerWindow = 20;
    private int momentumLag = 5;
}
