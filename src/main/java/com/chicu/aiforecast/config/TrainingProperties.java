package com.chicu.aiforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "training")
public class TrainingProperties {

    private int folds = 5;

    private long seed = 42L;

    /**
     * Потоки для параллельного обучения кандидатов.
     */
    private int threads = 3;

    /**
     * Переопределение минимального числа сэмплов: modelName → min.
     */
    private Map<String, Integer> minSamples = new LinkedHashMap<>();

    private Linear linear = new Linear();
    private Forest forest = new Forest();
    private Boosting boosting = new Boosting();

    @Data
    public static class Linear {
        private double ridge = 1e-4;
        private int iterations = 400;
        private double learningRate = 0.5;
        private double l2 = 1e-3;
    }

    @Data
    public static class Forest {
        private int trees = 60;
        private int maxDepth = 8;
        private int minSamplesLeaf = 2;
        private double featureFraction = 0.6;
    }

    @Data
    public static class Boosting {
        private int rounds = 120;
        private int maxDepth = 3;
        private int minSamplesLeaf = 2;
        private double learningRate = 0.1;
    }
}
