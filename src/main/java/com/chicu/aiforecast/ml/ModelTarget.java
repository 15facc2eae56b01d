package com.chicu.aiforecast.ml;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.enums.TargetKind;

import java.util.List;
import java.util.Map;

/**
 * Цели обучения. Метка строится из СЛЕДУЮЩЕЙ записи снапшота: фичи t → значение t+1.
 */
public enum ModelTarget {

    COVID_FORECAST("covid_forecast", TargetKind.FORECAST, SourceKind.EPIDEMIC, "cases", 10),
    STOCK_PREDICTION("stock_prediction", TargetKind.PRICE, SourceKind.MARKET, "close", 20),
    WEATHER_CLASSIFICATION("weather_classification", TargetKind.CLASSIFICATION, SourceKind.WEATHER, "temperature", 10);

    /**
     * Категории температуры: Cold &lt; 0 ≤ Cool &lt; 15 ≤ Warm &lt; 25 ≤ Hot.
     */
    public static final List<String> TEMPERATURE_LABELS = List.of("Cold", "Cool", "Warm", "Hot");

    private final String modelName;
    private final TargetKind targetKind;
    private final SourceKind source;
    private final String labelColumn;
    private final int defaultMinSamples;

    ModelTarget(String modelName, TargetKind targetKind, SourceKind source, String labelColumn, int defaultMinSamples) {
        this.modelName = modelName;
        this.targetKind = targetKind;
        this.source = source;
        this.labelColumn = labelColumn;
        this.defaultMinSamples = defaultMinSamples;
    }

    public String modelName() {
        return modelName;
    }

    public TargetKind targetKind() {
        return targetKind;
    }

    public SourceKind source() {
        return source;
    }

    public String labelColumn() {
        return labelColumn;
    }

    public int defaultMinSamples() {
        return defaultMinSamples;
    }

    /**
     * Минимум сэмплов с учётом переопределений из training.min-samples.
     */
    public int minSamples(Map<String, Integer> overrides) {
        Integer v = overrides != null ? overrides.get(modelName) : null;
        return v != null && v > 0 ? v : defaultMinSamples;
    }

    public List<String> classLabels() {
        return targetKind == TargetKind.CLASSIFICATION ? TEMPERATURE_LABELS : List.of();
    }

    /**
     * Значение колонки следующей записи → метка (для регрессии — само значение, для классификации — индекс класса).
     */
    public double label(double next) {
        if (targetKind != TargetKind.CLASSIFICATION) return next;
        if (next < 0) return 0;
        if (next < 15) return 1;
        if (next < 25) return 2;
        return 3;
    }
}
