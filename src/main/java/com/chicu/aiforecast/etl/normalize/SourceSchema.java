package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Фиксированная схема источника: числовые колонки, встроенные дефолты для forward-fill,
 * колонки, которые не бывают отрицательными.
 */
public record SourceSchema(
        SourceKind kind,
        List<String> numericColumns,
        Map<String, Double> defaults,
        Set<String> nonNegative,
        String textColumn,
        String textDefault
) {

    public static final SourceSchema EPIDEMIC = new SourceSchema(
            SourceKind.EPIDEMIC,
            List.of("cases", "deaths", "recovered"),
            Map.of("cases", 0.0, "deaths", 0.0, "recovered", 0.0),
            Set.of("cases", "deaths", "recovered"),
            null,
            null
    );

    public static final SourceSchema WEATHER = new SourceSchema(
            SourceKind.WEATHER,
            List.of("temperature", "humidity", "pressure", "wind_speed"),
            Map.of("temperature", 15.0, "humidity", 60.0, "pressure", 1013.0, "wind_speed", 0.0),
            Set.of("humidity", "pressure", "wind_speed"),
            "description",
            "unknown"
    );

    public static final SourceSchema MARKET = new SourceSchema(
            SourceKind.MARKET,
            List.of("open", "high", "low", "close", "volume"),
            Map.of("open", 0.0, "high", 0.0, "low", 0.0, "close", 0.0, "volume", 0.0),
            Set.of("open", "high", "low", "close", "volume"),
            null,
            null
    );

    public static SourceSchema of(SourceKind kind) {
        return switch (kind) {
            case EPIDEMIC -> EPIDEMIC;
            case WEATHER -> WEATHER;
            case MARKET -> MARKET;
        };
    }

    public int width() {
        return numericColumns.size();
    }

    Observation create(Instant ts, double[] v, String text) {
        return switch (kind) {
            case EPIDEMIC -> new EpidemicObservation(ts, v[0], v[1], v[2]);
            case WEATHER -> new WeatherObservation(ts, v[0], v[1], v[2], v[3],
                    text != null ? text : textDefault);
            case MARKET -> new MarketQuote(ts, v[0], v[1], v[2], v[3], v[4]);
        };
    }
}
