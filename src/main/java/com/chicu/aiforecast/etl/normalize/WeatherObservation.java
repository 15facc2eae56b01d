package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;

public record WeatherObservation(
        Instant at,
        double temperature,
        double humidity,
        double pressure,
        double windSpeed,
        String description
) implements Observation {

    @Override
    public SourceKind kind() {
        return SourceKind.WEATHER;
    }

    @Override
    public Instant timestamp() {
        return at;
    }

    @Override
    public double[] values() {
        return new double[]{temperature, humidity, pressure, windSpeed};
    }
}
