package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;

public record EpidemicObservation(
        Instant date,
        double cases,
        double deaths,
        double recovered
) implements Observation {

    @Override
    public SourceKind kind() {
        return SourceKind.EPIDEMIC;
    }

    @Override
    public Instant timestamp() {
        return date;
    }

    @Override
    public double[] values() {
        return new double[]{cases, deaths, recovered};
    }
}
