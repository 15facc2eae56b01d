package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;

public record MarketQuote(
        Instant date,
        double open,
        double high,
        double low,
        double close,
        double volume
) implements Observation {

    @Override
    public SourceKind kind() {
        return SourceKind.MARKET;
    }

    @Override
    public Instant timestamp() {
        return date;
    }

    @Override
    public double[] values() {
        return new double[]{open, high, low, close, volume};
    }
}
