package com.chicu.aiforecast.common.enums;

public enum TargetKind {

    FORECAST,
    PRICE,
    CLASSIFICATION;

    public boolean isRegression() {
        return this != CLASSIFICATION;
    }
}
