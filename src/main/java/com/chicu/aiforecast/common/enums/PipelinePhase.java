package com.chicu.aiforecast.common.enums;

/**
 * IDLE → COLLECTING → TRANSFORMING → PERSISTING → TRAINING(optional) → IDLE,
 * FAILED достижим из любой стадии.
 */
public enum PipelinePhase {
    IDLE,
    COLLECTING,
    TRANSFORMING,
    PERSISTING,
    TRAINING,
    FAILED
}
