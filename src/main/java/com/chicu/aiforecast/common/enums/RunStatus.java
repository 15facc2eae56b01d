package com.chicu.aiforecast.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Статус ответа операции пайплайна.
 */
public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    BUSY;

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }
}
