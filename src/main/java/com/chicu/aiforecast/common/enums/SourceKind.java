package com.chicu.aiforecast.common.enums;

import java.util.Locale;

/**
 * Внешние источники метрик. {@code id} используется в именах файлов и в ответах.
 */
public enum SourceKind {

    EPIDEMIC("epidemic"),
    WEATHER("weather"),
    MARKET("market");

    private final String id;

    SourceKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SourceKind fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source is blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKind k : values()) {
            if (k.id.equals(v) || k.name().toLowerCase(Locale.ROOT).equals(v)) {
                return k;
            }
        }
        throw new IllegalArgumentException("unknown source: " + value);
    }
}
