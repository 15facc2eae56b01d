package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Сырое наблюдение источника. Значения — скаляры как пришли (String, Number или null).
 */
public record RawRecord(
        SourceKind source,
        Instant timestamp,
        Map<String, Object> fields
) {
    public RawRecord {
        if (source == null) throw new IllegalArgumentException("source=null");
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
