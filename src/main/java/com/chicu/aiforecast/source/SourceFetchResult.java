package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.enums.SourceKind;
import lombok.Builder;

import java.util.List;

@Builder
public record SourceFetchResult(
        SourceKind source,
        List<RawRecord> records,
        boolean degraded,
        String degradedReason,
        int attempts
) {
    public int size() {
        return records == null ? 0 : records.size();
    }
}
