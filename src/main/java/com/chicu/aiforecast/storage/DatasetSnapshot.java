package com.chicu.aiforecast.storage;

import com.chicu.aiforecast.common.enums.SourceKind;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Манифест снапшота источника ({@code snapshots/<source>.json}). Его атомарная замена и есть commit.
 * Пути файлов — относительно pipeline.data-dir.
 */
@Builder
public record DatasetSnapshot(
        SourceKind source,
        long generation,
        Instant collectedAt,
        int recordCount,
        int droppedRecords,
        boolean degraded,
        String degradedReason,
        String rawFile,
        String processedFile,
        List<String> featureNames,
        String schemaHash
) {
    /**
     * Где лежат processed-данные снапшота.
     */
    public String location() {
        return processedFile;
    }
}
