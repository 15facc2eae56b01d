package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.enums.RunStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ответ runEtl. degradedSources — источники на синтетике или без нового снапшота.
 */
@Builder
public record EtlRunResult(
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        int totalRecords,
        Map<String, Integer> perSourceRecordCounts,
        List<String> degradedSources,
        Map<String, Integer> droppedRecords,
        List<String> errors
) {
    static EtlRunResult busy(Instant now) {
        return EtlRunResult.builder()
                .status(RunStatus.BUSY)
                .startedAt(now)
                .finishedAt(now)
                .perSourceRecordCounts(Map.of())
                .degradedSources(List.of())
                .droppedRecords(Map.of())
                .errors(List.of("pipeline run already in progress"))
                .build();
    }
}
