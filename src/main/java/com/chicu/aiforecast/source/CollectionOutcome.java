package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.enums.SourceKind;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Итог стадии COLLECTING.
 *
 * @param results  источники, которые вернули данные (в т.ч. синтетику)
 * @param timedOut источники, не успевшие до дедлайна: снапшот не обновляется
 * @param failures источники, упавшие неожиданной ошибкой: source → сообщение
 */
@Builder
public record CollectionOutcome(
        List<SourceFetchResult> results,
        List<SourceKind> timedOut,
        Map<SourceKind, String> failures
) {}
