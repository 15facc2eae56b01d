package com.chicu.aiforecast.storage;

/**
 * Записанные, но ещё не закоммиченные файлы снапшота. Без манифеста их никто не читает.
 */
public record StagedSnapshot(DatasetSnapshot snapshot) {
}
