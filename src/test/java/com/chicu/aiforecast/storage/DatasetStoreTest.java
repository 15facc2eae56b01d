package com.chicu.aiforecast.storage;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.source.RawRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetStoreTest {

    @TempDir
    Path tmp;

    @Test
    void commit_thenLoadLatest_shouldReturnSameRowsAndColumns() {
        DatasetStore store = new DatasetStore(TestData.pipelineProps(tmp), TestData.objectMapper());
        FeatureTable table = TestData.epidemicTable(12, 100, 10);

        List<DatasetSnapshot> committed = store.commit(List.of(
                store.stage(table, raw(), TestData.NOW, 1, false, null)));

        DatasetSnapshot snap = committed.get(0);
        assertEquals(12, snap.recordCount());
        assertEquals(1, snap.droppedRecords());
        assertTrue(Files.isRegularFile(store.root().resolve(snap.location())));

        FeatureTable loaded = store.loadLatest(SourceKind.EPIDEMIC).orElseThrow();
        assertEquals(table.size(), loaded.size());
        assertEquals(table.schema(), loaded.schema());
        assertArrayEquals(table.column("new_cases"), loaded.column("new_cases"), 1e-12);
        assertEquals(snap, store.latest(SourceKind.EPIDEMIC).orElseThrow());
    }

    @Test
    void latest_withoutManifest_shouldBeEmpty() {
        DatasetStore store = new DatasetStore(TestData.pipelineProps(tmp), TestData.objectMapper());

        assertTrue(store.latest(SourceKind.MARKET).isEmpty());
        assertTrue(store.loadLatest(SourceKind.MARKET).isEmpty());
    }

    @Test
    void secondCommit_shouldRemovePreviousGenerationFiles() {
        DatasetStore store = new DatasetStore(TestData.pipelineProps(tmp), TestData.objectMapper());

        DatasetSnapshot first = store.commit(List.of(
                store.stage(TestData.epidemicTable(5, 10, 1), raw(), TestData.NOW, 0, false, null))).get(0);
        DatasetSnapshot second = store.commit(List.of(
                store.stage(TestData.epidemicTable(7, 10, 1), raw(), TestData.NOW, 0, false, null))).get(0);

        assertTrue(second.generation() > first.generation(), "поколение должно расти");
        assertFalse(Files.exists(store.root().resolve(first.processedFile())));
        assertFalse(Files.exists(store.root().resolve(first.rawFile())));
        assertEquals(7, store.loadLatest(SourceKind.EPIDEMIC).orElseThrow().size());
    }

    @Test
    void stage_whenDataDirIsRegularFile_shouldThrowPersistenceException() throws Exception {
        Path blocker = tmp.resolve("data");
        Files.writeString(blocker, "not a directory");
        DatasetStore store = new DatasetStore(TestData.pipelineProps(tmp), TestData.objectMapper());

        assertThrows(PersistenceException.class,
                () -> store.stage(TestData.epidemicTable(3, 1, 1), raw(), TestData.NOW, 0, false, null));
    }

    @Test
    void discard_shouldDeleteUncommittedFilesOnly() {
        DatasetStore store = new DatasetStore(TestData.pipelineProps(tmp), TestData.objectMapper());
        DatasetSnapshot committed = store.commit(List.of(
                store.stage(TestData.epidemicTable(4, 1, 1), raw(), TestData.NOW, 0, false, null))).get(0);

        StagedSnapshot pending = store.stage(TestData.epidemicTable(6, 1, 1), raw(), TestData.NOW, 0, false, null);
        store.discard(List.of(pending));

        assertFalse(Files.exists(store.root().resolve(pending.snapshot().processedFile())));
        assertTrue(Files.exists(store.root().resolve(committed.processedFile())));
        assertEquals(committed, store.latest(SourceKind.EPIDEMIC).orElseThrow());
    }

    @Test
    void loadLatest_corruptedProcessedFile_shouldThrowPersistenceException() throws Exception {
        PipelineProperties props = TestData.pipelineProps(tmp);
        DatasetStore store = new DatasetStore(props, TestData.objectMapper());
        DatasetSnapshot snap = store.commit(List.of(
                store.stage(TestData.epidemicTable(4, 1, 1), raw(), TestData.NOW, 0, false, null))).get(0);

        Files.writeString(store.root().resolve(snap.processedFile()), "timestamp,other\n2024-01-01T00:00:00Z,1\n");

        assertThrows(PersistenceException.class, () -> store.loadLatest(SourceKind.EPIDEMIC));
    }

    private static List<RawRecord> raw() {
        return List.of(new RawRecord(SourceKind.EPIDEMIC, TestData.NOW, Map.of("cases", 1)));
    }
}
