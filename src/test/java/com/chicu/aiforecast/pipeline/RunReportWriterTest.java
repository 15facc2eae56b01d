package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.TestData;
import com.chicu.aiforecast.common.enums.RunStatus;
import com.chicu.aiforecast.config.PipelineProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RunReportWriterTest {

    @TempDir
    Path tmp;

    @Test
    void write_overRetention_shouldKeepOnlyNewestReports() throws Exception {
        PipelineProperties props = TestData.pipelineProps(tmp);
        props.setReportRetention(2);

        Path last = null;
        for (int i = 0; i < 4; i++) {
            Clock clock = Clock.fixed(TestData.NOW.plusSeconds(i), ZoneOffset.UTC);
            last = new RunReportWriter(props, TestData.objectMapper(), clock)
                    .write("collect", etl(), null)
                    .orElseThrow();
        }

        List<String> names = reportNames(last.getParent());
        assertEquals(List.of(
                "pipeline-run-20240310T000002000Z.json",
                "pipeline-run-20240310T000003000Z.json"), names, "остаются два последних отчёта");
    }

    @Test
    void write_retentionDisabled_shouldKeepEveryReport() throws Exception {
        PipelineProperties props = TestData.pipelineProps(tmp);
        props.setReportRetention(0);

        Path last = null;
        for (int i = 0; i < 3; i++) {
            Clock clock = Clock.fixed(TestData.NOW.plusSeconds(i), ZoneOffset.UTC);
            last = new RunReportWriter(props, TestData.objectMapper(), clock)
                    .write("collect", etl(), null)
                    .orElseThrow();
        }

        assertEquals(3, reportNames(last.getParent()).size());
    }

    @Test
    void write_reportsDisabled_shouldWriteNothing() {
        PipelineProperties props = TestData.pipelineProps(tmp);
        props.setWriteRunReports(false);

        assertTrue(new RunReportWriter(props, TestData.objectMapper(), TestData.clock())
                .write("full", etl(), null)
                .isEmpty());
        assertFalse(Files.exists(tmp.resolve("data").resolve("reports")));
    }

    private static EtlRunResult etl() {
        return EtlRunResult.builder()
                .status(RunStatus.SUCCESS)
                .startedAt(TestData.NOW)
                .finishedAt(TestData.NOW)
                .totalRecords(0)
                .build();
    }

    private static List<String> reportNames(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }
}
