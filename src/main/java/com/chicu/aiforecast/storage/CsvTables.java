package com.chicu.aiforecast.storage;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.etl.features.FeatureSchema;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.etl.features.ProcessedRecord;
import com.chicu.aiforecast.source.RawRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CSV-представление raw/processed таблиц (Commons CSV). Первая колонка всегда timestamp.
 */
public final class CsvTables {

    public static final String TIMESTAMP = "timestamp";

    private CsvTables() {
    }

    public static String renderRaw(List<RawRecord> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (RawRecord r : records) columns.addAll(r.fields().keySet());

        List<String> header = new ArrayList<>();
        header.add(TIMESTAMP);
        header.addAll(columns);

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format(header))) {
            for (RawRecord r : records) {
                List<String> row = new ArrayList<>(header.size());
                row.add(r.timestamp() != null ? r.timestamp().toString() : "");
                for (String c : columns) {
                    Object v = r.field(c);
                    row.add(v != null ? v.toString() : "");
                }
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("csv render error: " + e.getMessage(), e);
        }
        return out.toString();
    }

    public static String renderProcessed(FeatureTable table) {
        List<String> header = new ArrayList<>();
        header.add(TIMESTAMP);
        header.addAll(table.schema().names());

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format(header))) {
            for (ProcessedRecord r : table.records()) {
                List<String> row = new ArrayList<>(header.size());
                row.add(r.timestamp().toString());
                for (double v : r.values()) row.add(Double.toString(v));
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("csv render error: " + e.getMessage(), e);
        }
        return out.toString();
    }

    public static FeatureTable readProcessed(Path file, SourceKind kind, FeatureSchema expected) {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, fmt)) {

            List<String> header = parser.getHeaderNames();
            List<String> want = new ArrayList<>();
            want.add(TIMESTAMP);
            want.addAll(expected.names());
            if (!want.equals(header)) {
                throw new PersistenceException("processed header mismatch in " + file
                        + ": expected " + want + " got " + header);
            }

            List<ProcessedRecord> rows = new ArrayList<>();
            for (CSVRecord rec : parser) {
                Instant ts = Instant.parse(rec.get(0));
                double[] values = new double[expected.size()];
                for (int c = 0; c < values.length; c++) {
                    values[c] = Double.parseDouble(rec.get(c + 1));
                }
                rows.add(new ProcessedRecord(kind, ts, expected, values));
            }
            return new FeatureTable(kind, expected, rows);

        } catch (IOException e) {
            throw new PersistenceException("read failed: " + file + ": " + e.getMessage(), e);
        } catch (DateTimeParseException | NumberFormatException | IndexOutOfBoundsException | IllegalStateException e) {
            throw new PersistenceException("corrupted processed file " + file + ": " + e.getMessage(), e);
        }
    }

    private static CSVFormat format(List<String> header) {
        return CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build();
    }
}
