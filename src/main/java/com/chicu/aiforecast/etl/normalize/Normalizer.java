package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.RecordValidationException;
import com.chicu.aiforecast.config.FeatureProperties;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * RawRecord → типизированные Observation.
 * Порядок: приведение типов → валидация → сортировка → forward-fill → клиппинг выбросов.
 * Ни времени "сейчас", ни случайности: одинаковый вход даёт одинаковый выход.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Normalizer {

    private static final int MIN_ROWS_FOR_CLIP = 3;

    private final SourceProperties sourceProperties;
    private final FeatureProperties featureProperties;

    public NormalizedBatch normalize(SourceKind kind, List<RawRecord> records) {
        if (kind == null) throw new IllegalArgumentException("kind=null");

        SourceSchema schema = SourceSchema.of(kind);
        List<Row> rows = new ArrayList<>();
        Set<Instant> seen = new HashSet<>();
        int dropped = 0;

        for (RawRecord r : records == null ? List.<RawRecord>of() : records) {
            try {
                Row row = coerce(schema, r);
                if (!seen.add(row.ts)) {
                    throw new RecordValidationException("duplicate timestamp " + row.ts);
                }
                rows.add(row);
            } catch (RecordValidationException e) {
                dropped++;
                log.debug("🧹 DROP source={} reason={}", kind.id(), e.getMessage());
            }
        }

        rows.sort(Comparator.comparing(row -> row.ts));

        double[][] matrix = forwardFill(schema, rows);
        clipOutliers(schema, matrix);
        clampNonNegative(schema, matrix);

        List<Observation> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            out.add(schema.create(rows.get(i).ts, matrix[i], rows.get(i).text));
        }

        if (dropped > 0) {
            log.warn("🧹 NORMALIZE source={} kept={} dropped={}", kind.id(), out.size(), dropped);
        } else {
            log.info("🧹 NORMALIZE source={} kept={}", kind.id(), out.size());
        }
        return new NormalizedBatch(kind, out, dropped);
    }

    // =====================================================
    // (a) приведение типов + валидация
    // =====================================================

    private Row coerce(SourceSchema schema, RawRecord r) {
        if (r == null) {
            throw new RecordValidationException("record=null");
        }
        if (r.source() != schema.kind()) {
            throw new RecordValidationException("record of " + r.source().id() + " in " + schema.kind().id() + " batch");
        }
        if (r.timestamp() == null) {
            throw new RecordValidationException("no timestamp");
        }

        Double[] values = new Double[schema.width()];
        boolean any = false;
        for (int c = 0; c < values.length; c++) {
            values[c] = toDouble(r.field(schema.numericColumns().get(c)));
            any |= values[c] != null;
        }
        if (!any) {
            throw new RecordValidationException("all numeric fields missing at " + r.timestamp());
        }

        String text = null;
        if (schema.textColumn() != null) {
            Object t = r.field(schema.textColumn());
            if (t != null && !t.toString().isBlank()) {
                text = t.toString().trim().toLowerCase(Locale.ROOT);
            }
        }
        return new Row(r.timestamp(), values, text);
    }

    static Double toDouble(Object v) {
        if (v == null) return null;
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s) {
            String x = s.trim();
            if (x.isEmpty()) return null;
            try {
                d = Double.parseDouble(x);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    // =====================================================
    // (b) пропуски: предыдущее значение → дефолт из конфига → дефолт схемы
    // =====================================================

    private double[][] forwardFill(SourceSchema schema, List<Row> rows) {
        Map<String, Double> configured = sourceProperties.forSource(schema.kind()).getDefaults();
        int w = schema.width();
        double[][] m = new double[rows.size()][w];

        for (int c = 0; c < w; c++) {
            String col = schema.numericColumns().get(c);
            Double prev = null;
            for (int i = 0; i < rows.size(); i++) {
                Double v = rows.get(i).values[c];
                if (v == null) {
                    v = prev;
                }
                if (v == null && configured != null) {
                    v = configured.get(col);
                }
                if (v == null) {
                    v = schema.defaults().getOrDefault(col, 0.0);
                }
                m[i][c] = v;
                prev = v;
            }
        }
        return m;
    }

    // =====================================================
    // (c) выбросы: mean ± z * std по колонке батча
    // =====================================================

    private void clipOutliers(SourceSchema schema, double[][] m) {
        int n = m.length;
        double z = featureProperties.getZScoreClip();
        if (n < MIN_ROWS_FOR_CLIP || !(z > 0)) return;

        for (int c = 0; c < schema.width(); c++) {
            double mean = 0;
            for (double[] row : m) mean += row[c];
            mean /= n;

            double var = 0;
            for (double[] row : m) var += (row[c] - mean) * (row[c] - mean);
            double std = Math.sqrt(var / n);
            if (std == 0) continue;

            double lo = mean - z * std;
            double hi = mean + z * std;
            int clipped = 0;
            for (double[] row : m) {
                if (row[c] < lo) {
                    row[c] = lo;
                    clipped++;
                } else if (row[c] > hi) {
                    row[c] = hi;
                    clipped++;
                }
            }
            if (clipped > 0) {
                log.debug("✂️ CLIP source={} col={} clipped={} band=[{}, {}]",
                        schema.kind().id(), schema.numericColumns().get(c), clipped, lo, hi);
            }
        }
    }

    private static void clampNonNegative(SourceSchema schema, double[][] m) {
        for (int c = 0; c < schema.width(); c++) {
            if (!schema.nonNegative().contains(schema.numericColumns().get(c))) continue;
            for (double[] row : m) {
                if (row[c] < 0) row[c] = 0;
            }
        }
    }

    private record Row(Instant ts, Double[] values, String text) {}
}
