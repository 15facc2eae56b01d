package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.config.FeatureProperties;
import com.chicu.aiforecast.etl.normalize.NormalizedBatch;
import com.chicu.aiforecast.etl.normalize.Observation;
import com.chicu.aiforecast.etl.normalize.SourceSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * NormalizedBatch → FeatureTable.
 * Колонки: базовые, затем {@code <col>_ma} и {@code <col>_growth} по каждой базовой, затем фичи источника.
 */
@Slf4j
@Component
public class FeatureEngineer {

    private final FeatureProperties props;
    private final Map<SourceKind, FeatureRecipe> recipes = new EnumMap<>(SourceKind.class);

    public FeatureEngineer(FeatureProperties props) {
        this.props = props;
        register(new EpidemicFeatures());
        register(new WeatherFeatures());
        register(new MarketFeatures(props));
    }

    private void register(FeatureRecipe r) {
        recipes.put(r.kind(), r);
    }

    public FeatureSchema schemaFor(SourceKind kind) {
        SourceSchema base = SourceSchema.of(kind);
        List<String> names = new ArrayList<>(base.numericColumns());
        for (String col : base.numericColumns()) {
            names.add(col + "_ma");
            names.add(col + "_growth");
        }
        names.addAll(recipe(kind).extraColumns());
        return new FeatureSchema(names);
    }

    public FeatureTable transform(NormalizedBatch batch) {
        if (batch == null) throw new IllegalArgumentException("batch=null");

        SourceKind kind = batch.kind();
        SourceSchema base = SourceSchema.of(kind);
        FeatureSchema schema = schemaFor(kind);
        List<Observation> obs = batch.observations();
        int n = obs.size();
        int width = base.width();

        // ====== колонки базовых метрик ======
        double[][] cols = new double[width][n];
        for (int i = 0; i < n; i++) {
            double[] v = obs.get(i).values();
            for (int c = 0; c < width; c++) cols[c][i] = v[c];
        }

        double[][] matrix = new double[n][schema.size()];
        int at = 0;
        for (int c = 0; c < width; c++) put(matrix, at++, cols[c]);
        for (int c = 0; c < width; c++) {
            put(matrix, at++, Indicators.movingAverage(cols[c], props.getMovingAverageWindow()));
            put(matrix, at++, Indicators.growth(cols[c]));
        }

        FeatureRecipe recipe = recipe(kind);
        Map<String, double[]> extras = recipe.extras(obs);
        for (String name : recipe.extraColumns()) {
            double[] col = extras.get(name);
            if (col == null || col.length != n) {
                throw new IllegalStateException("recipe " + kind.id() + " не вернул колонку " + name);
            }
            put(matrix, at++, col);
        }
        if (at != schema.size()) {
            throw new IllegalStateException("заполнено " + at + " колонок из " + schema.size());
        }

        List<ProcessedRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            checkFinite(schema, matrix[i], i);
            out.add(new ProcessedRecord(kind, obs.get(i).timestamp(), schema, matrix[i]));
        }

        log.info("🧮 FEATURES source={} records={} features={}", kind.id(), n, schema.size());
        return new FeatureTable(kind, schema, out);
    }

    private FeatureRecipe recipe(SourceKind kind) {
        FeatureRecipe r = recipes.get(kind);
        if (r == null) throw new IllegalStateException("нет рецепта фич для " + kind);
        return r;
    }

    private static void put(double[][] matrix, int col, double[] series) {
        for (int i = 0; i < matrix.length; i++) matrix[i][col] = series[i];
    }

    private static void checkFinite(FeatureSchema schema, double[] row, int index) {
        for (int c = 0; c < row.length; c++) {
            if (!Double.isFinite(row[c])) {
                throw new IllegalStateException("non-finite feature " + schema.names().get(c)
                        + " в записи #" + index + ": " + row[c]);
            }
        }
    }
}
