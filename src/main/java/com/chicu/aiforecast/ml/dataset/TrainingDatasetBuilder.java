package com.chicu.aiforecast.ml.dataset;

import com.chicu.aiforecast.etl.features.FeatureSchema;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.etl.features.ProcessedRecord;
import com.chicu.aiforecast.ml.ModelTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает датасет для обучения из processed-снапшота:
 * - X: double[][] (порядок колонок = FeatureSchema снапшота)
 * - y: double[] (регрессия — значение, классификация — индекс класса)
 *
 * Сэмпл i = фичи записи i, метка из записи i+1, поэтому сэмплов на один меньше, чем записей.
 */
@Slf4j
@Service
public class TrainingDatasetBuilder {

    /**
     * Сырые строки датасета до сборки.
     */
    public record Rows(
            String datasetId,
            FeatureSchema schema,
            List<double[]> Xrows,
            List<Double> y,
            List<String> classLabels,
            Instant sourceSnapshotAt
    ) {}

    /**
     * Готовый датасет.
     * X: матрица [n_samples][n_features]
     * y: массив меток [n_samples]
     */
    public record Dataset(
            String datasetId,
            FeatureSchema schema,
            double[][] X,
            double[] y,
            int samples,
            int features,
            List<String> classLabels,
            Instant sourceSnapshotAt
    ) {
        public boolean classification() {
            return !classLabels.isEmpty();
        }
    }

    public Rows rows(ModelTarget target, FeatureTable table) {
        if (target == null) throw new IllegalArgumentException("target=null");
        if (table == null) throw new IllegalArgumentException("table=null");
        if (table.source() != target.source()) {
            throw new IllegalArgumentException("таблица " + table.source().id() + " не подходит для " + target.modelName());
        }

        int labelIdx = table.schema().indexOf(target.labelColumn());
        if (labelIdx < 0) {
            throw new IllegalArgumentException("в схеме нет колонки метки " + target.labelColumn());
        }

        List<ProcessedRecord> recs = table.records();
        List<double[]> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (int i = 0; i + 1 < recs.size(); i++) {
            x.add(recs.get(i).values().clone());
            y.add(target.label(recs.get(i + 1).values()[labelIdx]));
        }

        Instant last = recs.isEmpty() ? null : recs.get(recs.size() - 1).timestamp();
        return new Rows(target.modelName(), table.schema(), x, y, target.classLabels(), last);
    }

    public Dataset build(Rows rows) {
        if (rows == null) throw new IllegalArgumentException("rows=null");

        List<double[]> Xrows = rows.Xrows();
        List<Double> yList = rows.y();

        if (Xrows == null || yList == null) {
            throw new IllegalArgumentException("rows.Xrows/rows.y is null");
        }
        if (rows.schema() == null) {
            throw new IllegalArgumentException("rows.schema is null");
        }
        if (Xrows.size() != yList.size()) {
            throw new IllegalArgumentException("размеры не совпадают: Xrows=" + Xrows.size() + " y=" + yList.size());
        }

        int n = Xrows.size();
        int f = rows.schema().size();
        List<String> labels = rows.classLabels() == null ? List.of() : List.copyOf(rows.classLabels());

        for (int i = 0; i < n; i++) {
            double[] r = Xrows.get(i);
            if (r == null) throw new IllegalArgumentException("Xrows[" + i + "]=null");
            if (r.length != f) {
                throw new IllegalArgumentException("разная длина фич: row=" + i + " len=" + r.length + " expected=" + f);
            }
            Double lbl = yList.get(i);
            if (lbl == null || !Double.isFinite(lbl)) {
                throw new IllegalArgumentException("y[" + i + "]=" + lbl);
            }
            if (!labels.isEmpty() && (lbl < 0 || lbl >= labels.size() || lbl != Math.rint(lbl))) {
                throw new IllegalArgumentException("y[" + i + "] должен быть индексом класса 0.." + (labels.size() - 1) + ", а пришло: " + lbl);
            }
        }

        double[][] X = new double[n][f];
        double[] y = new double[n];

        for (int i = 0; i < n; i++) {
            System.arraycopy(Xrows.get(i), 0, X[i], 0, f);
            y[i] = yList.get(i);
        }

        log.info("📦 Dataset built: id={} samples={} features={}", rows.datasetId(), n, f);

        return new Dataset(rows.datasetId(), rows.schema(), X, y, n, f, labels, rows.sourceSnapshotAt());
    }
}
