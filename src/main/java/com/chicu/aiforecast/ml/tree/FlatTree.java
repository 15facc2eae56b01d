package com.chicu.aiforecast.ml.tree;

/**
 * Дерево в плоских массивах. Узел i: feature[i] &lt; 0 → лист со значением value[i],
 * иначе x[feature] &lt;= threshold → left[i], иначе right[i].
 * gain[i] — уменьшение SSE на сплите узла i (0 для листа).
 */
public record FlatTree(
        int[] feature,
        double[] threshold,
        int[] left,
        int[] right,
        double[][] value,
        double[] gain
) {

    public double[] predict(double[] x) {
        int node = 0;
        while (feature[node] >= 0) {
            node = x[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    /**
     * Сумма gain по сплитам каждой фичи. Дерево без gain (старый params-файл) → нули.
     */
    public void accumulateGain(double[] perFeature) {
        if (gain == null) return;
        for (int i = 0; i < feature.length; i++) {
            int f = feature[i];
            if (f >= 0 && f < perFeature.length) perFeature[f] += gain[i];
        }
    }
}
