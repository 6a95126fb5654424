package com.dehazing.patchRecurrence.matchAndFilter;

import java.util.ArrayList;
import java.util.List;

public class OutlierRemover {
    private final double outlierThreshold;

    public OutlierRemover(double outlierThreshold) {
        this.outlierThreshold = outlierThreshold;
    }

    /**
     * Computes each pair's estimate and keeps the pairs whose outlier indicator does
     * not exceed the threshold.
     */
    public List<Pair> removeOutliers(List<Pair> pairs) {
        List<Pair> kept = new ArrayList<>();
        for (Pair pair : pairs) {
            if (!pair.isEstimated()) pair.calculateOutlier();
            if (pair.getOutlierIndicator() <= outlierThreshold) {
                kept.add(pair);
            }
        }
        return kept;
    }
}
