package com.dehazing.patchRecurrence.matchAndFilter;

import lombok.Getter;

/**
 * Airlight proposed by one pair of patches, the weight it carries in the global
 * average and how badly the pair disagrees with the haze model (lower is better).
 */
@Getter
public class PairEstimate {
    private final double[] airlight;
    private final double weight;
    private final double outlierIndicator;

    public PairEstimate(double[] airlight, double weight, double outlierIndicator) {
        this.airlight = airlight.clone();
        this.weight = weight;
        this.outlierIndicator = outlierIndicator;
    }

    public double[] getAirlight() {
        return airlight.clone();
    }

    public static PairEstimate degenerate() {
        return new PairEstimate(new double[Pair.CHANNELS], 0.0, Double.POSITIVE_INFINITY);
    }
}
