package com.dehazing.patchRecurrence.matchAndFilter;

import com.dehazing.patchRecurrence.patch.Patch;
import lombok.Getter;

/**
 * Hai patch được coi là cùng một cấu trúc ảnh nhưng bị phủ sương với độ truyền qua khác nhau.
 * <p>
 * With the haze model {@code I = t J + (1 - t) A}, the patch with the smaller standard
 * deviation ({@code lo}) satisfies {@code lo = r hi + (1 - r) A} where
 * {@code r = std(lo) / std(hi)} is the transmission ratio. The airlight follows from the
 * channel means; the model residual over the pixels is the outlier indicator.
 */
public class Pair {
    public static final int CHANNELS = Patch.CHANNELS;
    static final double MIN_CONTRAST = 1e-6;

    @Getter
    private final Patch first;
    @Getter
    private final Patch second;
    private PairEstimate estimate;

    public Pair(Patch first, Patch second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Pair whose estimate is already known, e.g. restored from an earlier run.
     */
    public static Pair withEstimate(Patch first, Patch second, PairEstimate estimate) {
        Pair pair = new Pair(first, second);
        pair.estimate = estimate;
        return pair;
    }

    /**
     * Tính airlight, trọng số và chỉ số outlier. Chỉ được gọi một lần.
     */
    public PairEstimate calculateOutlier() {
        if (estimate != null) {
            throw new IllegalStateException("Estimate already computed for " + this);
        }
        estimate = computeEstimate();
        return estimate;
    }

    public boolean isEstimated() {
        return estimate != null;
    }

    public PairEstimate getEstimate() {
        if (estimate == null) {
            throw new IllegalStateException("calculateOutlier() has not been called for " + this);
        }
        return estimate;
    }

    public double[] getAirlight() {
        return getEstimate().getAirlight();
    }

    public double getWeight() {
        return getEstimate().getWeight();
    }

    public double getOutlierIndicator() {
        return getEstimate().getOutlierIndicator();
    }

    private PairEstimate computeEstimate() {
        Patch hi = first.getRawStdDev() >= second.getRawStdDev() ? first : second;
        Patch lo = hi == first ? second : first;

        double stdHi = hi.getRawStdDev();
        double stdLo = lo.getRawStdDev();
        if (!(stdHi > 0)) return PairEstimate.degenerate();
        double ratio = stdLo / stdHi;
        if (ratio >= 1.0 - MIN_CONTRAST) return PairEstimate.degenerate();

        double[] meanHi = hi.getMean();
        double[] meanLo = lo.getMean();
        double[] airlight = new double[CHANNELS];
        for (int c = 0; c < CHANNELS; c++) {
            airlight[c] = (meanLo[c] - ratio * meanHi[c]) / (1.0 - ratio);
        }

        // Phần dư của mô hình lo = r*hi + (1-r)*A trên từng pixel
        double[] rawHi = hi.getRaw();
        double[] rawLo = lo.getRaw();
        double sq = 0;
        for (int i = 0; i < rawLo.length; i++) {
            int c = i % CHANNELS;
            double predicted = ratio * rawHi[i] + (1.0 - ratio) * airlight[c];
            double d = rawLo[i] - predicted;
            sq += d * d;
        }
        double residual = Math.sqrt(sq / rawLo.length);
        double indicator = stdLo > 0 ? residual / stdLo : residual;

        double outside = 0;
        for (double a : airlight) {
            if (a < 0) outside += -a;
            else if (a > 1) outside += a - 1;
        }
        return new PairEstimate(airlight, 1.0 - ratio, indicator + outside);
    }

    @Override
    public String toString() {
        return String.format("Pair[(%d: %d, %d) <-> (%d: %d, %d)]",
                first.getScaleIndex(), first.getRow(), first.getCol(),
                second.getScaleIndex(), second.getRow(), second.getCol());
    }
}
