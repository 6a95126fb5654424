package com.dehazing.patchRecurrence.patch;

import lombok.Getter;

/**
 * Một patch vuông {@code patchSize x patchSize x 3} lấy từ một scale, cùng các thống kê của nó.
 * <p>
 * The raw block is stored row-major with interleaved RGB channels. Instances are
 * immutable: the block is copied on creation, the array getters return copies, and the
 * smoothing and bucketing steps hand back new patches through {@link #withStdDev(double)}
 * and {@link #withBucket(int)}, sharing the internal arrays.
 */
@Getter
public class Patch {
    public static final int CHANNELS = 3;
    public static final int NO_BUCKET = -1;

    private final int scaleIndex;
    private final int row;
    private final int col;
    private final int patchSize;

    private final double[] raw;
    private final double[] mean;
    // độ lệch chuẩn của chính block; stdDev có thể là giá trị đã làm mượt
    private final double rawStdDev;
    private final double stdDev;
    private final double[] norm;
    private final int bucket;

    private Patch(int scaleIndex, int row, int col, int patchSize,
                  double[] raw, double[] mean, double rawStdDev, double stdDev, double[] norm, int bucket) {
        this.scaleIndex = scaleIndex;
        this.row = row;
        this.col = col;
        this.patchSize = patchSize;
        this.raw = raw;
        this.mean = mean;
        this.rawStdDev = rawStdDev;
        this.stdDev = stdDev;
        this.norm = norm;
        this.bucket = bucket;
    }

    /**
     * Builds a patch from its raw block, computing the channel means, the standard
     * deviation of every value of the block around its channel mean, and the
     * normalized vector.
     */
    public static Patch of(int scaleIndex, int row, int col, int patchSize, double[] raw) {
        int length = patchSize * patchSize * CHANNELS;
        if (raw.length != length) {
            throw new IllegalArgumentException("Patch block needs " + length + " values, got " + raw.length);
        }

        double[] mean = new double[CHANNELS];
        for (int i = 0; i < length; i++) mean[i % CHANNELS] += raw[i];
        int pixels = patchSize * patchSize;
        for (int c = 0; c < CHANNELS; c++) mean[c] /= pixels;

        // độ lệch so với trung bình của từng kênh, gộp trên cả 3 kênh
        double sq = 0;
        for (int i = 0; i < length; i++) {
            double d = raw[i] - mean[i % CHANNELS];
            sq += d * d;
        }
        double std = Math.sqrt(sq / length);

        // std == 0: patch phẳng hoàn toàn -> vector chuẩn hoá bằng 0
        double[] norm = new double[length];
        if (std > 0) {
            for (int i = 0; i < length; i++) norm[i] = (raw[i] - mean[i % CHANNELS]) / std;
        }
        return new Patch(scaleIndex, row, col, patchSize, raw.clone(), mean, std, std, norm, NO_BUCKET);
    }

    public double[] getRaw() {
        return raw.clone();
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getNorm() {
        return norm.clone();
    }

    public Patch withStdDev(double smoothedStdDev) {
        return new Patch(scaleIndex, row, col, patchSize, raw, mean, rawStdDev, smoothedStdDev, norm, bucket);
    }

    public Patch withBucket(int newBucket) {
        if (bucket != NO_BUCKET) {
            throw new IllegalStateException("Bucket already assigned to " + this);
        }
        return new Patch(scaleIndex, row, col, patchSize, raw, mean, rawStdDev, stdDev, norm, newBucket);
    }

    public boolean hasBucket() {
        return bucket != NO_BUCKET;
    }

    @Override
    public String toString() {
        return String.format("Patch[scale=%d] at (%d, %d) mean=(%.4f, %.4f, %.4f) std=%.4f bucket=%d",
                scaleIndex, row, col, mean[0], mean[1], mean[2], stdDev, bucket);
    }
}
