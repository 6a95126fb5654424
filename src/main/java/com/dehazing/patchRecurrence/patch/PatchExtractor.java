package com.dehazing.patchRecurrence.patch;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

public class PatchExtractor {
    private final int patchSize;

    public PatchExtractor(int patchSize) {
        if (patchSize <= 0) throw new IllegalArgumentException("patch size must be positive: " + patchSize);
        this.patchSize = patchSize;
    }

    /**
     * Cắt patch trên lưới {@code [0, rows-P) x [0, cols-P)} với bước {@code step}, theo thứ tự hàng.
     *
     * @param scaled     3-channel image of one scale level, values in [0, 1]
     * @param scaleIndex position of the scale in the scale sequence
     * @param step       1 for dense extraction, 2 for alternate patches
     */
    public ScalePatches extract(Mat scaled, int scaleIndex, int step) {
        if (scaled.channels() != Patch.CHANNELS) {
            throw new IllegalArgumentException("Expected a 3-channel image, got " + scaled.channels() + " channels");
        }
        int rows = scaled.rows();
        int cols = scaled.cols();
        List<Patch> patches = new ArrayList<>();
        if (rows <= patchSize || cols <= patchSize) {
            return new ScalePatches(scaleIndex, rows, cols, patchSize, step, patches);
        }
        double[] pixels = readPixels(scaled);

        int rowLength = cols * Patch.CHANNELS;
        int blockRow = patchSize * Patch.CHANNELS;
        for (int i = 0; i < rows - patchSize; i += step) {
            for (int j = 0; j < cols - patchSize; j += step) {
                double[] raw = new double[patchSize * blockRow];
                for (int y = 0; y < patchSize; y++) {
                    System.arraycopy(pixels, (i + y) * rowLength + j * Patch.CHANNELS, raw, y * blockRow, blockRow);
                }
                patches.add(Patch.of(scaleIndex, i, j, patchSize, raw));
            }
        }
        return new ScalePatches(scaleIndex, rows, cols, patchSize, step, patches);
    }

    public List<ScalePatches> extractAll(List<Mat> scaledImgs, int step) {
        List<ScalePatches> out = new ArrayList<>();
        for (int k = 0; k < scaledImgs.size(); k++) {
            out.add(extract(scaledImgs.get(k), k, step));
        }
        return out;
    }

    private static double[] readPixels(Mat img) {
        Mat src = img;
        if (img.depth() != CV_64F) {
            src = new Mat();
            img.convertTo(src, CV_64F);
        } else if (!img.isContinuous()) {
            src = img.clone();
        }
        double[] buf = new double[src.rows() * src.cols() * Patch.CHANNELS];
        try (DoubleIndexer idx = src.createIndexer()) {
            idx.get(0L, buf);
        }
        return buf;
    }
}
