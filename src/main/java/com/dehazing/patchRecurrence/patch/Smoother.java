package com.dehazing.patchRecurrence.patch;

import com.dehazing.patchRecurrence.exception.DimensionMismatchException;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.BORDER_DEFAULT;
import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;

/**
 * Làm mượt độ lệch chuẩn của các patch trên lưới của từng scale (Gaussian 7x7, sigma 6)
 * để việc chia bucket ít bị nhiễu.
 */
public class Smoother {
    public static final int KERNEL_SIZE = 7;
    public static final double SIGMA = 6.0;

    public ScalePatches smooth(ScalePatches scale) {
        int gridRows = scale.getGridRows();
        int gridCols = scale.getGridCols();
        if (scale.size() != gridRows * gridCols) {
            throw new DimensionMismatchException(String.format(
                    "Scale %d: %d patches cannot be reshaped to a %d x %d grid (step %d)",
                    scale.getScaleIndex(), scale.size(), gridRows, gridCols, scale.getStep()));
        }
        if (scale.isEmpty()) return scale;

        Mat stdGrid = new Mat(gridRows, gridCols, CV_64F);
        try (DoubleIndexer idx = stdGrid.createIndexer()) {
            idx.put(0L, scale.stdDevs());
        }

        Mat blur = new Mat();
        GaussianBlur(stdGrid, blur, new Size(KERNEL_SIZE, KERNEL_SIZE), SIGMA, SIGMA, BORDER_DEFAULT);

        double[] smoothed = new double[scale.size()];
        try (DoubleIndexer idx = blur.createIndexer()) {
            idx.get(0L, smoothed);
        }
        stdGrid.release();
        blur.release();

        List<Patch> out = new ArrayList<>(scale.size());
        for (int i = 0; i < smoothed.length; i++) {
            out.add(scale.get(i).withStdDev(smoothed[i]));
        }
        return scale.withPatches(out);
    }
}
