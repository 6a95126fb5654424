package com.dehazing.patchRecurrence.patch;

import com.dehazing.patchRecurrence.exception.ConfigurationException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgproc.INTER_CUBIC;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

public class Scaler {

    /**
     * Trả về các bản resize của ảnh theo thứ tự của {@code scales} (nội suy bicubic).
     * Factor 1 vẫn đi qua resize để mọi scale có cùng kiểu Mat.
     * A factor that shrinks a side below one pixel yields an empty level of the same type.
     */
    public List<Mat> scale(Mat img, double[] scales) {
        double previous = Double.POSITIVE_INFINITY;
        for (double sc : scales) {
            if (!(sc > 0) || sc >= previous) {
                throw new ConfigurationException("Scale factors must be positive and strictly decreasing");
            }
            previous = sc;
        }

        List<Mat> outputs = new ArrayList<>();
        for (double sc : scales) {
            // cùng cách làm tròn với resize của OpenCV (cvRound)
            int rows = (int) Math.rint(img.rows() * sc);
            int cols = (int) Math.rint(img.cols() * sc);
            if (rows <= 0 || cols <= 0) {
                outputs.add(new Mat(Math.max(rows, 0), Math.max(cols, 0), img.type()));
                continue;
            }
            Mat resized = new Mat();
            resize(img, resized, new Size(), sc, sc, INTER_CUBIC);
            outputs.add(resized);
        }
        return outputs;
    }
}
