package com.dehazing.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2RGB;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * Đọc ảnh màu và đưa về RGB, kiểu double, giá trị trong [0, 1].
 */
public class ImageLoader {

    public static Mat load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image not found: " + path);
        }
        Mat bgr = imread(path.toString(), IMREAD_COLOR);
        if (bgr == null || bgr.empty()) {
            throw new IOException("Cannot decode image " + path);
        }
        return toNormalizedRgb(bgr);
    }

    public static Mat decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Empty image data");
        }
        Mat bgr = imdecode(new Mat(bytes), IMREAD_COLOR);
        if (bgr == null || bgr.empty()) {
            throw new IOException("Cannot decode image data (" + bytes.length + " bytes)");
        }
        return toNormalizedRgb(bgr);
    }

    public static Mat toNormalizedRgb(Mat bgr) {
        Mat rgb = new Mat();
        cvtColor(bgr, rgb, COLOR_BGR2RGB);
        Mat normalized = new Mat();
        rgb.convertTo(normalized, CV_64F, 1.0 / 255.0, 0.0);
        rgb.release();
        return normalized;
    }
}
