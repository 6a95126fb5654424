package com.dehazing.imageOperator;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imencode;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

public class ImageLoaderTest {
    private static final double EPSILON = 1e-12;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    // B = 0, G = 128, R = 255 theo thứ tự của OpenCV
    private static Mat bgrImage() {
        return new Mat(6, 9, CV_8UC3, new Scalar(0, 128, 255, 0));
    }

    private static void assertRgb(Mat img) {
        Assert.assertEquals(6, img.rows());
        Assert.assertEquals(9, img.cols());
        Assert.assertEquals(3, img.channels());
        Assert.assertEquals(CV_64F, img.depth());
        try (DoubleIndexer idx = img.createIndexer()) {
            for (int y = 0; y < img.rows(); y++) {
                for (int x = 0; x < img.cols(); x++) {
                    Assert.assertEquals(1.0, idx.get(y, x, 0), EPSILON);
                    Assert.assertEquals(128 / 255.0, idx.get(y, x, 1), EPSILON);
                    Assert.assertEquals(0.0, idx.get(y, x, 2), EPSILON);
                }
            }
        }
    }

    @Test
    public void testLoadPng() throws IOException {
        Path file = folder.getRoot().toPath().resolve("scene.png");
        Assert.assertTrue(imwrite(file.toString(), bgrImage()));
        assertRgb(ImageLoader.load(file));
    }

    @Test
    public void testDecodeBytes() throws IOException {
        BytePointer buf = new BytePointer();
        Assert.assertTrue(imencode(".png", bgrImage(), buf));
        byte[] bytes = new byte[(int) buf.limit()];
        buf.get(bytes);
        assertRgb(ImageLoader.decode(bytes));
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        ImageLoader.load(folder.getRoot().toPath().resolve("missing.png"));
    }

    @Test(expected = IOException.class)
    public void testUndecodableFile() throws IOException {
        Path file = folder.getRoot().toPath().resolve("broken.png");
        Files.write(file, new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 });
        ImageLoader.load(file);
    }

    @Test(expected = IOException.class)
    public void testEmptyBytes() throws IOException {
        ImageLoader.decode(new byte[0]);
    }
}
