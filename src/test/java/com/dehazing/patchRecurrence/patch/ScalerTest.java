package com.dehazing.patchRecurrence.patch;

import com.dehazing.patchRecurrence.TestImages;
import com.dehazing.patchRecurrence.exception.ConfigurationException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_64FC3;

public class ScalerTest {
    @Test
    public void testSizes() {
        final Mat img = TestImages.uniform(40, 80, 0.5, 0.5, 0.5);
        final List<Mat> scaled = new Scaler().scale(img, new double[] { 1.0, 0.75, 0.5, 0.25 });

        Assert.assertEquals(4, scaled.size());
        final int[][] expected = { { 40, 80 }, { 30, 60 }, { 20, 40 }, { 10, 20 } };
        for (int i = 0; i < expected.length; ++i) {
            Assert.assertEquals(expected[i][0], scaled.get(i).rows());
            Assert.assertEquals(expected[i][1], scaled.get(i).cols());
            Assert.assertEquals(CV_64FC3, scaled.get(i).type());
        }
    }

    @Test
    public void testLevelBelowOnePixelIsEmpty() {
        final Mat img = TestImages.uniform(2, 2, 0.5, 0.5, 0.5);
        final List<Mat> scaled = new Scaler().scale(img, new double[] { 1.0, 0.25 });

        Assert.assertEquals(2, scaled.size());
        Assert.assertEquals(2, scaled.get(0).rows());
        Assert.assertTrue(scaled.get(1).empty());
        Assert.assertEquals(CV_64FC3, scaled.get(1).type());

        ScalePatches patches = new PatchExtractor(7).extract(scaled.get(1), 1, 2);
        Assert.assertTrue(patches.isEmpty());
        Assert.assertEquals(0, patches.getGridRows());
        Assert.assertTrue(new Smoother().smooth(patches).isEmpty());
    }

    @Test(expected = ConfigurationException.class)
    public void testIncreasingFactorsRejected() {
        new Scaler().scale(TestImages.uniform(10, 10, 0, 0, 0), new double[] { 0.5, 1.0 });
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveFactorRejected() {
        new Scaler().scale(TestImages.uniform(10, 10, 0, 0, 0), new double[] { 1.0, 0.0 });
    }
}
