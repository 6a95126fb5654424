package com.dehazing.patchRecurrence;

import com.dehazing.patchRecurrence.exception.ConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Numeric parameters threaded through every stage of the airlight pipeline.
 * Bound from the {@code airlight.*} keys of application.yml when running inside
 * Spring, built directly by the command line and the tests otherwise.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "airlight")
public class AirlightConfig {

    public enum MatcherType {FLANN, BRUTE_FORCE}

    // Thứ tự giảm dần là bắt buộc: chỉ số toàn cục được ghép theo thứ tự scale
    private List<Double> scales = new ArrayList<>(Arrays.asList(1.0, 0.75, 0.5, 0.375, 0.3, 0.25));

    private int patchSize = 7;
    private int numBuckets = 10;
    private int nearestNeighbours = 5;
    private int numQueryPatches = 2000;
    private double pairThreshold = 0.9;
    private double outlierThreshold = 0.2;

    private long seed = 0L;

    // step 1 (dense) thay vì step 2 (sparse + smoothing)
    private boolean allPatches = false;
    // bỏ qua ngưỡng tương quan
    private boolean allPairs = false;
    private boolean removeDuplicates = false;
    private MatcherType matcher = MatcherType.FLANN;

    public int getStep() {
        return allPatches ? 1 : 2;
    }

    /**
     * Fails fast on anything the stages cannot work with, before any image is touched.
     */
    public AirlightConfig validate() {
        if (patchSize <= 0) throw new ConfigurationException("patch size must be positive: " + patchSize);
        if (numBuckets <= 0) throw new ConfigurationException("bucket count must be positive: " + numBuckets);
        if (nearestNeighbours <= 0) throw new ConfigurationException("K nearest must be positive: " + nearestNeighbours);
        if (numQueryPatches <= 0) throw new ConfigurationException("query patch count must be positive: " + numQueryPatches);
        if (scales == null || scales.isEmpty()) throw new ConfigurationException("at least one scale factor is required");

        double previous = Double.POSITIVE_INFINITY;
        for (Double sc : scales) {
            if (sc == null || !(sc > 0)) {
                throw new ConfigurationException("scale factors must be positive: " + scales);
            }
            if (sc >= previous) {
                throw new ConfigurationException("scale factors must be strictly decreasing: " + scales);
            }
            previous = sc;
        }
        return this;
    }

    public double[] scaleFactors() {
        double[] out = new double[scales.size()];
        for (int i = 0; i < out.length; i++) out[i] = scales.get(i);
        return out;
    }

    @Override
    public String toString() {
        return String.format("AirlightConfig[scales=%s, patchSize=%d, buckets=%d, K=%d, queries=%d, pairThreshold=%.3f, outlierThreshold=%.3f, seed=%d, step=%d, allPairs=%b, removeDuplicates=%b, matcher=%s]",
                scales, patchSize, numBuckets, nearestNeighbours, numQueryPatches, pairThreshold, outlierThreshold, seed, getStep(), allPairs, removeDuplicates, matcher);
    }
}
