package com.dehazing.patchRecurrence.matchAndFilter;

import com.dehazing.patchRecurrence.AirlightConfig.MatcherType;
import com.dehazing.patchRecurrence.exception.ConfigurationException;
import com.dehazing.patchRecurrence.patch.Patch;
import com.dehazing.patchRecurrence.patch.PatchArena;
import com.dehazing.patchRecurrence.patch.ScalePatches;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;
import org.bytedeco.opencv.opencv_features2d.FlannBasedMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * Ghép patch có texture (query, bucket 7..9) với patch phẳng (candidate, bucket 0..5)
 * giống nhất của mọi scale. Bucket 6 được bỏ trống làm vùng đệm giữa hai nhóm.
 * <p>
 * A single matcher is trained on the candidate vectors of all scales; every scale then
 * queries it once with its (possibly subsampled) query vectors.
 */
public class PairGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(PairGenerator.class);

    public static final int CANDIDATE_MIN_BUCKET = 0;
    public static final int CANDIDATE_MAX_BUCKET = 5;
    public static final int QUERY_MIN_BUCKET = 7;
    public static final int QUERY_MAX_BUCKET = 9;

    private final int kNearest;
    private final int numQueryPatches;
    private final long seed;
    private final MatcherType matcherType;

    public PairGenerator(int kNearest, int numQueryPatches, long seed, MatcherType matcherType) {
        if (kNearest <= 0) throw new ConfigurationException("K nearest must be positive: " + kNearest);
        this.kNearest = kNearest;
        this.numQueryPatches = numQueryPatches;
        this.seed = seed;
        this.matcherType = matcherType;
    }

    public static boolean isCandidate(Patch p) {
        return p.getBucket() >= CANDIDATE_MIN_BUCKET && p.getBucket() <= CANDIDATE_MAX_BUCKET;
    }

    public static boolean isQuery(Patch p) {
        return p.getBucket() >= QUERY_MIN_BUCKET && p.getBucket() <= QUERY_MAX_BUCKET;
    }

    public List<CandidatePair> generatePairs(PatchArena arena) {
        // Bảng tra: chỉ số cục bộ trong ma trận candidate -> handle toàn cục trong arena
        List<Integer> candidateHandles = new ArrayList<>();
        List<int[]> queryIndices = new ArrayList<>();
        for (int k = 0; k < arena.scaleCount(); k++) {
            ScalePatches scale = arena.scale(k);
            List<Integer> qi = new ArrayList<>();
            for (int i = 0; i < scale.size(); i++) {
                Patch p = scale.get(i);
                if (isQuery(p)) qi.add(i);
                if (isCandidate(p)) candidateHandles.add(arena.handle(k, i));
            }
            queryIndices.add(subsample(qi));
        }

        if (kNearest > candidateHandles.size()) {
            throw new ConfigurationException("K nearest (" + kNearest + ") exceeds the " + candidateHandles.size()
                    + " available candidate patches");
        }

        List<CandidatePair> pairs = new ArrayList<>();
        Mat candidates = toDescriptorMat(candidateHandles.size(), r -> arena.get(candidateHandles.get(r)).getNorm());
        MatVector trainSet = new MatVector(candidates);
        DescriptorMatcher matcher = createMatcher();
        try {
            matcher.add(trainSet);
            matcher.train();
            LOG.debug("Trained {} matcher on {} candidate patches", matcherType, candidateHandles.size());

            for (int k = 0; k < arena.scaleCount(); k++) {
                int[] qi = queryIndices.get(k);
                if (qi.length == 0) {
                    LOG.debug("Scale {} has no query patches", k);
                    continue;
                }
                ScalePatches scale = arena.scale(k);
                Mat queries = toDescriptorMat(qi.length, r -> scale.get(qi[r]).getNorm());
                DMatchVectorVector knnMatches = new DMatchVectorVector();
                try {
                    matcher.knnMatch(queries, knnMatches, kNearest);
                    for (long i = 0; i < knnMatches.size(); i++) {
                        DMatchVector matches = knnMatches.get(i);
                        for (long j = 0; j < matches.size(); j++) {
                            DMatch m = matches.get(j);
                            int queryHandle = arena.handle(k, qi[m.queryIdx()]);
                            pairs.add(new CandidatePair(queryHandle, candidateHandles.get(m.trainIdx())));
                        }
                    }
                } finally {
                    knnMatches.close();
                    queries.release();
                }
                LOG.debug("Scale {}: {} query patches", k, qi.length);
            }
        } finally {
            matcher.close();
            trainSet.close();
            candidates.release();
        }
        return pairs;
    }

    /**
     * 2 láng giềng gần nhất (chính xác) của mọi patch ở scale đầu tiên, dùng vector pixel thô
     * thay vì vector chuẩn hoá. Hàng {@code i} thuộc về patch {@code i} và thường chứa chính nó,
     * vì vậy kết quả cần đi qua {@link DuplicateRemover}.
     */
    public int[][] generateRawPairs(ScalePatches scale) {
        int n = scale.size();
        if (n < 2) return new int[0][];

        Mat raw = toDescriptorMat(n, r -> scale.get(r).getRaw());
        BFMatcher matcher = new BFMatcher(NORM_L2, false);
        DMatchVectorVector knnMatches = new DMatchVectorVector();
        try {
            matcher.knnMatch(raw, raw, knnMatches, 2);
            int[][] nearest = new int[n][];
            for (long i = 0; i < knnMatches.size(); i++) {
                DMatchVector matches = knnMatches.get(i);
                int[] row = new int[(int) matches.size()];
                for (int j = 0; j < row.length; j++) row[j] = matches.get(j).trainIdx();
                nearest[(int) i] = row;
            }
            return nearest;
        } finally {
            knnMatches.close();
            matcher.close();
            raw.release();
        }
    }

    /**
     * Chọn ngẫu nhiên (seed cố định) tối đa {@code numQueryPatches} chỉ số, không lặp,
     * giữ thứ tự ban đầu.
     */
    int[] subsample(List<Integer> indices) {
        int n = indices.size();
        if (n <= numQueryPatches) {
            return indices.stream().mapToInt(Integer::intValue).toArray();
        }
        int[] positions = new int[n];
        for (int i = 0; i < n; i++) positions[i] = i;
        Random rnd = new Random(seed);
        for (int i = 0; i < numQueryPatches; i++) {
            int swap = i + rnd.nextInt(n - i);
            int tmp = positions[i];
            positions[i] = positions[swap];
            positions[swap] = tmp;
        }
        int[] selection = Arrays.copyOf(positions, numQueryPatches);
        Arrays.sort(selection);
        int[] out = new int[numQueryPatches];
        for (int i = 0; i < out.length; i++) out[i] = indices.get(selection[i]);
        return out;
    }

    private DescriptorMatcher createMatcher() {
        if (matcherType == MatcherType.BRUTE_FORCE) {
            return new BFMatcher(NORM_L2, false);
        }
        return new FlannBasedMatcher();
    }

    private static Mat toDescriptorMat(int rows, Function<Integer, double[]> rowSource) {
        int cols = rowSource.apply(0).length;
        Mat mat = new Mat(rows, cols, CV_32F);
        float[] buf = new float[rows * cols];
        for (int r = 0; r < rows; r++) {
            double[] v = rowSource.apply(r);
            for (int c = 0; c < cols; c++) buf[r * cols + c] = (float) v[c];
        }
        try (FloatIndexer idx = mat.createIndexer()) {
            idx.put(0L, buf);
        }
        return mat;
    }
}
