package com.dehazing.patchRecurrence;

import com.dehazing.patchRecurrence.cache.PatchCache;
import com.dehazing.patchRecurrence.exception.EmptyResultException;
import com.dehazing.patchRecurrence.matchAndFilter.AirlightEstimator;
import com.dehazing.patchRecurrence.matchAndFilter.CandidatePair;
import com.dehazing.patchRecurrence.matchAndFilter.DuplicateRemover;
import com.dehazing.patchRecurrence.matchAndFilter.OutlierRemover;
import com.dehazing.patchRecurrence.matchAndFilter.Pair;
import com.dehazing.patchRecurrence.matchAndFilter.PairFilter;
import com.dehazing.patchRecurrence.matchAndFilter.PairGenerator;
import com.dehazing.patchRecurrence.patch.Bucketizer;
import com.dehazing.patchRecurrence.patch.PatchArena;
import com.dehazing.patchRecurrence.patch.PatchExtractor;
import com.dehazing.patchRecurrence.patch.ScalePatches;
import com.dehazing.patchRecurrence.patch.Scaler;
import com.dehazing.patchRecurrence.patch.Smoother;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ước lượng airlight toàn cục của một ảnh mờ sương bằng sự lặp lại của patch qua nhiều scale.
 * <p>
 * Steps run strictly one after the other:
 * scale, extract, smooth (sparse mode only), bucket, pair, optionally de-duplicate,
 * filter by correlation, drop outliers, weighted average.
 */
public class AirlightPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(AirlightPipeline.class);

    private final AirlightConfig config;
    private final Scaler scaler = new Scaler();
    private final PatchExtractor extractor;
    private final Smoother smoother = new Smoother();
    private final Bucketizer bucketizer;
    private final PairGenerator pairGenerator;
    private final DuplicateRemover duplicateRemover = new DuplicateRemover();
    private final PairFilter pairFilter;
    private final OutlierRemover outlierRemover;
    private final AirlightEstimator estimator = new AirlightEstimator();

    public AirlightPipeline(AirlightConfig config) {
        this.config = config.validate();
        this.extractor = new PatchExtractor(config.getPatchSize());
        this.bucketizer = new Bucketizer(config.getNumBuckets());
        this.pairGenerator = new PairGenerator(config.getNearestNeighbours(), config.getNumQueryPatches(),
                config.getSeed(), config.getMatcher());
        this.pairFilter = new PairFilter(config.getPairThreshold(), config.isAllPairs());
        this.outlierRemover = new OutlierRemover(config.getOutlierThreshold());
    }

    public AirlightResult run(Mat img) {
        List<ScalePatches> patches = generatePatches(img);
        List<CandidatePair> pairs = generatePairs(patches);
        return estimate(patches, pairs, false);
    }

    /**
     * Như {@link #run(Mat)} nhưng đọc/ghi patch và cặp ứng viên qua cache theo {@code key}.
     */
    public AirlightResult run(Mat img, String key, PatchCache cache) throws IOException {
        Optional<PatchCache.Entry> cached = cache.load(key);
        if (cached.isPresent()) {
            LOG.info("Using saved patches and pairs ...");
            return estimate(cached.get().getPatches(), cached.get().getPairs(), true);
        }
        List<ScalePatches> patches = generatePatches(img);
        List<CandidatePair> pairs = generatePairs(patches);
        LOG.info("Saving patches and pairs ...");
        cache.save(key, patches, pairs);
        return estimate(patches, pairs, false);
    }

    public List<ScalePatches> generatePatches(Mat img) {
        List<Mat> scaledImgs = scaler.scale(img, config.scaleFactors());

        LOG.info("Extracting patches ...");
        List<ScalePatches> raw = extractor.extractAll(scaledImgs, config.getStep());
        for (Mat m : scaledImgs) m.release();

        List<ScalePatches> out = new ArrayList<>();
        int total = 0;
        for (ScalePatches scale : raw) {
            ScalePatches current = scale;
            if (!config.isAllPatches()) {
                current = smoother.smooth(current);
            }
            current = bucketizer.assign(current);
            LOG.debug("Scale {}: {} x {} image, {} patches", current.getScaleIndex(),
                    current.getImageRows(), current.getImageCols(), current.size());
            total += current.size();
            out.add(current);
        }
        if (total == 0) {
            throw new EmptyResultException("Image is too small for " + config.getPatchSize() + "x"
                    + config.getPatchSize() + " patches at every scale");
        }
        LOG.info("Extracted {} patches over {} scales", total, out.size());
        return out;
    }

    public List<CandidatePair> generatePairs(List<ScalePatches> patches) {
        LOG.info("Generating pairs of patches ...");
        List<CandidatePair> pairs = pairGenerator.generatePairs(new PatchArena(patches));
        if (config.isRemoveDuplicates()) {
            int before = pairs.size();
            pairs = duplicateRemover.removeDuplicates(pairs);
            LOG.info("Removed {} duplicate pairs", before - pairs.size());
        }
        if (pairs.isEmpty()) {
            throw new EmptyResultException("Nearest neighbour search produced no pair of patches");
        }
        LOG.info("Generated {} candidate pairs", pairs.size());
        return pairs;
    }

    /**
     * Cặp từ pixel thô của scale đầu tiên (2 láng giềng, đã bỏ cặp tự khớp và cặp đối xứng).
     * Handles of the first scale coincide with its local indices.
     */
    public List<CandidatePair> generateRawPairs(List<ScalePatches> patches) {
        LOG.info("Generating raw pairs of patches ...");
        int[][] nearest = pairGenerator.generateRawPairs(patches.get(0));
        List<CandidatePair> pairs = duplicateRemover.removeDuplicates(nearest);
        if (pairs.isEmpty()) {
            throw new EmptyResultException("Raw nearest neighbour search produced no pair of patches");
        }
        LOG.info("Generated {} raw pairs", pairs.size());
        return pairs;
    }

    public AirlightResult estimate(List<ScalePatches> patches, List<CandidatePair> candidates, boolean fromCache) {
        PatchArena arena = new PatchArena(patches);

        LOG.info("Filtering pairs of patches and estimating local airlight ...");
        List<Pair> filtered = pairFilter.filterPairs(arena, candidates);
        if (filtered.isEmpty()) {
            throw new EmptyResultException("No pair reached the correlation threshold " + config.getPairThreshold());
        }
        LOG.info("{} of {} pairs pass the correlation threshold", filtered.size(), candidates.size());

        LOG.info("Removing outliers ...");
        List<Pair> inliers = outlierRemover.removeOutliers(filtered);
        LOG.info("{} pairs remain after outlier removal", inliers.size());

        LOG.info("Estimating global airlight ...");
        double[] airlight = estimator.estimateAirlight(inliers);
        AirlightResult result = new AirlightResult(airlight, arena.size(), candidates.size(),
                filtered.size(), inliers.size(), fromCache);
        LOG.info("Estimated airlight is {}", result);
        return result;
    }

    public AirlightConfig getConfig() {
        return config;
    }
}
