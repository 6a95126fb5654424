package com.dehazing.cli;

import com.dehazing.imageOperator.ImageLoader;
import com.dehazing.patchRecurrence.AirlightConfig;
import com.dehazing.patchRecurrence.AirlightPipeline;
import com.dehazing.patchRecurrence.AirlightResult;
import com.dehazing.patchRecurrence.cache.PatchCache;
import com.dehazing.patchRecurrence.exception.DehazingException;
import com.dehazing.patchRecurrence.matchAndFilter.CandidatePair;
import com.dehazing.patchRecurrence.patch.ScalePatches;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class AirlightMain {
    private static final Logger LOG = LoggerFactory.getLogger(AirlightMain.class);

    public static void main(String[] args) {
        AirlightArguments parsed = new AirlightArguments(args);
        if (!parsed.parsedSuccessfully()) {
            System.exit(2);
        }
        try {
            AirlightResult result = run(parsed);
            double[] a = result.getAirlight();
            System.out.printf("%.6f %.6f %.6f%n", a[0], a[1], a[2]);
        } catch (IOException | DehazingException e) {
            LOG.error("Airlight estimation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static AirlightResult run(AirlightArguments parsed) throws IOException {
        AirlightPipeline pipeline = new AirlightPipeline(parsed.applyTo(new AirlightConfig()));
        LOG.info("Using {}", pipeline.getConfig());

        Path input = parsed.inputPath();
        LOG.info("Loading image {} ...", input);
        Mat img = ImageLoader.load(input);

        if (parsed.rawPairs()) {
            List<ScalePatches> patches = pipeline.generatePatches(img);
            List<CandidatePair> pairs = pipeline.generateRawPairs(patches);
            return pipeline.estimate(patches, pairs, false);
        }
        if (parsed.noCache()) {
            return pipeline.run(img);
        }
        PatchCache cache = new PatchCache(parsed.cacheDirectory());
        return pipeline.run(img, PatchCache.keyFor(input), cache);
    }
}
