package com.dehazing.cli;

import com.dehazing.patchRecurrence.AirlightConfig;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line arguments of the airlight estimator.
 */
public class AirlightArguments {

    @Option(name = "-i", aliases = { "--input" }, required = true,
            usage = "Path to the hazy input image")
    private String input;

    @Option(name = "-c", aliases = { "--cache-dir" }, required = false,
            usage = "Directory holding cached patches and pairs (defaults to the directory of the input image)")
    private String cacheDir = null;

    @Option(name = "--no-cache", required = false,
            usage = "Do not read or write cached patches and pairs")
    private boolean noCache = false;

    @Option(name = "--all-patches", required = false,
            usage = "Extract every patch (step 1) instead of alternate patches; disables smoothing")
    private boolean allPatches = false;

    @Option(name = "--all-pairs", required = false,
            usage = "Keep every candidate pair regardless of correlation")
    private boolean allPairs = false;

    @Option(name = "--remove-duplicates", required = false,
            usage = "Remove self and symmetric pairs before filtering")
    private boolean removeDuplicates = false;

    @Option(name = "--raw-pairs", required = false,
            usage = "Pair patches of the first scale by raw pixels instead of normalized patches")
    private boolean rawPairs = false;

    @Option(name = "--exact", required = false,
            usage = "Use exact (brute force) nearest neighbour search instead of FLANN")
    private boolean exact = false;

    @Option(name = "-p", aliases = { "--patch-size" }, required = false,
            usage = "Patch size in pixels")
    private Integer patchSize = null;

    @Option(name = "-k", aliases = { "--nearest" }, required = false,
            usage = "Nearest candidates retrieved per query patch")
    private Integer nearestNeighbours = null;

    @Option(name = "--pair-threshold", required = false,
            usage = "Minimum correlation of a pair")
    private Double pairThreshold = null;

    @Option(name = "--outlier-threshold", required = false,
            usage = "Maximum outlier indicator of a pair")
    private Double outlierThreshold = null;

    private boolean parsedSuccessfully = false;

    public AirlightArguments(final String[] args) {
        final CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            parsedSuccessfully = true;
        } catch (final CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        }
    }

    public boolean parsedSuccessfully() { return parsedSuccessfully; }

    public Path inputPath() { return Paths.get(input); }

    public Path cacheDirectory() {
        if (cacheDir != null) return Paths.get(cacheDir);
        Path parent = inputPath().toAbsolutePath().getParent();
        return parent != null ? parent : Paths.get(".");
    }

    public boolean noCache() { return noCache; }
    public boolean rawPairs() { return rawPairs; }

    /**
     * Overrides the defaults of {@code config} with whatever was given on the command line.
     */
    public AirlightConfig applyTo(AirlightConfig config) {
        if (patchSize != null) config.setPatchSize(patchSize);
        if (nearestNeighbours != null) config.setNearestNeighbours(nearestNeighbours);
        if (pairThreshold != null) config.setPairThreshold(pairThreshold);
        if (outlierThreshold != null) config.setOutlierThreshold(outlierThreshold);
        if (allPatches) config.setAllPatches(true);
        if (allPairs) config.setAllPairs(true);
        if (removeDuplicates) config.setRemoveDuplicates(true);
        if (exact) config.setMatcher(AirlightConfig.MatcherType.BRUTE_FORCE);
        return config;
    }
}
