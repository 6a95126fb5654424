package com.dehazing.patchRecurrence.patch;

import com.dehazing.patchRecurrence.exception.DimensionMismatchException;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * The patches of one scale level in row-major grid order, together with the grid
 * they were cut from. The step is part of the collection so that later steps
 * never have to guess how the grid was sampled.
 */
@Getter
public class ScalePatches {
    private final int scaleIndex;
    private final int imageRows;
    private final int imageCols;
    private final int patchSize;
    private final int step;
    private final int gridRows;
    private final int gridCols;
    private final List<Patch> patches;

    public ScalePatches(int scaleIndex, int imageRows, int imageCols, int patchSize, int step, List<Patch> patches) {
        this.scaleIndex = scaleIndex;
        this.imageRows = imageRows;
        this.imageCols = imageCols;
        this.patchSize = patchSize;
        this.step = step;
        this.gridRows = gridSize(imageRows, patchSize, step);
        this.gridCols = gridSize(imageCols, patchSize, step);
        this.patches = Collections.unmodifiableList(patches);
    }

    /**
     * Number of offsets in {@code [0, extent - patchSize)} taken every {@code step} pixels.
     */
    public static int gridSize(int extent, int patchSize, int step) {
        if (step <= 0) throw new IllegalArgumentException("step must be positive: " + step);
        int span = extent - patchSize;
        if (span <= 0) return 0;
        return (span + step - 1) / step;
    }

    public ScalePatches withPatches(List<Patch> replaced) {
        if (replaced.size() != patches.size()) {
            throw new DimensionMismatchException("Scale " + scaleIndex + " holds " + patches.size()
                    + " patches, replacement holds " + replaced.size());
        }
        return new ScalePatches(scaleIndex, imageRows, imageCols, patchSize, step, replaced);
    }

    public int size() {
        return patches.size();
    }

    public boolean isEmpty() {
        return patches.isEmpty();
    }

    public Patch get(int index) {
        return patches.get(index);
    }

    public double[] stdDevs() {
        double[] out = new double[patches.size()];
        for (int i = 0; i < out.length; i++) out[i] = patches.get(i).getStdDev();
        return out;
    }
}
