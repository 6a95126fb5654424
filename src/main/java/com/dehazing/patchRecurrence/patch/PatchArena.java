package com.dehazing.patchRecurrence.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concatenation of every scale's patches, scale after scale, in the order the
 * scales were produced. A handle is the position of a patch in that
 * concatenation; {@code offset(k)} is the handle of the first patch of scale k.
 */
public class PatchArena {
    private final List<ScalePatches> scales;
    private final List<Patch> patches;
    private final int[] offsets;

    public PatchArena(List<ScalePatches> scales) {
        this.scales = Collections.unmodifiableList(new ArrayList<>(scales));
        this.offsets = new int[scales.size()];
        List<Patch> all = new ArrayList<>();
        for (int k = 0; k < scales.size(); k++) {
            offsets[k] = all.size();
            all.addAll(scales.get(k).getPatches());
        }
        this.patches = Collections.unmodifiableList(all);
    }

    public int handle(int scaleIndex, int localIndex) {
        return offsets[scaleIndex] + localIndex;
    }

    public int offset(int scaleIndex) {
        return offsets[scaleIndex];
    }

    public Patch get(int handle) {
        return patches.get(handle);
    }

    public int size() {
        return patches.size();
    }

    public int scaleCount() {
        return scales.size();
    }

    public ScalePatches scale(int scaleIndex) {
        return scales.get(scaleIndex);
    }

    public List<ScalePatches> getScales() {
        return scales;
    }

    public List<Patch> getPatches() {
        return patches;
    }
}
