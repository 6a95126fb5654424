package com.dehazing.patchRecurrence;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public class AirlightResult {
    private final double[] airlight;
    private final int patchCount;
    private final int candidatePairCount;
    private final int filteredPairCount;
    private final int inlierPairCount;
    private final boolean fromCache;

    @Override
    public String toString() {
        return String.format("Airlight (R, G, B) = (%.4f, %.4f, %.4f) from %d pairs [%d patches, %d candidates, %d correlated]",
                airlight[0], airlight[1], airlight[2], inlierPairCount, patchCount, candidatePairCount, filteredPairCount);
    }
}
