package com.dehazing.patchRecurrence.matchAndFilter;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Two {@link com.dehazing.patchRecurrence.patch.PatchArena} handles proposed as a pair
 * by the nearest-neighbour search, before any filtering.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class CandidatePair {
    private final int query;
    private final int candidate;

    @Override
    public String toString() {
        return "[" + query + ", " + candidate + "]";
    }
}
