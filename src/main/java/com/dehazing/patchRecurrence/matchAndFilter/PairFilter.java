package com.dehazing.patchRecurrence.matchAndFilter;

import com.dehazing.patchRecurrence.patch.PatchArena;

import java.util.ArrayList;
import java.util.List;

public class PairFilter {
    private final double pairThreshold;
    private final boolean allPairs;

    /**
     * @param pairThreshold minimum Pearson correlation between the normalized patches
     * @param allPairs      keep every candidate pair without looking at the correlation
     */
    public PairFilter(double pairThreshold, boolean allPairs) {
        this.pairThreshold = pairThreshold;
        this.allPairs = allPairs;
    }

    public List<Pair> filterPairs(PatchArena arena, List<CandidatePair> pairs) {
        List<Pair> filtered = new ArrayList<>();
        for (CandidatePair p : pairs) {
            if (allPairs || correlation(arena.get(p.getQuery()).getNorm(), arena.get(p.getCandidate()).getNorm()) >= pairThreshold) {
                filtered.add(new Pair(arena.get(p.getQuery()), arena.get(p.getCandidate())));
            }
        }
        return filtered;
    }

    /**
     * Hệ số tương quan Pearson (1 - correlation distance). Vector có phương sai 0 cho kết quả 0.
     */
    public static double correlation(double[] u, double[] v) {
        if (u.length != v.length) {
            throw new IllegalArgumentException("Vectors differ in length: " + u.length + " vs " + v.length);
        }
        int n = u.length;
        if (n == 0) return 0.0;
        double meanU = 0, meanV = 0;
        for (int i = 0; i < n; i++) {
            meanU += u[i];
            meanV += v[i];
        }
        meanU /= n;
        meanV /= n;

        double dot = 0, su = 0, sv = 0;
        for (int i = 0; i < n; i++) {
            double du = u[i] - meanU;
            double dv = v[i] - meanV;
            dot += du * dv;
            su += du * du;
            sv += dv * dv;
        }
        if (su == 0 || sv == 0) return 0.0;
        double r = dot / Math.sqrt(su * sv);
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
