package com.dehazing.patchRecurrence.matchAndFilter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loại bỏ cặp tự khớp (i == j) và cặp đối xứng sinh ra bởi tìm kiếm láng giềng gần nhất.
 * Thứ tự lần xuất hiện đầu tiên được giữ nguyên.
 */
public class DuplicateRemover {

    /**
     * @param neighbours row {@code i} holds the neighbours found for patch {@code i}
     */
    public List<CandidatePair> removeDuplicates(int[][] neighbours) {
        List<CandidatePair> pairs = new ArrayList<>();
        for (int i = 0; i < neighbours.length; i++) {
            for (int j : neighbours[i]) {
                pairs.add(new CandidatePair(i, j));
            }
        }
        return removeDuplicates(pairs);
    }

    public List<CandidatePair> removeDuplicates(List<CandidatePair> pairs) {
        List<CandidatePair> unique = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (CandidatePair p : pairs) {
            int i = p.getQuery();
            int j = p.getCandidate();
            if (i == j) continue;
            if (seen.add(key(i, j))) {
                seen.add(key(j, i));
                unique.add(p);
            }
        }
        return unique;
    }

    private static long key(int i, int j) {
        return ((long) i << 32) | (j & 0xFFFFFFFFL);
    }
}
