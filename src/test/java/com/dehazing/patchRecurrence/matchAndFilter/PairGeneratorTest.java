package com.dehazing.patchRecurrence.matchAndFilter;

import com.dehazing.patchRecurrence.AirlightConfig.MatcherType;
import com.dehazing.patchRecurrence.TestImages;
import com.dehazing.patchRecurrence.exception.ConfigurationException;
import com.dehazing.patchRecurrence.patch.Patch;
import com.dehazing.patchRecurrence.patch.PatchArena;
import com.dehazing.patchRecurrence.patch.ScalePatches;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

public class PairGeneratorTest {
    private static final int P = 3;

    private static ScalePatches scale(int scaleIndex, int[] buckets, Random rnd) {
        List<Patch> patches = new ArrayList<>();
        for (int i = 0; i < buckets.length; i++) {
            patches.add(Patch.of(scaleIndex, i, 0, P, TestImages.randomBlock(P, rnd)).withBucket(buckets[i]));
        }
        return new ScalePatches(scaleIndex, buckets.length + P, P + 1, P, 1, patches);
    }

    private static ScalePatches replace(ScalePatches scale, int index, double[] raw) {
        List<Patch> patches = new ArrayList<>(scale.getPatches());
        Patch old = patches.get(index);
        patches.set(index, Patch.of(old.getScaleIndex(), old.getRow(), old.getCol(), P, raw).withBucket(old.getBucket()));
        return scale.withPatches(patches);
    }

    private static PatchArena twoScales(Random rnd) {
        ScalePatches s0 = scale(0, new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 0, 1 }, rnd);
        ScalePatches s1 = scale(1, new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 }, rnd);
        return new PatchArena(Arrays.asList(s0, s1));
    }

    @Test
    public void testHandlesPointIntoArena() {
        PatchArena arena = twoScales(new Random(21));
        List<CandidatePair> pairs = new PairGenerator(3, 100, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);

        // 3 query patch mỗi scale, mỗi query 3 láng giềng
        Assert.assertEquals(2 * 3 * 3, pairs.size());
        for (CandidatePair p : pairs) {
            Assert.assertTrue(PairGenerator.isQuery(arena.get(p.getQuery())));
            Assert.assertTrue(PairGenerator.isCandidate(arena.get(p.getCandidate())));
        }
        Set<Integer> queries = new HashSet<>();
        for (CandidatePair p : pairs) queries.add(p.getQuery());
        Assert.assertEquals(new HashSet<>(Arrays.asList(7, 8, 9, 12 + 7, 12 + 8, 12 + 9)), queries);
    }

    @Test
    public void testMatchesAcrossScales() {
        Random rnd = new Random(22);
        ScalePatches s0 = scale(0, new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 0, 1 }, rnd);
        ScalePatches s1 = scale(1, new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 }, rnd);
        // query 8 của scale 1 trùng với candidate 11 của scale 0
        s1 = replace(s1, 8, s0.get(11).getRaw().clone());
        PatchArena arena = new PatchArena(Arrays.asList(s0, s1));

        List<CandidatePair> pairs = new PairGenerator(1, 100, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);
        Assert.assertEquals(6, pairs.size());
        Assert.assertTrue(pairs.contains(new CandidatePair(arena.handle(1, 8), arena.handle(0, 11))));

        // query còn lại: láng giềng gần nhất trong toàn bộ candidate
        for (CandidatePair p : pairs) {
            double[] q = arena.get(p.getQuery()).getNorm();
            double best = Double.MAX_VALUE;
            int bestHandle = -1;
            for (int h = 0; h < arena.size(); h++) {
                if (!PairGenerator.isCandidate(arena.get(h))) continue;
                double d = distance(q, arena.get(h).getNorm());
                if (d < best) {
                    best = d;
                    bestHandle = h;
                }
            }
            Assert.assertEquals(bestHandle, p.getCandidate());
        }
    }

    @Test
    public void testScaleWithoutQueries() {
        Random rnd = new Random(23);
        ScalePatches s0 = scale(0, new int[] { 0, 1, 2, 3, 4, 5 }, rnd);
        ScalePatches s1 = scale(1, new int[] { 0, 6, 9, 8, 6 }, rnd);
        PatchArena arena = new PatchArena(Arrays.asList(s0, s1));

        List<CandidatePair> pairs = new PairGenerator(2, 100, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);
        Assert.assertEquals(4, pairs.size());
        for (CandidatePair p : pairs) {
            Assert.assertTrue(p.getQuery() == 6 + 2 || p.getQuery() == 6 + 3);
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testTooManyNeighbours() {
        Random rnd = new Random(24);
        PatchArena arena = new PatchArena(Arrays.asList(scale(0, new int[] { 0, 1, 7, 8 }, rnd)));
        new PairGenerator(3, 100, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);
    }

    @Test(expected = ConfigurationException.class)
    public void testNoCandidatesAtAll() {
        Random rnd = new Random(25);
        PatchArena arena = new PatchArena(Arrays.asList(scale(0, new int[] { 6, 7, 8, 9 }, rnd)));
        new PairGenerator(1, 100, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveNeighbours() {
        new PairGenerator(0, 100, 0, MatcherType.BRUTE_FORCE);
    }

    @Test
    public void testRepeatedCallsGiveSameResult() {
        // mỗi lần gọi tạo và giải phóng matcher riêng
        PatchArena arena = twoScales(new Random(26));
        PairGenerator generator = new PairGenerator(2, 100, 0, MatcherType.BRUTE_FORCE);
        List<CandidatePair> first = generator.generatePairs(arena);
        for (int i = 0; i < 20; i++) {
            Assert.assertEquals(first, generator.generatePairs(arena));
        }
        int[][] raw = generator.generateRawPairs(arena.scale(0));
        Assert.assertArrayEquals(raw, generator.generateRawPairs(arena.scale(0)));
    }

    @Test
    public void testSubsampleIsSeededAndOrdered() {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < 300; i += 3) indices.add(i);

        PairGenerator generator = new PairGenerator(1, 10, 0, MatcherType.BRUTE_FORCE);
        int[] first = generator.subsample(indices);
        int[] second = generator.subsample(indices);

        Assert.assertEquals(10, first.length);
        Assert.assertArrayEquals(first, second);
        for (int i = 1; i < first.length; i++) Assert.assertTrue(first[i - 1] < first[i]);
        for (int v : first) Assert.assertTrue(indices.contains(v));

        int[] other = new PairGenerator(1, 10, 1, MatcherType.BRUTE_FORCE).subsample(indices);
        Assert.assertFalse(Arrays.equals(first, other));

        int[] all = new PairGenerator(1, 500, 0, MatcherType.BRUTE_FORCE).subsample(indices);
        Assert.assertEquals(indices.size(), all.length);
    }

    @Test
    public void testQueriesCappedPerScale() {
        Random rnd = new Random(25);
        int[] buckets = new int[40];
        for (int i = 0; i < buckets.length; i++) buckets[i] = i % 2 == 0 ? 0 : 9;
        PatchArena arena = new PatchArena(Arrays.asList(scale(0, buckets, rnd), scale(1, buckets, rnd)));

        List<CandidatePair> pairs = new PairGenerator(2, 5, 0, MatcherType.BRUTE_FORCE).generatePairs(arena);
        Assert.assertEquals(2 * 5 * 2, pairs.size());
    }

    @Test
    public void testFlannFindsExactDuplicate() {
        Random rnd = new Random(26);
        ScalePatches s0 = scale(0, new int[] { 0, 1, 2, 3, 4, 5, 7 }, rnd);
        s0 = replace(s0, 6, s0.get(3).getRaw().clone());
        PatchArena arena = new PatchArena(Arrays.asList(s0));

        List<CandidatePair> pairs = new PairGenerator(1, 100, 0, MatcherType.FLANN).generatePairs(arena);
        Assert.assertEquals(Arrays.asList(new CandidatePair(6, 3)), pairs);
    }

    @Test
    public void testRawPairs() {
        Random rnd = new Random(27);
        ScalePatches s0 = scale(0, new int[] { 0, 0, 0, 0, 0, 0, 0, 0, 0 }, rnd);
        s0 = replace(s0, 7, s0.get(3).getRaw().clone());

        int[][] nearest = new PairGenerator(1, 100, 0, MatcherType.BRUTE_FORCE).generateRawPairs(s0);
        Assert.assertEquals(9, nearest.length);
        for (int[] row : nearest) Assert.assertEquals(2, row.length);

        List<CandidatePair> pairs = new DuplicateRemover().removeDuplicates(nearest);
        Assert.assertTrue(pairs.contains(new CandidatePair(3, 7)) ^ pairs.contains(new CandidatePair(7, 3)));
        for (CandidatePair p : pairs) Assert.assertNotEquals(p.getQuery(), p.getCandidate());
    }

    private static double distance(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) s += (a[i] - b[i]) * (a[i] - b[i]);
        return s;
    }
}
