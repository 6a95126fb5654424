package com.dehazing.patchRecurrence.patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Cân bằng histogram theo thứ hạng: mỗi scale được chia thành {@code numBuckets} nhóm
 * liên tiếp theo độ lệch chuẩn tăng dần, nhóm cuối nhận phần dư.
 */
public class Bucketizer {
    private final int numBuckets;

    public Bucketizer(int numBuckets) {
        if (numBuckets <= 0) throw new IllegalArgumentException("bucket count must be positive: " + numBuckets);
        this.numBuckets = numBuckets;
    }

    public ScalePatches assign(ScalePatches scale) {
        int[] buckets = bucketsFor(scale.stdDevs());
        List<Patch> out = new ArrayList<>(buckets.length);
        for (int i = 0; i < buckets.length; i++) {
            out.add(scale.get(i).withBucket(buckets[i]));
        }
        return scale.withPatches(out);
    }

    /**
     * Bucket of every value, indexed like {@code values}. Equal values keep their
     * original order in the ranking. With at least {@code numBuckets} values every
     * bucket is used; with fewer, all values go to the top bucket.
     */
    public int[] bucketsFor(double[] values) {
        int n = values.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));

        int interval = (int) Math.round((double) n / numBuckets);
        // làm tròn lên có thể để trống bucket trên cùng: khi đó lấy phần nguyên
        if (interval * (numBuckets - 1) >= n) {
            interval = n / numBuckets;
        }
        int[] buckets = new int[n];
        for (int rank = 0; rank < n; rank++) {
            int bucket = interval == 0 ? numBuckets - 1 : Math.min(rank / interval, numBuckets - 1);
            buckets[order[rank]] = bucket;
        }
        return buckets;
    }

    public int getNumBuckets() {
        return numBuckets;
    }
}
