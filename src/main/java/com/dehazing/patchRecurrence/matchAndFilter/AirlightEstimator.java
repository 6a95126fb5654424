package com.dehazing.patchRecurrence.matchAndFilter;

import com.dehazing.patchRecurrence.exception.EmptyResultException;

import java.util.List;

public class AirlightEstimator {

    /**
     * Trung bình có trọng số của airlight từng cặp: sum(w * A) / sum(w).
     *
     * @throws EmptyResultException when there is no pair or the weights sum to zero
     */
    public double[] estimateAirlight(List<Pair> pairs) {
        if (pairs.isEmpty()) {
            throw new EmptyResultException("No pair left to estimate the airlight from");
        }
        double[] numerator = new double[Pair.CHANNELS];
        double denominator = 0.0;
        for (Pair pair : pairs) {
            double w = pair.getWeight();
            double[] a = pair.getAirlight();
            for (int c = 0; c < numerator.length; c++) numerator[c] += w * a[c];
            denominator += w;
        }
        if (denominator == 0.0) {
            throw new EmptyResultException("Weights of the " + pairs.size() + " remaining pairs sum to zero");
        }
        double[] airlight = new double[numerator.length];
        for (int c = 0; c < airlight.length; c++) airlight[c] = numerator[c] / denominator;
        return airlight;
    }
}
