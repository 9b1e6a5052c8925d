package com.texsynth.server.synthesis;

import java.util.Random;

/**
 * Finds the sample window that best matches a partially synthesized
 * neighborhood. Distances are Gaussian-weighted sums of squared differences
 * over the filled positions only; one candidate is drawn uniformly from all
 * candidates within {@code errorTolerance} of the best, and it is accepted only
 * if its distance is below the current maximum error threshold.
 */
public class MatchSelector {

    private final PatchIndex index;
    private final double errorTolerance;
    private final Random random;

    public MatchSelector(PatchIndex index, double errorTolerance, Random random) {
        this.index = index;
        this.errorTolerance = errorTolerance;
        this.random = random;
    }

    public MatchResult select(NeighborhoodView view, double maxErrorThreshold) {
        double[] weighting = computeWeighting(view.mask(), index.gaussian(), index.getChannels());
        double[] distances = computeDistances(view, weighting);

        double min = Double.POSITIVE_INFINITY;
        for (double d : distances) {
            if (d < min) {
                min = d;
            }
        }
        double cutoff = min * (1 + errorTolerance);

        int nearOptimal = 0;
        for (double d : distances) {
            if (d <= cutoff) {
                nearOptimal++;
            }
        }

        // Draw the k-th member of the near-optimal set without materializing it
        int pick = random.nextInt(nearOptimal);
        int selected = -1;
        for (int k = 0; k < distances.length; k++) {
            if (distances[k] <= cutoff) {
                if (pick == 0) {
                    selected = k;
                    break;
                }
                pick--;
            }
        }

        double error = distances[selected];
        return new MatchResult(error < maxErrorThreshold, selected, index.centerRow(selected),
                index.centerCol(selected), error, nearOptimal);
    }

    /**
     * Gaussian kernel restricted to the filled positions of {@code mask} (replicated over
     * every channel) and renormalized so the filled entries sum to 1. Unfilled entries are 0.
     *
     * @throws InternalInvariantViolationException if no position of the mask is filled
     */
    public static double[] computeWeighting(boolean[] mask, double[] gaussian, int channels) {
        int area = mask.length;
        if (gaussian.length != area * channels) {
            throw new IllegalArgumentException("Kernel length " + gaussian.length + " does not match "
                    + channels + " channels of " + area + " positions");
        }
        double weight = 0.0;
        for (int ch = 0; ch < channels; ch++) {
            for (int i = 0; i < area; i++) {
                if (mask[i]) {
                    weight += gaussian[ch * area + i];
                }
            }
        }
        if (weight <= 0.0) {
            throw new InternalInvariantViolationException("Neighborhood has no filled positions");
        }
        double[] weighting = new double[gaussian.length];
        for (int ch = 0; ch < channels; ch++) {
            for (int i = 0; i < area; i++) {
                if (mask[i]) {
                    weighting[ch * area + i] = gaussian[ch * area + i] / weight;
                }
            }
        }
        return weighting;
    }

    double[] computeDistances(NeighborhoodView view, double[] weighting) {
        double[] values = view.values();

        int active = 0;
        for (double w : weighting) {
            if (w != 0.0) {
                active++;
            }
        }
        int[] positions = new int[active];
        int p = 0;
        for (int i = 0; i < weighting.length; i++) {
            if (weighting[i] != 0.0) {
                positions[p++] = i;
            }
        }

        double[] distances = new double[index.getCandidateCount()];
        for (int k = 0; k < distances.length; k++) {
            double[] candidate = index.candidate(k);
            double sum = 0.0;
            for (int i : positions) {
                double diff = candidate[i] - values[i];
                sum += weighting[i] * diff * diff;
            }
            distances[k] = sum;
        }
        return distances;
    }

    public double[] distancesFor(NeighborhoodView view) {
        return computeDistances(view, computeWeighting(view.mask(), index.gaussian(), index.getChannels()));
    }
}
