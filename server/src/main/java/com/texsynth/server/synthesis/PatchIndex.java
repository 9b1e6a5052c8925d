package com.texsynth.server.synthesis;

/**
 * Every window-sized placement of a sliding window over the sample (stride 1),
 * flattened channel-stacked, together with the Gaussian spatial kernel used to
 * weight neighborhood distances. Immutable after construction.
 */
public class PatchIndex {

    private final int windowSize;
    private final int halfWindow;
    private final int channels;
    private final int placementRows;
    private final int placementCols;

    // candidates[k] is the channel-stacked window whose top-left corner is
    // (k / placementCols, k % placementCols)
    private final double[][] candidates;

    // window^2 kernel entries repeated once per channel, each copy summing to 1
    private final double[] gaussian;

    public PatchIndex(PixelBuffer sample, int windowSize, double sigmaDivisor) {
        int adjusted = adjustWindowSize(windowSize);
        if (adjusted > sample.getRows() || adjusted > sample.getCols()) {
            throw new InvalidDimensionsException("Window size " + adjusted + " does not fit in a "
                    + sample.getRows() + "x" + sample.getCols() + " sample");
        }
        this.windowSize = adjusted;
        this.halfWindow = adjusted / 2;
        this.channels = sample.getChannels();
        this.placementRows = sample.getRows() - adjusted + 1;
        this.placementCols = sample.getCols() - adjusted + 1;
        this.candidates = buildCandidates(sample);
        this.gaussian = buildGaussian(adjusted, channels, adjusted / sigmaDivisor);
    }

    /**
     * Even window sizes are bumped to the next odd size.
     */
    public static int adjustWindowSize(int windowSize) {
        if (windowSize % 2 == 0) {
            return windowSize + 1;
        }
        return windowSize;
    }

    private double[][] buildCandidates(PixelBuffer sample) {
        int area = windowSize * windowSize;
        double[][] table = new double[placementRows * placementCols][];
        for (int top = 0; top < placementRows; top++) {
            for (int left = 0; left < placementCols; left++) {
                double[] vec = new double[area * channels];
                for (int ch = 0; ch < channels; ch++) {
                    int base = ch * area;
                    for (int dr = 0; dr < windowSize; dr++) {
                        for (int dc = 0; dc < windowSize; dc++) {
                            vec[base + dr * windowSize + dc] = sample.get(top + dr, left + dc, ch);
                        }
                    }
                }
                table[top * placementCols + left] = vec;
            }
        }
        return table;
    }

    static double[] buildGaussian(int windowSize, int channels, double sigma) {
        int half = windowSize / 2;
        int area = windowSize * windowSize;
        double[] kernel = new double[area];
        double sum = 0.0;
        for (int dr = -half; dr <= half; dr++) {
            for (int dc = -half; dc <= half; dc++) {
                double v = Math.exp(-(dr * dr + dc * dc) / (2.0 * sigma * sigma));
                kernel[(dr + half) * windowSize + (dc + half)] = v;
                sum += v;
            }
        }
        double[] stacked = new double[area * channels];
        for (int ch = 0; ch < channels; ch++) {
            for (int i = 0; i < area; i++) {
                stacked[ch * area + i] = kernel[i] / sum;
            }
        }
        return stacked;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getHalfWindow() {
        return halfWindow;
    }

    public int getChannels() {
        return channels;
    }

    public int getCandidateCount() {
        return candidates.length;
    }

    /**
     * The channel-stacked vector of candidate {@code index}. Callers must not modify it.
     */
    double[] candidate(int index) {
        return candidates[index];
    }

    public double[] getCandidateCopy(int index) {
        return candidates[index].clone();
    }

    /**
     * Channel-replicated Gaussian kernel. Callers must not modify it.
     */
    double[] gaussian() {
        return gaussian;
    }

    public double[] getGaussianCopy() {
        return gaussian.clone();
    }

    /** Sample row of the centre pixel of candidate {@code index}. */
    public int centerRow(int index) {
        return index / placementCols + halfWindow;
    }

    /** Sample column of the centre pixel of candidate {@code index}. */
    public int centerCol(int index) {
        return index % placementCols + halfWindow;
    }
}
