package com.texsynth.server.synthesis;

/**
 * The window-sized neighborhood around one output pixel: the channel-stacked
 * values already synthesized there and a single 2D validity mask shared by all
 * channels. Positions outside the output read as unfilled zeros.
 */
public class NeighborhoodView {

    private final int windowSize;
    private final int channels;
    private final double[] values;
    private final boolean[] mask;
    private final int filledCount;

    public NeighborhoodView(int windowSize, int channels, double[] values, boolean[] mask) {
        int area = windowSize * windowSize;
        if (values.length != area * channels || mask.length != area) {
            throw new IllegalArgumentException("Neighborhood arrays do not match window " + windowSize
                    + " with " + channels + " channels");
        }
        this.windowSize = windowSize;
        this.channels = channels;
        this.values = values;
        this.mask = mask;
        int count = 0;
        for (boolean m : mask) {
            if (m) {
                count++;
            }
        }
        this.filledCount = count;
    }

    public static NeighborhoodView extract(SynthesisCanvas canvas, int row, int col, int windowSize) {
        int half = windowSize / 2;
        if (canvas.getPadding() < half) {
            throw new IllegalArgumentException("Canvas padding " + canvas.getPadding()
                    + " is too small for window " + windowSize);
        }
        // (row, col) + padding is the target in padded coordinates; step back half a window
        int top = row + canvas.getPadding() - half;
        int left = col + canvas.getPadding() - half;
        int channels = canvas.getChannels();
        int area = windowSize * windowSize;

        double[] values = new double[area * channels];
        boolean[] mask = new boolean[area];
        for (int dr = 0; dr < windowSize; dr++) {
            for (int dc = 0; dc < windowSize; dc++) {
                int i = dr * windowSize + dc;
                mask[i] = canvas.paddedFilled(top + dr, left + dc);
                for (int ch = 0; ch < channels; ch++) {
                    values[ch * area + i] = canvas.paddedValue(top + dr, left + dc, ch);
                }
            }
        }
        return new NeighborhoodView(windowSize, channels, values, mask);
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getChannels() {
        return channels;
    }

    public int getFilledCount() {
        return filledCount;
    }

    double[] values() {
        return values;
    }

    boolean[] mask() {
        return mask;
    }

    public double getValue(int dr, int dc, int channel) {
        return values[channel * windowSize * windowSize + dr * windowSize + dc];
    }

    public boolean isValid(int dr, int dc) {
        return mask[dr * windowSize + dc];
    }
}
