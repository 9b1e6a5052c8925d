package com.texsynth.server.synthesis;

public class SynthesisResult {
    private final PixelBuffer output;
    private final int windowSize;
    private final int passes;
    private final int thresholdRelaxations;
    private final double finalMaxErrorThreshold;
    private final long matchAttempts;
    private final boolean fromCache;

    public SynthesisResult(PixelBuffer output, int windowSize, int passes, int thresholdRelaxations,
            double finalMaxErrorThreshold, long matchAttempts, boolean fromCache) {
        this.output = output;
        this.windowSize = windowSize;
        this.passes = passes;
        this.thresholdRelaxations = thresholdRelaxations;
        this.finalMaxErrorThreshold = finalMaxErrorThreshold;
        this.matchAttempts = matchAttempts;
        this.fromCache = fromCache;
    }

    public PixelBuffer getOutput() {
        return output;
    }

    /** Window size actually used, after even sizes were bumped to odd. */
    public int getWindowSize() {
        return windowSize;
    }

    public int getPasses() {
        return passes;
    }

    public int getThresholdRelaxations() {
        return thresholdRelaxations;
    }

    public double getFinalMaxErrorThreshold() {
        return finalMaxErrorThreshold;
    }

    public long getMatchAttempts() {
        return matchAttempts;
    }

    public boolean isFromCache() {
        return fromCache;
    }
}
