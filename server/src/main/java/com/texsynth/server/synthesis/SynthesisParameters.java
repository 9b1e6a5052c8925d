package com.texsynth.server.synthesis;

public class SynthesisParameters {
    // Side length of the random patch copied into the centre of the output; must be odd
    public int seedSize = 3;
    // Candidates within min * (1 + errorTolerance) form the near-optimal set
    public double errorTolerance = 0.1;
    public double initialMaxErrorThreshold = 0.3;
    // Applied to the threshold after a pass that accepted nothing
    public double thresholdGrowthFactor = 1.1;
    // Gaussian sigma = windowSize / gaussianSigmaDivisor
    public double gaussianSigmaDivisor = 6.4;
    // 0 = unbounded
    public int maxPasses = 0;
    public FrontierCommitMode commitMode = FrontierCommitMode.IMMEDIATE;

    public SynthesisParameters() {
    }

    public SynthesisParameters(
            int seedSize,
            double errorTolerance,
            double initialMaxErrorThreshold,
            double thresholdGrowthFactor,
            double gaussianSigmaDivisor,
            int maxPasses,
            FrontierCommitMode commitMode) {
        this.seedSize = seedSize;
        this.errorTolerance = errorTolerance;
        this.initialMaxErrorThreshold = initialMaxErrorThreshold;
        this.thresholdGrowthFactor = thresholdGrowthFactor;
        this.gaussianSigmaDivisor = gaussianSigmaDivisor;
        this.maxPasses = maxPasses;
        this.commitMode = commitMode;
    }

    public static SynthesisParameters defaults() {
        return new SynthesisParameters(3, 0.1, 0.3, 1.1, 6.4, 0, FrontierCommitMode.IMMEDIATE);
    }

    public SynthesisParameters copy() {
        return new SynthesisParameters(
                this.seedSize,
                this.errorTolerance,
                this.initialMaxErrorThreshold,
                this.thresholdGrowthFactor,
                this.gaussianSigmaDivisor,
                this.maxPasses,
                this.commitMode);
    }

    public void validate() {
        if (seedSize < 1 || seedSize % 2 == 0) {
            throw new InvalidDimensionsException("Seed size must be a positive odd number, got " + seedSize);
        }
        if (errorTolerance < 0) {
            throw new IllegalArgumentException("errorTolerance must be non-negative");
        }
        if (initialMaxErrorThreshold <= 0) {
            throw new IllegalArgumentException("initialMaxErrorThreshold must be positive");
        }
        if (thresholdGrowthFactor <= 1.0) {
            throw new IllegalArgumentException("thresholdGrowthFactor must be greater than 1");
        }
        if (gaussianSigmaDivisor <= 0) {
            throw new IllegalArgumentException("gaussianSigmaDivisor must be positive");
        }
        if (maxPasses < 0) {
            throw new IllegalArgumentException("maxPasses must be 0 (unbounded) or positive");
        }
        if (commitMode == null) {
            throw new IllegalArgumentException("commitMode must be set");
        }
    }

    /**
     * Stable textual form of every parameter that influences the output, used as part of cache keys.
     */
    public String fingerprint() {
        return "seed=" + seedSize
                + ";tol=" + errorTolerance
                + ";thr=" + initialMaxErrorThreshold
                + ";grow=" + thresholdGrowthFactor
                + ";sigma=" + gaussianSigmaDivisor
                + ";commit=" + commitMode;
    }
}
