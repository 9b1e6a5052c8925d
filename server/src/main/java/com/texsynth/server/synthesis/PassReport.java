package com.texsynth.server.synthesis;

public class PassReport {
    private final int passNumber;
    private final int frontierSize;
    private final int accepted;
    private final int filledCount;
    private final int totalPixels;
    private final double maxErrorThreshold;
    private final boolean thresholdRelaxed;

    public PassReport(int passNumber, int frontierSize, int accepted, int filledCount, int totalPixels,
            double maxErrorThreshold, boolean thresholdRelaxed) {
        this.passNumber = passNumber;
        this.frontierSize = frontierSize;
        this.accepted = accepted;
        this.filledCount = filledCount;
        this.totalPixels = totalPixels;
        this.maxErrorThreshold = maxErrorThreshold;
        this.thresholdRelaxed = thresholdRelaxed;
    }

    public int getPassNumber() {
        return passNumber;
    }

    public int getFrontierSize() {
        return frontierSize;
    }

    public int getAccepted() {
        return accepted;
    }

    public int getFilledCount() {
        return filledCount;
    }

    public int getTotalPixels() {
        return totalPixels;
    }

    /** Threshold in effect for the next pass. */
    public double getMaxErrorThreshold() {
        return maxErrorThreshold;
    }

    public boolean isThresholdRelaxed() {
        return thresholdRelaxed;
    }

    public double getFilledFraction() {
        return (double) filledCount / totalPixels;
    }
}
