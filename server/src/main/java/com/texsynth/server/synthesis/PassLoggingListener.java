package com.texsynth.server.synthesis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PassLoggingListener implements SynthesisProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(PassLoggingListener.class);

    private final int everyNPasses;

    public PassLoggingListener(int everyNPasses) {
        if (everyNPasses <= 0) {
            throw new IllegalArgumentException("everyNPasses must be positive");
        }
        this.everyNPasses = everyNPasses;
    }

    @Override
    public void onPassCompleted(PassReport report, PixelBuffer output) {
        if (report.getPassNumber() % everyNPasses == 0 || report.getFilledCount() == report.getTotalPixels()) {
            logger.info("Pass {}: accepted {}/{} frontier pixels, filled {}/{} ({}%), threshold={}",
                    report.getPassNumber(), report.getAccepted(), report.getFrontierSize(),
                    report.getFilledCount(), report.getTotalPixels(),
                    String.format("%.1f", 100.0 * report.getFilledFraction()),
                    String.format("%.4f", report.getMaxErrorThreshold()));
        }
    }
}
