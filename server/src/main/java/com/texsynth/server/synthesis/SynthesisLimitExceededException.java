package com.texsynth.server.synthesis;

public class SynthesisLimitExceededException extends RuntimeException {

    private final int passes;

    public SynthesisLimitExceededException(int passes, int unfilledPixels) {
        super("Synthesis did not complete within " + passes + " passes, " + unfilledPixels
                + " pixels still unfilled");
        this.passes = passes;
    }

    public int getPasses() {
        return passes;
    }
}
