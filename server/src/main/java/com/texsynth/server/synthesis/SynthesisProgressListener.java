package com.texsynth.server.synthesis;

/**
 * Observes a synthesis run once per completed growth pass. The output passed in
 * is a private copy; listeners cannot influence the run.
 */
public interface SynthesisProgressListener {

    void onPassCompleted(PassReport report, PixelBuffer output);
}
