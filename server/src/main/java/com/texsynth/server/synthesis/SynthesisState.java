package com.texsynth.server.synthesis;

public enum SynthesisState {
    SEEDING,
    GROWING,
    DONE
}
