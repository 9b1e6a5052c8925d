package com.texsynth.server.synthesis;

/**
 * When pixels accepted during a pass become visible to the neighborhoods of
 * the remaining frontier pixels of that pass.
 */
public enum FrontierCommitMode {
    /** Written immediately; later pixels in the same pass see earlier ones. */
    IMMEDIATE,
    /** Staged and applied after the whole frontier was processed. */
    END_OF_PASS
}
