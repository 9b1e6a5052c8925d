package com.texsynth.server.synthesis;

/**
 * A state that correct frontier semantics make unreachable, e.g. a neighborhood
 * with no filled pixels. Indicates a logic defect.
 */
public class InternalInvariantViolationException extends IllegalStateException {

    public InternalInvariantViolationException(String message) {
        super(message);
    }
}
