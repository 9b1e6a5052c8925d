package com.texsynth.server.synthesis;

/**
 * Raised when sample, output, seed or window dimensions cannot be synthesized.
 * Always thrown before any synthesis buffer is allocated.
 */
public class InvalidDimensionsException extends IllegalArgumentException {

    public InvalidDimensionsException(String message) {
        super(message);
    }
}
