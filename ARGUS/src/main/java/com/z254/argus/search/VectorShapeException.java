package com.z254.argus.search;

/**
 * Raised when vectors or batches do not have the shape the index expects.
 * Inputs are never truncated or padded.
 */
public class VectorShapeException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public VectorShapeException(String what, int expected, int actual) {
        super(what + ": expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
