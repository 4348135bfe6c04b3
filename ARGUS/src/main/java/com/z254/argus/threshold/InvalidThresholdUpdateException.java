package com.z254.argus.threshold;

import java.util.Set;

/**
 * A threshold update named unknown keys or carried non-numeric values.
 * Nothing from the rejected update is applied.
 */
public class InvalidThresholdUpdateException extends IllegalArgumentException {

    private final Set<String> rejectedKeys;

    public InvalidThresholdUpdateException(String message, Set<String> rejectedKeys) {
        super(message);
        this.rejectedKeys = Set.copyOf(rejectedKeys);
    }

    public Set<String> getRejectedKeys() {
        return rejectedKeys;
    }
}
