package com.z254.argus.snooze;

/**
 * The snooze backing store could not be reached. Retryable.
 */
public class SnoozeStoreUnavailableException extends RuntimeException {

    public SnoozeStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
