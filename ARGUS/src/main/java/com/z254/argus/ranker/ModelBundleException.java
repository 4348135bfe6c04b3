package com.z254.argus.ranker;

/**
 * A ranker model bundle could not be read, written or is incomplete.
 */
public class ModelBundleException extends RuntimeException {

    public ModelBundleException(String message) {
        super(message);
    }

    public ModelBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
