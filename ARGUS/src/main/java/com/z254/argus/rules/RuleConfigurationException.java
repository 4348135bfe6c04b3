package com.z254.argus.rules;

/**
 * Raised when a rule document cannot be loaded. Nothing from the document
 * is applied when this is thrown.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
