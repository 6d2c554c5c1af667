package com.refinement_copilot.common.exception;

/**
 * Raised when classifier output does not match the expected structure
 */
public class ClassificationParseException extends Exception {

    public ClassificationParseException(String message) {
        super(message);
    }

    public ClassificationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
