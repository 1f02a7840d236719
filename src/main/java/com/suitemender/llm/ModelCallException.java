package com.suitemender.llm;

/**
 * The model backend could not be reached or returned an unusable envelope.
 * Callers map this to an UNKNOWN classification or a rejected patch.
 */
public class ModelCallException extends RuntimeException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
