package com.eainde.policylens.exception;

/**
 * A policy document could not be turned into text (unsupported kind, bad encoding).
 */
public class ExtractionException extends PolicyLensException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
