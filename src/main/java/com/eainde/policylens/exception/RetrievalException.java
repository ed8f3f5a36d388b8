package com.eainde.policylens.exception;

/**
 * Embedding or vector search was unavailable. Fatal to a single evaluation.
 */
public class RetrievalException extends PolicyLensException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
