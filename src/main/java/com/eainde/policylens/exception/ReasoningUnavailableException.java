package com.eainde.policylens.exception;

/**
 * The reasoning gateway failed, exhausted its retries, or is not configured.
 * Recoverable: callers switch to the deterministic fallback.
 */
public class ReasoningUnavailableException extends PolicyLensException {

    public ReasoningUnavailableException(String message) {
        super(message);
    }

    public ReasoningUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
