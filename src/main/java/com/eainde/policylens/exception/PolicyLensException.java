package com.eainde.policylens.exception;

/**
 * Root of the unchecked exceptions raised by the compliance core.
 */
public class PolicyLensException extends RuntimeException {

    public PolicyLensException(String message) {
        super(message);
    }

    public PolicyLensException(String message, Throwable cause) {
        super(message, cause);
    }
}
