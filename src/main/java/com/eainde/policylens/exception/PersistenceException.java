package com.eainde.policylens.exception;

/**
 * A store could not be read or written.
 */
public class PersistenceException extends PolicyLensException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
