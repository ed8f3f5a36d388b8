package com.eainde.policylens.exception;

/**
 * A stored record cannot be parsed for replay. Skipped and counted by batch runs.
 */
public class MalformedRecordException extends PolicyLensException {

    private final String recordId;

    public MalformedRecordException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
