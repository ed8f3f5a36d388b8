package com.eainde.policylens.exception;

/**
 * A transaction evaluation failed closed. No decision and no case were written.
 */
public class EvaluationFailureException extends PolicyLensException {

    private final String traceId;
    private final String transactionId;

    public EvaluationFailureException(String traceId, String transactionId, Throwable cause) {
        super("Evaluation of transaction " + transactionId + " failed [" + traceId + "]: "
                + cause.getMessage(), cause);
        this.traceId = traceId;
        this.transactionId = transactionId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
