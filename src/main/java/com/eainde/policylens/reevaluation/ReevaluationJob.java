package com.eainde.policylens.reevaluation;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on an asynchronous batch run. Cancellation is cooperative: items already running
 * finish, items not yet started are counted as not started.
 */
public class ReevaluationJob {

    private final String jobId;
    private final AtomicBoolean cancelled;
    private final CompletableFuture<ReevaluationSummary> result;

    ReevaluationJob(String jobId, AtomicBoolean cancelled, CompletableFuture<ReevaluationSummary> result) {
        this.jobId = jobId;
        this.cancelled = cancelled;
        this.result = result;
    }

    public String getJobId() {
        return jobId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CompletableFuture<ReevaluationSummary> result() {
        return result;
    }
}
