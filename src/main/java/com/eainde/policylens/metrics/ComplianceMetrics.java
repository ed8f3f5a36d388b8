package com.eainde.policylens.metrics;

import com.eainde.policylens.model.ChangeClassification;
import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.Verdict;

import java.time.Duration;

/**
 * Operational counters and timers. Injected wherever they are recorded.
 */
public interface ComplianceMetrics {

    void evaluationCompleted(Verdict verdict, DecisionSource source, Duration latency);

    void evaluationFailed();

    void modelCall(Duration latency, boolean success);

    void policyChangeDetected(ChangeClassification classification);

    void reevaluationFinished(int reEvaluated, int verdictsChanged, int skipped, int failed);

    void feedbackReceived(Verdict correctedVerdict, boolean overturned);

    /** Metrics that record nothing. */
    ComplianceMetrics NOOP = new ComplianceMetrics() {
        @Override
        public void evaluationCompleted(Verdict verdict, DecisionSource source, Duration latency) {
        }

        @Override
        public void evaluationFailed() {
        }

        @Override
        public void modelCall(Duration latency, boolean success) {
        }

        @Override
        public void policyChangeDetected(ChangeClassification classification) {
        }

        @Override
        public void reevaluationFinished(int reEvaluated, int verdictsChanged, int skipped, int failed) {
        }

        @Override
        public void feedbackReceived(Verdict correctedVerdict, boolean overturned) {
        }
    };
}
