package com.eainde.policylens.metrics;

import com.eainde.policylens.model.ChangeClassification;
import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

public class MicrometerComplianceMetrics implements ComplianceMetrics {

    private final MeterRegistry registry;

    public MicrometerComplianceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void evaluationCompleted(Verdict verdict, DecisionSource source, Duration latency) {
        Counter.builder("policylens.evaluations")
                .tag("verdict", verdict.name())
                .tag("source", source.name())
                .register(registry)
                .increment();
        Timer.builder("policylens.evaluation.latency")
                .register(registry)
                .record(latency);
    }

    @Override
    public void evaluationFailed() {
        registry.counter("policylens.evaluations.failed").increment();
    }

    @Override
    public void modelCall(Duration latency, boolean success) {
        Timer.builder("policylens.model.latency")
                .tag("outcome", success ? "success" : "error")
                .register(registry)
                .record(latency);
    }

    @Override
    public void policyChangeDetected(ChangeClassification classification) {
        registry.counter("policylens.policy.changes", "type", classification.name()).increment();
    }

    @Override
    public void reevaluationFinished(int reEvaluated, int verdictsChanged, int skipped, int failed) {
        registry.counter("policylens.reevaluation.items", "outcome", "re_evaluated").increment(reEvaluated);
        registry.counter("policylens.reevaluation.items", "outcome", "verdict_changed").increment(verdictsChanged);
        registry.counter("policylens.reevaluation.items", "outcome", "skipped").increment(skipped);
        registry.counter("policylens.reevaluation.items", "outcome", "failed").increment(failed);
    }

    @Override
    public void feedbackReceived(Verdict correctedVerdict, boolean overturned) {
        registry.counter("policylens.feedback",
                "corrected_verdict", correctedVerdict.name(),
                "overturned", Boolean.toString(overturned)).increment();
    }
}
