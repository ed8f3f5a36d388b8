package com.eainde.policylens.engine;

import com.eainde.policylens.model.ComplianceDecision;

import java.time.Duration;

/**
 * @param decision the stored decision
 * @param traceId  trace id of the evaluation, also the decision id in the store
 * @param latency  wall-clock time of the evaluation
 */
public record EvaluationResult(ComplianceDecision decision, String traceId, Duration latency) {}
