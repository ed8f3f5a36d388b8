package com.eainde.policylens.model;

/**
 * Where the verdict of a {@link ComplianceDecision} came from, so consumers can weight trust.
 */
public enum DecisionSource {
    /** Well-formed answer from the reasoning gateway. */
    REASONING_GATEWAY,
    /** Reasoning gateway answered, but the answer was malformed and coerced to safe defaults. */
    REASONING_COERCED,
    /** Reasoning unavailable; deterministic rule-based heuristic. */
    FALLBACK_HEURISTIC
}
