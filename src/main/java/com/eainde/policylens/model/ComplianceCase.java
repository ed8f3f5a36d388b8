package com.eainde.policylens.model;

import java.time.Instant;

/**
 * Case-based memory entry: what a past transaction looked like and what it received.
 * Written once, after its decision was stored.
 */
public record ComplianceCase(
        String caseId,
        String transactionId,
        float[] embedding,
        Verdict verdict,
        double riskScore,
        String reasoning,
        Instant createdAt
) {}
