package com.eainde.policylens.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of a transaction evaluation.
 */
public enum Verdict {
    FLAG,
    NEEDS_REVIEW,
    ACCEPTABLE;

    /**
     * Lenient parse used on reasoning-gateway output. Accepts the canonical names in any
     * case plus the short forms {@code REVIEW} and {@code CLEAR}.
     */
    public static Optional<Verdict> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.strip().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        switch (normalized) {
            case "FLAG":
            case "FLAGGED":
                return Optional.of(FLAG);
            case "NEEDS_REVIEW":
            case "REVIEW":
                return Optional.of(NEEDS_REVIEW);
            case "ACCEPTABLE":
            case "CLEAR":
                return Optional.of(ACCEPTABLE);
            default:
                return Optional.empty();
        }
    }
}
