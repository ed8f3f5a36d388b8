package com.eainde.policylens.model;

import java.util.Locale;
import java.util.Optional;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW,
    ACCEPTABLE;

    public static Optional<RiskLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
