package com.eainde.policylens.model;

/**
 * Size class of a policy edit, derived from change magnitude (1 - similarity).
 */
public enum ChangeClassification {
    MINOR,
    MODERATE,
    MAJOR;

    private static final double MINOR_LIMIT = 0.05;
    private static final double MODERATE_LIMIT = 0.20;

    public static ChangeClassification fromMagnitude(double magnitude) {
        if (magnitude < MINOR_LIMIT) return MINOR;
        if (magnitude < MODERATE_LIMIT) return MODERATE;
        return MAJOR;
    }
}
