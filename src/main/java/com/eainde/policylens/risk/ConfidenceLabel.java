package com.eainde.policylens.risk;

/**
 * How much precedent backs a composite score.
 */
public enum ConfidenceLabel {
    HIGH,
    MEDIUM,
    LOW
}
