package com.eainde.policylens.risk;

/**
 * Verdict of the composite scorer. Kept separate from the engine's verdict because the two
 * use independent thresholds.
 */
public enum RiskVerdict {
    FLAG,
    REVIEW,
    CLEAR
}
