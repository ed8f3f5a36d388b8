package com.eainde.policylens.risk;

import com.eainde.policylens.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One human-readable reason contributing to a composite score.
 */
public record RiskFactor(
        @JsonProperty("factor")      String factor,
        @JsonProperty("severity")    RiskLevel severity,
        @JsonProperty("description") String description
) {}
