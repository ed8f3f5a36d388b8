package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Result of comparing two versions of a policy document.
 *
 * @param changeId          record identifier
 * @param oldDocId          superseded version
 * @param newDocId          replacing version
 * @param similarityRatio   longest-matching-blocks ratio in [0,1]
 * @param changeMagnitude   {@code 1 - similarityRatio}
 * @param classification    MINOR / MODERATE / MAJOR
 * @param sectionsAffected  "Added: X" / "Removed: Y" entries, or a content-level marker
 * @param timestamp         detection time
 */
public record PolicyChangeRecord(
        @JsonProperty("change_id")         String changeId,
        @JsonProperty("old_doc_id")        String oldDocId,
        @JsonProperty("new_doc_id")        String newDocId,
        @JsonProperty("similarity_ratio")  double similarityRatio,
        @JsonProperty("change_magnitude")  double changeMagnitude,
        @JsonProperty("change_type")       ChangeClassification classification,
        @JsonProperty("sections_affected") List<String> sectionsAffected,
        @JsonProperty("timestamp")         Instant timestamp
) {

    public PolicyChangeRecord {
        sectionsAffected = sectionsAffected == null ? List.of() : List.copyOf(sectionsAffected);
    }

    /**
     * Builds a record from a similarity ratio; magnitude and classification are derived.
     */
    public static PolicyChangeRecord of(String changeId, String oldDocId, String newDocId,
                                        double similarityRatio, List<String> sectionsAffected,
                                        Instant timestamp) {
        double ratio = Math.max(0.0, Math.min(1.0, similarityRatio));
        double magnitude = 1.0 - ratio;
        return new PolicyChangeRecord(changeId, oldDocId, newDocId, ratio, magnitude,
                ChangeClassification.fromMagnitude(magnitude), sectionsAffected, timestamp);
    }
}
