package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a policy chunk as cited by a decision. Later chunk changes do not affect it.
 */
public record PolicyCitation(
        @JsonProperty("doc_id")          String docId,
        @JsonProperty("doc_title")       String docTitle,
        @JsonProperty("section")         String section,
        @JsonProperty("text")            String text,
        @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("version")         String version
) {}
