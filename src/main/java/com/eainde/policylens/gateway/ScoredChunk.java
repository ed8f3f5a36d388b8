package com.eainde.policylens.gateway;

import com.eainde.policylens.model.PolicyChunk;

/**
 * A retrieved policy chunk with its similarity to the query in [0,1].
 */
public record ScoredChunk(PolicyChunk chunk, double score) {}
