package com.eainde.policylens.policy;

import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;

import java.util.Objects;

/**
 * A policy document version as submitted.
 */
public record PolicyUpload(
        String title,
        PolicySource source,
        PolicyTopic topic,
        String version,
        String content
) {

    public PolicyUpload {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(version, "version");
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Policy content must not be blank");
        }
    }
}
