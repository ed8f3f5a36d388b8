package com.eainde.policylens.model;

import java.time.Instant;

/**
 * One version of a policy document. The raw text is kept as the snapshot later versions are
 * diffed against.
 *
 * @param docId        unique per version
 * @param title        display title
 * @param source       issuing body
 * @param topic        topic classification
 * @param version      version label
 * @param content      raw text snapshot
 * @param active       false once superseded; never flips back
 * @param validFrom    start of validity
 * @param validTo      end of validity, null while active
 * @param supersededBy id of the version that replaced this one, or null
 */
public record PolicyDocument(
        String docId,
        String title,
        PolicySource source,
        PolicyTopic topic,
        String version,
        String content,
        boolean active,
        Instant validFrom,
        Instant validTo,
        String supersededBy
) {}
