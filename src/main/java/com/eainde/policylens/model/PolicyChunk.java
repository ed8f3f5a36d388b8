package com.eainde.policylens.model;

import java.time.Instant;

/**
 * A retrievable slice of a policy document. Created once at ingestion and never edited;
 * the active flag only changes through document deactivation.
 *
 * @param chunkId  {@code <docId>_chunk_<ordinal>}
 * @param docId    owning document
 * @param ordinal  position within the document, section order first
 * @param text     chunk text, bounded to {@link #MAX_TEXT_LENGTH}
 * @param docTitle owning document title
 * @param section  section label, or null for unlabeled text
 * @param source   source tag
 * @param topic    topic tag
 * @param version  document version
 * @param active   whether the owning document is active
 * @param validFrom start of validity
 * @param validTo   end of validity, or null
 */
public record PolicyChunk(
        String chunkId,
        String docId,
        int ordinal,
        String text,
        String docTitle,
        String section,
        PolicySource source,
        PolicyTopic topic,
        String version,
        boolean active,
        Instant validFrom,
        Instant validTo
) {
    public static final int MAX_TEXT_LENGTH = 4000;
}
