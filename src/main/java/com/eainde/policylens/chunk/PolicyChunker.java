package com.eainde.policylens.chunk;

import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicyDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a policy document into overlapping token windows suitable for retrieval.
 *
 * <h3>Why overlap?</h3>
 * <p>A requirement often spans a window boundary: a threshold stated at the end of one
 * window and the reporting duty it triggers at the start of the next. Overlapping windows
 * keep both halves retrievable together.</p>
 *
 * <h3>Layout:</h3>
 * <pre>
 *   size = 600, overlap = 100, stride = 500
 *   Chunk 0: tokens [0..600)
 *   Chunk 1: tokens [500..1100)   tokens 500-599 are overlap
 *   Chunk 2: tokens [1000..1320)  last window, stops at end of section
 * </pre>
 *
 * <p>A window also closes early when its text would exceed
 * {@link PolicyChunk#MAX_TEXT_LENGTH} characters; text is never truncated. Windows never
 * cross a section boundary. Output order is section order, then window
 * order, and chunk ids derive from that order, so re-chunking the same text yields the
 * same ids.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * PolicyChunker chunker = PolicyChunker.builder()
 *         .chunkSize(600)
 *         .overlap(100)
 *         .minChunkChars(50)
 *         .build();
 *
 * List&lt;PolicyChunk&gt; chunks = chunker.chunk(document);
 * </pre>
 *
 * <p>This class is pure logic with no Spring dependencies.</p>
 */
public class PolicyChunker {

    private static final Logger log = LoggerFactory.getLogger(PolicyChunker.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int chunkSize;
    private final int overlap;
    private final int minChunkChars;

    private PolicyChunker(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.overlap = builder.overlap;
        this.minChunkChars = builder.minChunkChars;

        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") must be < chunkSize (" + chunkSize + ")");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Chunks a document. Every chunk inherits the document's metadata.
     *
     * @param document the document to split
     * @return chunks in stable order, possibly empty for blank or tiny documents
     */
    public List<PolicyChunk> chunk(PolicyDocument document) {
        List<PolicySection> sections = SectionHeadings.split(document.content());
        if (sections.isEmpty()) {
            log.warn("Document {} has no text to chunk", document.docId());
            return Collections.emptyList();
        }

        List<PolicyChunk> chunks = new ArrayList<>();
        for (PolicySection section : sections) {
            for (String windowText : window(tokenize(section.text()))) {
                chunks.add(toChunk(document, section, chunks.size(), windowText));
            }
        }

        log.info("Document {} v{} split into {} sections, {} chunks (size={}, overlap={})",
                document.docId(), document.version(), sections.size(), chunks.size(), chunkSize, overlap);
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Whitespace tokenization used for windowing. A token longer than
     * {@link PolicyChunk#MAX_TEXT_LENGTH} is split into pieces of that length.
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return Collections.emptyList();
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(text.strip())) {
            for (int i = 0; i < token.length(); i += PolicyChunk.MAX_TEXT_LENGTH) {
                tokens.add(token.substring(i, Math.min(i + PolicyChunk.MAX_TEXT_LENGTH, token.length())));
            }
        }
        return tokens;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /**
     * Windows of at most {@code chunkSize} tokens and {@link PolicyChunk#MAX_TEXT_LENGTH}
     * characters. A window that hits the character bound closes before the token that would
     * cross it, and the next window starts {@code overlap} tokens back from there. Stops once
     * a window reaches the last token, and drops a trailing fragment shorter than
     * {@code minChunkChars}.
     */
    List<String> window(List<String> tokens) {
        List<String> windows = new ArrayList<>();

        int start = 0;
        while (start < tokens.size()) {
            int end = start;
            int length = 0;
            while (end < tokens.size() && end - start < chunkSize) {
                int added = tokens.get(end).length() + (end > start ? 1 : 0);
                if (end > start && length + added > PolicyChunk.MAX_TEXT_LENGTH) break;
                length += added;
                end++;
            }
            String text = String.join(" ", tokens.subList(start, end));

            if (text.length() < minChunkChars) {
                log.debug("Dropping {}-char fragment at token {}", text.length(), start);
                break;
            }
            windows.add(text);

            if (end >= tokens.size()) break;
            if (end - start <= overlap) {
                log.debug("Window at token {} holds {} tokens, overlap reduced", start, end - start);
            }
            start = Math.max(end - overlap, start + 1);
        }
        return windows;
    }

    private PolicyChunk toChunk(PolicyDocument document, PolicySection section, int ordinal, String text) {
        return new PolicyChunk(
                document.docId() + "_chunk_" + ordinal,
                document.docId(),
                ordinal,
                text,
                document.title(),
                section.label(),
                document.source(),
                document.topic(),
                document.version(),
                document.active(),
                document.validFrom(),
                document.validTo());
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a chunker with default settings (600-token windows, 100-token overlap,
     * 50-char minimum).
     */
    public static PolicyChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int chunkSize = 600;
        private int overlap = 100;
        private int minChunkChars = 50;

        /**
         * Tokens per window. Default: 600.
         */
        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Tokens shared by adjacent windows. Default: 100. Must be less than chunkSize.
         */
        public Builder overlap(int overlap) {
            if (overlap < 0) throw new IllegalArgumentException("overlap must be >= 0");
            this.overlap = overlap;
            return this;
        }

        /**
         * Fragments shorter than this many characters are dropped. Default: 50.
         */
        public Builder minChunkChars(int minChunkChars) {
            if (minChunkChars < 0) throw new IllegalArgumentException("minChunkChars must be >= 0");
            this.minChunkChars = minChunkChars;
            return this;
        }

        public PolicyChunker build() {
            return new PolicyChunker(this);
        }
    }
}
