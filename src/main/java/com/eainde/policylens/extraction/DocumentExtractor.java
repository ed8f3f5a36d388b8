package com.eainde.policylens.extraction;

/**
 * Turns uploaded document bytes into plain text.
 */
public interface DocumentExtractor {

    /**
     * @param content raw document bytes
     * @param kind    document kind
     * @return extracted text
     * @throws com.eainde.policylens.exception.ExtractionException if the content cannot be decoded
     */
    String extract(byte[] content, DocumentKind kind);
}
