package com.eainde.policylens.extraction;

import com.eainde.policylens.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 extractor. Binary formats are rejected; a PDF or DOCX extractor can be
 * registered in its place.
 */
@Slf4j
@Component
public class PlainTextDocumentExtractor implements DocumentExtractor {

    @Override
    public String extract(byte[] content, DocumentKind kind) {
        if (kind != DocumentKind.TEXT) {
            throw new ExtractionException("No extractor available for " + kind + " documents");
        }
        if (content == null || content.length == 0) {
            throw new ExtractionException("Document is empty");
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content)).toString();
            // strip a UTF-8 byte order mark
            if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                text = text.substring(1);
            }
            log.debug("Extracted {} chars from {} bytes", text.length(), content.length);
            return text;
        } catch (CharacterCodingException e) {
            throw new ExtractionException("Document is not valid UTF-8 text", e);
        }
    }
}
