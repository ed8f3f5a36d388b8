package com.eainde.policylens.extraction;

import java.util.Locale;

/**
 * Kinds of uploaded policy documents.
 */
public enum DocumentKind {
    TEXT,
    PDF,
    DOCX;

    /**
     * Resolves a kind from a file name extension. Unknown extensions are treated as text.
     */
    public static DocumentKind fromFileName(String fileName) {
        if (fileName == null) return TEXT;
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) return PDF;
        if (lower.endsWith(".docx")) return DOCX;
        return TEXT;
    }
}
