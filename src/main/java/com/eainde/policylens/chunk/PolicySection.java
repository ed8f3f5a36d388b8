package com.eainde.policylens.chunk;

/**
 * A heading-delimited section of a policy document.
 *
 * <pre>
 *   Section 0: label = null        (preamble before the first heading, if any)
 *   Section 1: label = "Section 1 Customer Due Diligence"
 *   Section 2: label = "2.1 Reporting Thresholds"
 * </pre>
 *
 * @param index zero-based position in the document
 * @param label heading line without trailing colon, or null for unlabeled text
 * @param text  section text; for labeled sections the heading line is the first line
 */
public record PolicySection(
        int index,
        String label,
        String text
) {

    /**
     * @return true if this section was opened by a heading
     */
    public boolean isLabeled() {
        return label != null;
    }

    @Override
    public String toString() {
        return String.format("Section[%d, %s, %d chars]",
                index, label != null ? label : "<unlabeled>", text.length());
    }
}
