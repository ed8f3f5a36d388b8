package com.eainde.policylens.chunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heading detection shared by the chunker and the policy sentinel, so that section
 * labels mean the same thing on both sides.
 *
 * <p>A heading is a short line that starts with {@code Section}, {@code Article} or
 * {@code Chapter} followed by a label, or with a numeric header such as {@code 3},
 * {@code 3.2} or {@code 3.2.1.} followed by a title.</p>
 */
public final class SectionHeadings {

    private static final Pattern HEADING = Pattern.compile(
            "^(?:(?:section|article|chapter)\\s+\\S.*|\\d+(?:\\.\\d+)*\\.?\\s+\\S.*)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    /** Longer lines are body text that happens to start with a number. */
    static final int MAX_HEADING_LENGTH = 120;

    private SectionHeadings() {
    }

    public static boolean isHeading(String line) {
        if (line == null) return false;
        String trimmed = line.strip();
        return !trimmed.isEmpty()
                && trimmed.length() <= MAX_HEADING_LENGTH
                && HEADING.matcher(trimmed).matches();
    }

    /**
     * Normalized label for a heading line: trimmed, trailing colons removed.
     */
    public static String label(String headingLine) {
        String trimmed = headingLine.strip();
        while (trimmed.endsWith(":")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed;
    }

    /**
     * Splits text into sections in document order. Text before the first heading becomes an
     * unlabeled section when it is not blank. Without any heading the whole text is one
     * unlabeled section.
     */
    public static List<PolicySection> split(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        List<PolicySection> sections = new ArrayList<>();
        String currentLabel = null;
        StringBuilder current = new StringBuilder();

        for (String line : LINE_BREAK.split(text, -1)) {
            if (isHeading(line)) {
                addSection(sections, currentLabel, current);
                currentLabel = label(line);
                current = new StringBuilder();
            }
            if (current.length() > 0) current.append('\n');
            current.append(line);
        }
        addSection(sections, currentLabel, current);
        return Collections.unmodifiableList(sections);
    }

    /**
     * Heading labels of a text, in first-seen order.
     */
    public static Set<String> labels(String text) {
        Set<String> labels = new LinkedHashSet<>();
        if (text == null) return labels;
        for (String line : LINE_BREAK.split(text, -1)) {
            if (isHeading(line)) {
                labels.add(label(line));
            }
        }
        return labels;
    }

    private static void addSection(List<PolicySection> sections, String label, StringBuilder text) {
        // a preamble made only of whitespace is not a section
        if (label == null && text.toString().isBlank()) return;
        sections.add(new PolicySection(sections.size(), label, text.toString()));
    }
}
