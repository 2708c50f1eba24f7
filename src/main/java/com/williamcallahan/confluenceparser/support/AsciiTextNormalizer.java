package com.williamcallahan.confluenceparser.support;

/**
 * Locale-independent text helpers for markup names and text leaves.
 *
 * Tag and attribute names are compared after lowering ASCII letters only, so that
 * locale rules never change how {@code ac:Layout-Cell} resolves.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = null;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                if (normalized == null) {
                    normalized = new StringBuilder(text.length()).append(text, 0, index);
                }
                normalized.append((char) (current + CASE_OFFSET));
            } else if (normalized != null) {
                normalized.append(current);
            }
        }
        return normalized == null ? text : normalized.toString();
    }

    /**
     * Strips a namespace prefix and lowercases the remaining local name.
     *
     * @param qualifiedName name such as {@code ac:structured-macro}
     * @return local name such as {@code structured-macro}, or empty string if null
     */
    public static String localName(String qualifiedName) {
        if (qualifiedName == null) {
            return "";
        }
        int colon = qualifiedName.indexOf(':');
        String local = colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
        return toLowerAscii(local);
    }

    /**
     * Collapses every run of whitespace (including non-breaking spaces) to a single space.
     *
     * @param text raw character data
     * @return collapsed text; leading and trailing runs become one space, not nothing
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder collapsed = new StringBuilder(text.length());
        boolean inWhitespace = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (Character.isWhitespace(current) || current == '\u00A0') {
                if (!inWhitespace) {
                    collapsed.append(' ');
                    inWhitespace = true;
                }
            } else {
                collapsed.append(current);
                inWhitespace = false;
            }
        }
        return collapsed.toString();
    }
}
