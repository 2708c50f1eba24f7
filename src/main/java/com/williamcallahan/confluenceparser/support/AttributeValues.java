package com.williamcallahan.confluenceparser.support;

/**
 * Coerces attribute and parameter strings into typed values without ever throwing.
 */
public final class AttributeValues {

    private AttributeValues() {
        // Utility class - no instantiation
    }

    /**
     * Parses a base-10 integer.
     *
     * @param raw attribute value (may be null)
     * @return parsed value, or null when absent or malformed
     */
    public static Integer parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException malformed) {
            return null;
        }
    }

    /**
     * Parses the literals {@code true} and {@code false}, ignoring ASCII case.
     *
     * @param raw attribute value (may be null)
     * @return parsed flag, or null for any other value
     */
    public static Boolean parseBoolean(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = AsciiTextNormalizer.toLowerAscii(raw.strip());
        if ("true".equals(normalized)) {
            return Boolean.TRUE;
        }
        if ("false".equals(normalized)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public static String blankToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
