package com.williamcallahan.confluenceparser.support;

/**
 * Removes unpaired UTF-16 surrogates so the markup is valid Unicode before parsing.
 */
public final class SurrogateRepair {

    private SurrogateRepair() {
        // Utility class - no instantiation
    }

    /**
     * Deletes every lone high or low surrogate, keeping well-formed pairs intact.
     *
     * @param text input text (may be null)
     * @return repaired text, the same instance when nothing needed removal, or empty string if null
     */
    public static String stripUnpaired(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder repaired = null;
        int length = text.length();
        for (int index = 0; index < length; index++) {
            char current = text.charAt(index);
            boolean keep;
            int width = 1;
            if (Character.isHighSurrogate(current)) {
                keep = index + 1 < length && Character.isLowSurrogate(text.charAt(index + 1));
                if (keep) {
                    width = 2;
                }
            } else {
                keep = !Character.isLowSurrogate(current);
            }
            if (!keep && repaired == null) {
                repaired = new StringBuilder(length).append(text, 0, index);
            } else if (keep && repaired != null) {
                repaired.append(text, index, index + width);
            }
            index += width - 1;
        }
        return repaired == null ? text : repaired.toString();
    }
}
