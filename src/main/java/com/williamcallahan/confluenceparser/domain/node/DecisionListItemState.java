package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;

public enum DecisionListItemState {
    DECIDED,
    PENDING;

    /**
     * Parses a decision state, treating anything but {@code DECIDED} as pending.
     * @param value raw state attribute
     * @return parsed state, or null when the value is absent
     */
    public static DecisionListItemState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return "decided".equals(AsciiTextNormalizer.toLowerAscii(value.strip())) ? DECIDED : PENDING;
    }
}
