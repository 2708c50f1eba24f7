package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;

public enum TaskListItemStatus {
    COMPLETE,
    INCOMPLETE;

    /**
     * Parses a task status literal.
     * @param value raw status such as {@code complete}
     * @return status, or null when the literal is not recognized
     */
    public static TaskListItemStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (AsciiTextNormalizer.toLowerAscii(value.strip())) {
            case "complete", "completed", "done" -> COMPLETE;
            case "incomplete", "todo" -> INCOMPLETE;
            default -> null;
        };
    }
}
