package com.williamcallahan.confluenceparser.domain;

import java.util.List;
import java.util.Objects;

/**
 * Side information produced by a parse.
 *
 * @param diagnostics recoverable issues in the order they were found
 */
public record DocumentMetadata(List<String> diagnostics) {

    public static final DocumentMetadata EMPTY = new DocumentMetadata(List.of());

    public DocumentMetadata {
        Objects.requireNonNull(diagnostics, "Diagnostics list cannot be null");
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Checks if the parse finished without diagnostics.
     * @return true if nothing was recorded
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
