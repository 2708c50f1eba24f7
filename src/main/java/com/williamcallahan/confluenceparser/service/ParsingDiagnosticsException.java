package com.williamcallahan.confluenceparser.service;

import java.util.List;

/**
 * Signals that a parse configured to raise on finish recorded diagnostics.
 */
public class ParsingDiagnosticsException extends IllegalStateException {

    private final List<String> diagnostics;

    /**
     * Creates the aggregate failure for a finished parse.
     *
     * @param diagnostics every diagnostic recorded, in discovery order
     */
    public ParsingDiagnosticsException(List<String> diagnostics) {
        super("Parsing finished with " + diagnostics.size() + " diagnostic(s): " + diagnostics);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
