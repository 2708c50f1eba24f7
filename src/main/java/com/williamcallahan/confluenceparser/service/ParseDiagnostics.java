package com.williamcallahan.confluenceparser.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects recoverable issues found during a single parse, in discovery order.
 */
public final class ParseDiagnostics {

    public static final String UNKNOWN_ELEMENT = "unknown_element";
    public static final String UNKNOWN_MACRO = "unknown_macro";
    public static final String UNKNOWN_ADF_NODE_TYPE = "unknown_adf_node_type";

    private final List<String> entries = new ArrayList<>();

    /**
     * Records a diagnostic of the form {@code reason:detail}.
     *
     * @param reason machine-readable reason such as {@link #UNKNOWN_MACRO}
     * @param detail offending tag, macro name or node type (may be null)
     */
    public void record(String reason, String detail) {
        entries.add(reason + ":" + (detail == null ? "" : detail));
    }

    /**
     * Records a free-form diagnostic message as is.
     * @param message diagnostic text
     */
    public void add(String message) {
        entries.add(message);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<String> snapshot() {
        return List.copyOf(entries);
    }
}
