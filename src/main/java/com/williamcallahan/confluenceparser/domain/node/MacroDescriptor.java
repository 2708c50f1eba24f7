package com.williamcallahan.confluenceparser.domain.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity and raw parameters shared by every structured macro.
 *
 * @param name macro name as written in the markup, e.g. {@code "code"}; empty when the markup omits it
 * @param macroId macro id attribute, or null
 * @param localId local id attribute, or null
 * @param parameters raw parameter values by parameter name, in source order
 */
public record MacroDescriptor(String name, String macroId, String localId, Map<String, String> parameters) {

    public MacroDescriptor {
        Objects.requireNonNull(name, "Macro name cannot be null");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static MacroDescriptor of(String name) {
        return new MacroDescriptor(name, null, null, Map.of());
    }
}
