package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Macro whose name has no typed mapping; keeps the raw name, parameters and body.
 */
public final class GenericMacro extends MacroNode {

    private final String plainTextBody;

    public GenericMacro(MacroDescriptor descriptor, String plainTextBody, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.GENERIC_MACRO, descriptor, children, scope);
        this.plainTextBody = plainTextBody;
    }

    public String plainTextBody() {
        return plainTextBody;
    }
}
