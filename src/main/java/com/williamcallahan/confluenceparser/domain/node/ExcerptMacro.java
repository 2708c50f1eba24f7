package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class ExcerptMacro extends MacroNode {

    private final Boolean hidden;
    private final String outputType;

    public ExcerptMacro(MacroDescriptor descriptor, Boolean hidden, String outputType, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.EXCERPT_MACRO, descriptor, children, scope);
        this.hidden = hidden;
        this.outputType = outputType;
    }

    public ExcerptMacro(List<? extends Node> children) {
        this(MacroDescriptor.of("excerpt"), null, null, children, NodeScope.NONE);
    }

    public Boolean hidden() {
        return hidden;
    }

    /**
     * Gets the requested output type.
     * @return {@code BLOCK} or {@code INLINE} as written, or null
     */
    public String outputType() {
        return outputType;
    }
}
