package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class ExpandMacro extends MacroNode {

    private final String title;
    private final String breakoutWidth;

    public ExpandMacro(MacroDescriptor descriptor, String title, String breakoutWidth, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.EXPAND_MACRO, descriptor, children, scope);
        this.title = title;
        this.breakoutWidth = breakoutWidth;
    }

    public ExpandMacro(String title, List<? extends Node> children) {
        this(MacroDescriptor.of("expand"), title, null, children, NodeScope.NONE);
    }

    public String title() {
        return title;
    }

    public String breakoutWidth() {
        return breakoutWidth;
    }
}
