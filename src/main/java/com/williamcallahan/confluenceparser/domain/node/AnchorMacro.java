package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class AnchorMacro extends MacroNode {

    private final String anchorName;

    public AnchorMacro(MacroDescriptor descriptor, String anchorName, NodeScope scope) {
        super(NodeType.ANCHOR_MACRO, descriptor, List.of(), scope);
        this.anchorName = anchorName;
    }

    public AnchorMacro(String anchorName) {
        this(MacroDescriptor.of("anchor"), anchorName, NodeScope.NONE);
    }

    public String anchorName() {
        return anchorName;
    }
}
