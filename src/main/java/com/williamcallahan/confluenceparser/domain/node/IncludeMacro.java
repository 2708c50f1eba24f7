package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class IncludeMacro extends MacroNode {

    private final String contentTitle;
    private final String spaceKey;

    public IncludeMacro(MacroDescriptor descriptor, String contentTitle, String spaceKey, NodeScope scope) {
        super(NodeType.INCLUDE_MACRO, descriptor, List.of(), scope);
        this.contentTitle = contentTitle;
        this.spaceKey = spaceKey;
    }

    public IncludeMacro(String contentTitle) {
        this(MacroDescriptor.of("include"), contentTitle, null, NodeScope.NONE);
    }

    public String contentTitle() {
        return contentTitle;
    }

    public String spaceKey() {
        return spaceKey;
    }
}
