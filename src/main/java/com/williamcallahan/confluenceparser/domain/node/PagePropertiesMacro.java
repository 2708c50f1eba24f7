package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class PagePropertiesMacro extends MacroNode {

    private final String propertiesId;
    private final Boolean hidden;

    public PagePropertiesMacro(MacroDescriptor descriptor, String propertiesId, Boolean hidden,
            List<? extends Node> children, NodeScope scope) {
        super(NodeType.PAGE_PROPERTIES_MACRO, descriptor, children, scope);
        this.propertiesId = propertiesId;
        this.hidden = hidden;
    }

    public String propertiesId() {
        return propertiesId;
    }

    public Boolean hidden() {
        return hidden;
    }
}
