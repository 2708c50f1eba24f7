package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Page properties style key/value table wrapper ({@code details}).
 */
public final class DetailsMacro extends MacroNode {

    private final String detailsId;
    private final Boolean hidden;

    public DetailsMacro(MacroDescriptor descriptor, String detailsId, Boolean hidden, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.DETAILS_MACRO, descriptor, children, scope);
        this.detailsId = detailsId;
        this.hidden = hidden;
    }

    public String detailsId() {
        return detailsId;
    }

    public Boolean hidden() {
        return hidden;
    }
}
