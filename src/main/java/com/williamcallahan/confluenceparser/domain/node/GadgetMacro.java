package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class GadgetMacro extends MacroNode {

    private final String url;
    private final String width;
    private final String height;

    public GadgetMacro(MacroDescriptor descriptor, String url, String width, String height, NodeScope scope) {
        super(NodeType.GADGET_MACRO, descriptor, List.of(), scope);
        this.url = url;
        this.width = width;
        this.height = height;
    }

    public String url() {
        return url;
    }

    public String width() {
        return width;
    }

    public String height() {
        return height;
    }
}
