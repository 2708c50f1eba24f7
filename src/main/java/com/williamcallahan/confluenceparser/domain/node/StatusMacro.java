package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Coloured status lozenge.
 */
public final class StatusMacro extends MacroNode {

    private final String title;
    private final String colour;
    private final Boolean subtle;

    public StatusMacro(MacroDescriptor descriptor, String title, String colour, Boolean subtle, NodeScope scope) {
        super(NodeType.STATUS_MACRO, descriptor, List.of(), scope);
        this.title = title;
        this.colour = colour;
        this.subtle = subtle;
    }

    public StatusMacro(String title, String colour) {
        this(MacroDescriptor.of("status"), title, colour, null, NodeScope.NONE);
    }

    public String title() {
        return title;
    }

    public String colour() {
        return colour;
    }

    public Boolean subtle() {
        return subtle;
    }
}
