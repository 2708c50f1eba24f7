package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class TocMacro extends MacroNode {

    private final String style;
    private final Integer minLevel;
    private final Integer maxLevel;
    private final String tocType;
    private final Boolean outline;

    public TocMacro(MacroDescriptor descriptor, String style, Integer minLevel, Integer maxLevel, String tocType,
            Boolean outline, NodeScope scope) {
        super(NodeType.TOC_MACRO, descriptor, List.of(), scope);
        this.style = style;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.tocType = tocType;
        this.outline = outline;
    }

    public String style() {
        return style;
    }

    public Integer minLevel() {
        return minLevel;
    }

    public Integer maxLevel() {
        return maxLevel;
    }

    public String tocType() {
        return tocType;
    }

    public Boolean outline() {
        return outline;
    }
}
