package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Row of a page layout, e.g. {@code two_equal}.
 */
public final class LayoutSection extends Node {

    private final String sectionType;
    private final String breakoutMode;

    public LayoutSection(String sectionType, String breakoutMode, List<? extends Node> children, NodeScope scope) {
        super(NodeType.LAYOUT_SECTION, children, scope);
        this.sectionType = sectionType;
        this.breakoutMode = breakoutMode;
    }

    public String sectionType() {
        return sectionType;
    }

    public String breakoutMode() {
        return breakoutMode;
    }

    public List<LayoutCell> cells() {
        return filter(children(), LayoutCell.class);
    }
}
