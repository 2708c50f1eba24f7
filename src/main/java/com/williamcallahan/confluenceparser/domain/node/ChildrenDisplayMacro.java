package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.PageReference;
import java.util.List;

/**
 * Listing of a page's children ({@code children} / {@code children-display}).
 */
public final class ChildrenDisplayMacro extends MacroNode {

    private final Integer depth;
    private final String excerptType;
    private final String sort;
    private final Boolean reverse;
    private final Boolean all;
    private final String style;
    private final PageReference page;

    public ChildrenDisplayMacro(MacroDescriptor descriptor, Integer depth, String excerptType, String sort,
            Boolean reverse, Boolean all, String style, PageReference page, NodeScope scope) {
        super(NodeType.CHILDREN_DISPLAY_MACRO, descriptor, List.of(), scope);
        this.depth = depth;
        this.excerptType = excerptType;
        this.sort = sort;
        this.reverse = reverse;
        this.all = all;
        this.style = style;
        this.page = page;
    }

    public Integer depth() {
        return depth;
    }

    public String excerptType() {
        return excerptType;
    }

    public String sort() {
        return sort;
    }

    public Boolean reverse() {
        return reverse;
    }

    public Boolean all() {
        return all;
    }

    public String style() {
        return style;
    }

    /**
     * Gets the parent page whose children are listed.
     * @return page reference, or null for the current page
     */
    public PageReference page() {
        return page;
    }
}
