package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.node.LayoutAddress;
import com.williamcallahan.confluenceparser.domain.node.NodeScope;

/**
 * Recursion state carried down the element tree.
 *
 * @param listDepth number of enclosing list items, 0 outside lists
 * @param layout enclosing layout cell address, or null
 * @param preformatted whether text is inside a {@code pre} element and must keep its whitespace
 */
record ParseContext(int listDepth, LayoutAddress layout, boolean preformatted) {

    static final ParseContext ROOT = new ParseContext(0, null, false);

    ParseContext enterListItem() {
        return new ParseContext(listDepth + 1, layout, preformatted);
    }

    ParseContext enterLayoutCell(int sectionIndex, int cellIndex) {
        return new ParseContext(listDepth, new LayoutAddress(sectionIndex, cellIndex), preformatted);
    }

    ParseContext enterPreformatted() {
        return preformatted ? this : new ParseContext(listDepth, layout, true);
    }

    NodeScope scope() {
        if (listDepth == 0 && layout == null) {
            return NodeScope.NONE;
        }
        return new NodeScope(listDepth == 0 ? null : listDepth, layout);
    }
}
