package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.Link;
import java.util.List;
import java.util.Objects;

/**
 * Hyperlink node.
 *
 * <p>Children hold the embedded resource identifiers followed by the link body. The
 * resolved target lives in {@link #link()}.</p>
 */
public final class LinkElement extends Node {

    private final LinkType linkType;
    private final String href;
    private final Link link;

    public LinkElement(LinkType linkType, String href, Link link, List<? extends Node> children, NodeScope scope) {
        super(NodeType.LINK, children, scope);
        this.linkType = Objects.requireNonNull(linkType, "Link type cannot be null");
        this.href = href;
        this.link = link;
    }

    public LinkElement(LinkType linkType, String href, List<? extends Node> children) {
        this(linkType, href, href == null ? null : new Link(href, null, null, null, ""), children, NodeScope.NONE);
    }

    public LinkType linkType() {
        return linkType;
    }

    public String href() {
        return href;
    }

    public Link link() {
        return link;
    }

    /**
     * Gets the canonical URI of the link target.
     * @return URI derived from the embedded link, else the href, else null
     */
    public String canonicalUri() {
        if (link != null) {
            String uri = link.canonicalUri();
            if (uri != null) {
                return uri;
            }
        }
        return href;
    }
}
