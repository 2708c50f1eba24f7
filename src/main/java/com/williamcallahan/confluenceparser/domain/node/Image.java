package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.UrlReference;
import java.util.List;

/**
 * Embedded image; caption content is carried as children.
 */
public final class Image extends Node {

    private final ImageAttributes attributes;
    private final AttachmentReference attachment;
    private final UrlReference url;

    public Image(ImageAttributes attributes, AttachmentReference attachment, UrlReference url,
            List<? extends Node> caption, NodeScope scope) {
        super(NodeType.IMAGE, caption, scope);
        this.attributes = attributes == null ? ImageAttributes.EMPTY : attributes;
        this.attachment = attachment;
        this.url = url;
    }

    public Image(ImageAttributes attributes) {
        this(attributes, null, null, List.of(), NodeScope.NONE);
    }

    public ImageAttributes attributes() {
        return attributes;
    }

    public AttachmentReference attachment() {
        return attachment;
    }

    public UrlReference url() {
        return url;
    }

    public String alt() {
        return attributes.alt();
    }

    public String title() {
        return attributes.title();
    }

    public String src() {
        return attributes.src();
    }

    /**
     * Gets the attachment filename.
     * @return filename of the embedded attachment, or null for URL and src images
     */
    public String filename() {
        return attachment == null ? null : attachment.filename();
    }
}
