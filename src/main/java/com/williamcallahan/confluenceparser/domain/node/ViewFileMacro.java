package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import java.util.List;

/**
 * Inline preview of an attached office file.
 */
public final class ViewFileMacro extends MacroNode {

    private final AttachmentReference attachment;
    private final String height;
    private final String width;

    public ViewFileMacro(MacroDescriptor descriptor, AttachmentReference attachment, String height, String width,
            NodeScope scope) {
        super(NodeType.VIEW_FILE_MACRO, descriptor, List.of(), scope);
        this.attachment = attachment;
        this.height = height;
        this.width = width;
    }

    public ViewFileMacro(AttachmentReference attachment) {
        this(MacroDescriptor.of("view-file"), attachment, null, null, NodeScope.NONE);
    }

    public AttachmentReference attachment() {
        return attachment;
    }

    public String filename() {
        return attachment == null ? null : attachment.filename();
    }

    public Integer versionAtSave() {
        return attachment == null ? null : attachment.versionAtSave();
    }

    public String height() {
        return height;
    }

    public String width() {
        return width;
    }
}
