package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import java.util.List;

public final class ViewPdfMacro extends MacroNode {

    private final AttachmentReference attachment;

    public ViewPdfMacro(MacroDescriptor descriptor, AttachmentReference attachment, NodeScope scope) {
        super(NodeType.VIEW_PDF_MACRO, descriptor, List.of(), scope);
        this.attachment = attachment;
    }

    public ViewPdfMacro(AttachmentReference attachment) {
        this(MacroDescriptor.of("viewpdf"), attachment, NodeScope.NONE);
    }

    public AttachmentReference attachment() {
        return attachment;
    }

    public String filename() {
        return attachment == null ? null : attachment.filename();
    }
}
