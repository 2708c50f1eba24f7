package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class AttachmentsMacro extends MacroNode {

    private final String patterns;
    private final String sortBy;
    private final Boolean upload;
    private final Boolean old;

    public AttachmentsMacro(MacroDescriptor descriptor, String patterns, String sortBy, Boolean upload, Boolean old,
            NodeScope scope) {
        super(NodeType.ATTACHMENTS_MACRO, descriptor, List.of(), scope);
        this.patterns = patterns;
        this.sortBy = sortBy;
        this.upload = upload;
        this.old = old;
    }

    /**
     * Gets the filename filter.
     * @return comma separated glob patterns such as {@code *.pdf}, or null
     */
    public String patterns() {
        return patterns;
    }

    public String sortBy() {
        return sortBy;
    }

    public Boolean upload() {
        return upload;
    }

    public Boolean old() {
        return old;
    }
}
