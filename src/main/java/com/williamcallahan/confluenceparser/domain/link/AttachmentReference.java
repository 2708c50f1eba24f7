package com.williamcallahan.confluenceparser.domain.link;

/**
 * Reference to a file attached to the current (or another) page.
 */
public record AttachmentReference(String filename, String contentId, Integer versionAtSave)
        implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.ATTACHMENT;
    }

    @Override
    public String canonicalUri() {
        if (filename == null || filename.isEmpty()) {
            return null;
        }
        String version = versionAtSave == null ? "" : "@v" + versionAtSave;
        return "attach://" + filename + version;
    }
}
