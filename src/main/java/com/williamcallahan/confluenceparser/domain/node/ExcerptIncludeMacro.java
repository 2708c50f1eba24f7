package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Embeds the excerpt of another page or blog post.
 */
public final class ExcerptIncludeMacro extends MacroNode {

    private final String contentTitle;
    private final String spaceKey;
    private final String postingDay;
    private final Boolean noPanel;

    public ExcerptIncludeMacro(MacroDescriptor descriptor, String contentTitle, String spaceKey, String postingDay,
            Boolean noPanel, NodeScope scope) {
        super(NodeType.EXCERPT_INCLUDE_MACRO, descriptor, List.of(), scope);
        this.contentTitle = contentTitle;
        this.spaceKey = spaceKey;
        this.postingDay = postingDay;
        this.noPanel = noPanel;
    }

    public ExcerptIncludeMacro(String contentTitle, String postingDay) {
        this(MacroDescriptor.of("excerpt-include"), contentTitle, null, postingDay, null, NodeScope.NONE);
    }

    public String contentTitle() {
        return contentTitle;
    }

    public String spaceKey() {
        return spaceKey;
    }

    /**
     * Gets the posting day when the source is a blog post.
     * @return posting day such as {@code 2023-01-01}, or null for pages
     */
    public String postingDay() {
        return postingDay;
    }

    public Boolean noPanel() {
        return noPanel;
    }
}
