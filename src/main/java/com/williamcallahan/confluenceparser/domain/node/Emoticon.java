package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class Emoticon extends Node {

    private final String name;
    private final String shortname;
    private final String emojiId;
    private final String fallback;

    /**
     * Creates an emoticon.
     *
     * @param name legacy emoticon name such as {@code smile}
     * @param shortname emoji shortname such as {@code :smile:}
     * @param emojiId emoji code point id
     * @param fallback glyph to show when the emoji cannot be resolved
     * @param scope construction scope
     */
    public Emoticon(String name, String shortname, String emojiId, String fallback, NodeScope scope) {
        super(NodeType.EMOTICON, List.of(), scope);
        this.name = name;
        this.shortname = shortname;
        this.emojiId = emojiId;
        this.fallback = fallback;
    }

    public Emoticon(String name, String shortname, String fallback) {
        this(name, shortname, null, fallback, NodeScope.NONE);
    }

    public String name() {
        return name;
    }

    public String shortname() {
        return shortname;
    }

    public String emojiId() {
        return emojiId;
    }

    public String fallback() {
        return fallback;
    }
}
