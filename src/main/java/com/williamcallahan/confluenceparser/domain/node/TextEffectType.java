package com.williamcallahan.confluenceparser.domain.node;

public enum TextEffectType {
    STRONG,
    EMPHASIS,
    UNDERLINE,
    STRIKETHROUGH,
    SUBSCRIPT,
    SUPERSCRIPT,
    MONOSPACE,
    PREFORMATTED
}
