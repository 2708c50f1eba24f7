package com.williamcallahan.confluenceparser.domain.node;

public enum TextBreakType {
    HORIZONTAL_RULE,
    LINE_BREAK
}
