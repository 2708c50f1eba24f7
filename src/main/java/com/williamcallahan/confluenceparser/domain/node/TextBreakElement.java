package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Objects;

public final class TextBreakElement extends Node {

    private final TextBreakType breakType;

    public TextBreakElement(TextBreakType breakType, NodeScope scope) {
        super(NodeType.TEXT_BREAK, List.of(), scope);
        this.breakType = Objects.requireNonNull(breakType, "Break type cannot be null");
    }

    public TextBreakElement(TextBreakType breakType) {
        this(breakType, NodeScope.NONE);
    }

    public TextBreakType breakType() {
        return breakType;
    }

    @Override
    public boolean isBlock() {
        return breakType == TextBreakType.HORIZONTAL_RULE;
    }
}
