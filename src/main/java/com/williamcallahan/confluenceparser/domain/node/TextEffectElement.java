package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Objects;

/**
 * Inline formatting wrapper; {@code pre} is the one block-level effect.
 */
public final class TextEffectElement extends Node {

    private final TextEffectType effect;

    public TextEffectElement(TextEffectType effect, List<? extends Node> children, NodeScope scope) {
        super(NodeType.TEXT_EFFECT, children, scope);
        this.effect = Objects.requireNonNull(effect, "Text effect cannot be null");
    }

    public TextEffectType effect() {
        return effect;
    }

    @Override
    public boolean isBlock() {
        return effect == TextEffectType.PREFORMATTED;
    }
}
