package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import java.util.List;
import java.util.Objects;

/**
 * Typed reference ({@code ri:*}) appearing inside a link or standalone.
 */
public final class ResourceIdentifier extends Node {

    private final ResourceReference reference;

    public ResourceIdentifier(ResourceReference reference, NodeScope scope) {
        super(NodeType.RESOURCE_IDENTIFIER, List.of(), scope);
        this.reference = Objects.requireNonNull(reference, "Resource reference cannot be null");
    }

    public ResourceIdentifier(ResourceReference reference) {
        this(reference, NodeScope.NONE);
    }

    public ResourceReference reference() {
        return reference;
    }
}
