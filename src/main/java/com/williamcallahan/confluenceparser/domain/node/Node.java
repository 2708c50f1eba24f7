package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.render.PlainTextRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base of the closed set of document tree variants.
 *
 * <p>A node owns its children and never references its parent; upward navigation goes
 * through {@link #path()} from the document root. Payload fields are final. The identity
 * fields ({@code id}, {@code path}, {@code kind}) are written exactly once by
 * {@link IdentityAssigner} when the owning document is assembled, after which the tree is
 * read-only.</p>
 */
public abstract sealed class Node
    permits Text, Fragment, ContainerElement, Paragraph, HeadingElement, TextEffectElement,
        TextBreakElement, BlockquoteElement, ListElement, ListItem, Table, TableRow, TableCell,
        LinkElement, ResourceIdentifier, Image, Emoticon, Time, PlaceholderElement, I18nElement,
        LayoutElement, LayoutSection, LayoutCell, DecisionList, DecisionListItem, MacroNode {

    /** Id carried by nodes that have not been placed in a document. */
    public static final int UNASSIGNED_ID = -1;

    private final NodeType type;
    private final List<Node> children;
    private final NodeScope scope;

    private int id = UNASSIGNED_ID;
    private List<Integer> path = List.of();
    private String kind;

    protected Node(NodeType type, List<? extends Node> children, NodeScope scope) {
        this.type = Objects.requireNonNull(type, "Node type cannot be null");
        this.children = children == null ? List.of() : List.copyOf(children);
        this.scope = scope == null ? NodeScope.NONE : scope;
    }

    public NodeType type() {
        return type;
    }

    /**
     * Gets the discriminant string of this node's variant.
     * @return type identifier such as {@code "heading"}
     */
    public String typeName() {
        return type.getIdentifier();
    }

    /**
     * Gets the coarse semantic kind.
     * @return kind assigned by the identity pass, or derived from the type if the node is detached
     */
    public String kind() {
        return kind != null ? kind : NodeKinds.classify(this);
    }

    /**
     * Gets the document-unique id.
     * @return id, or {@link #UNASSIGNED_ID} for a node built outside a document
     */
    public int id() {
        return id;
    }

    /**
     * Gets the child indices leading from the document root to this node.
     * @return immutable index path; empty for the root
     */
    public List<Integer> path() {
        return path;
    }

    public List<Node> children() {
        return children;
    }

    public NodeScope scope() {
        return scope;
    }

    public boolean isBlock() {
        return type.isBlock();
    }

    /**
     * Lists this node and all of its descendants in pre-order.
     * @return nodes in traversal order, starting with this node
     */
    public List<Node> walk() {
        List<Node> visited = new ArrayList<>();
        collect(this, visited);
        return visited;
    }

    public List<Node> findAll() {
        return walk();
    }

    /**
     * Finds every node in this subtree of the given variant.
     *
     * @param nodeClass variant to match
     * @param <T> variant type
     * @return matching nodes in traversal order
     */
    public <T extends Node> List<T> findAll(Class<T> nodeClass) {
        return filter(walk(), nodeClass);
    }

    /**
     * Walks the subtree once and splits the result by variant.
     *
     * @param nodeClasses variants to match
     * @return one list per requested variant, in argument order
     */
    @SafeVarargs
    public final List<List<Node>> findAll(Class<? extends Node>... nodeClasses) {
        return split(walk(), nodeClasses);
    }

    /**
     * Renders this subtree as plain text.
     * @return canonical text rendering
     */
    public String toText() {
        return PlainTextRenderer.render(this);
    }

    final void assignIdentity(int assignedId, List<Integer> assignedPath, String assignedKind) {
        if (id != UNASSIGNED_ID) {
            throw new IllegalStateException("Node " + typeName() + " already has id " + id);
        }
        this.id = assignedId;
        this.path = List.copyOf(assignedPath);
        this.kind = assignedKind;
    }

    static <T extends Node> List<T> filter(List<Node> nodes, Class<T> nodeClass) {
        List<T> matches = new ArrayList<>();
        for (Node node : nodes) {
            if (nodeClass.isInstance(node)) {
                matches.add(nodeClass.cast(node));
            }
        }
        return matches;
    }

    static List<List<Node>> split(List<Node> nodes, Class<? extends Node>[] nodeClasses) {
        List<List<Node>> buckets = new ArrayList<>(nodeClasses.length);
        for (int bucketIndex = 0; bucketIndex < nodeClasses.length; bucketIndex++) {
            buckets.add(new ArrayList<>());
        }
        for (Node node : nodes) {
            for (int bucketIndex = 0; bucketIndex < nodeClasses.length; bucketIndex++) {
                if (nodeClasses[bucketIndex].isInstance(node)) {
                    buckets.get(bucketIndex).add(node);
                }
            }
        }
        return buckets;
    }

    private static void collect(Node node, List<Node> visited) {
        visited.add(node);
        for (Node child : node.children) {
            collect(child, visited);
        }
    }
}
