package com.williamcallahan.confluenceparser.domain;

import com.williamcallahan.confluenceparser.domain.node.Fragment;
import com.williamcallahan.confluenceparser.domain.node.IdentityAssigner;
import com.williamcallahan.confluenceparser.domain.node.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed storage-format document.
 *
 * <p>{@code content} holds the top-level nodes in source order. {@code root} consolidates
 * them: null when there are none, the node itself when there is exactly one, otherwise a
 * synthetic {@link Fragment}. Identity (ids, paths, kinds) is assigned across the tree
 * rooted at {@code root} when the document is assembled.</p>
 */
public final class StorageDocument {

    private final List<Node> content;
    private final Node root;
    private final DocumentMetadata metadata;

    private volatile String text;

    private StorageDocument(List<Node> content, Node root, DocumentMetadata metadata) {
        this.content = content;
        this.root = root;
        this.metadata = metadata;
    }

    /**
     * Builds a document from top-level nodes and assigns node identity.
     *
     * @param content top-level nodes in source order; nulls are skipped
     * @param diagnostics diagnostics recorded while parsing
     * @return assembled document
     */
    public static StorageDocument assemble(List<? extends Node> content, List<String> diagnostics) {
        Objects.requireNonNull(content, "Content cannot be null");
        List<Node> topLevel = new ArrayList<>(content.size());
        for (Node node : content) {
            if (node != null) {
                topLevel.add(node);
            }
        }
        Node root = switch (topLevel.size()) {
            case 0 -> null;
            case 1 -> topLevel.get(0);
            default -> new Fragment(topLevel);
        };
        IdentityAssigner.assign(root);
        return new StorageDocument(List.copyOf(topLevel), root, new DocumentMetadata(diagnostics));
    }

    /**
     * Gets a document without content or diagnostics.
     * @return empty document
     */
    public static StorageDocument empty() {
        return new StorageDocument(List.of(), null, DocumentMetadata.EMPTY);
    }

    public List<Node> content() {
        return content;
    }

    /**
     * Gets the consolidated root.
     * @return root node, or null for an empty document
     */
    public Node root() {
        return root;
    }

    public DocumentMetadata metadata() {
        return metadata;
    }

    public List<String> diagnostics() {
        return metadata.diagnostics();
    }

    /**
     * Gets the canonical plain-text rendering, computed on first access.
     * @return rendered text with surrounding whitespace stripped; empty for an empty document
     */
    public String text() {
        String rendered = text;
        if (rendered == null) {
            rendered = root == null ? "" : root.toText().strip();
            text = rendered;
        }
        return rendered;
    }

    /**
     * Lists every node in pre-order starting at the root.
     * @return all nodes, empty when the document has no root
     */
    public List<Node> walk() {
        return root == null ? List.of() : root.walk();
    }

    public List<Node> findAll() {
        return walk();
    }

    public <T extends Node> List<T> findAll(Class<T> nodeClass) {
        return root == null ? List.of() : root.findAll(nodeClass);
    }

    /**
     * Walks the document once and splits the nodes by variant.
     *
     * @param nodeClasses variants to match
     * @return one list per requested variant, in argument order
     */
    @SafeVarargs
    public final List<List<Node>> findAll(Class<? extends Node>... nodeClasses) {
        if (root == null) {
            List<List<Node>> buckets = new ArrayList<>(nodeClasses.length);
            for (int bucketIndex = 0; bucketIndex < nodeClasses.length; bucketIndex++) {
                buckets.add(List.of());
            }
            return buckets;
        }
        return root.findAll(nodeClasses);
    }
}
