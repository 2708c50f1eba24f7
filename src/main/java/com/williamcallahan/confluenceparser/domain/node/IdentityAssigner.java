package com.williamcallahan.confluenceparser.domain.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns sequential ids, root-relative paths and semantic kinds to a freshly built tree.
 *
 * <p>Ids follow pre-order starting at zero for the root, so they increase in traversal
 * order. A tree can be assigned only once.</p>
 */
public final class IdentityAssigner {

    private int nextId;

    private IdentityAssigner() {}

    /**
     * Assigns identity to every node reachable from the root.
     *
     * @param root document root, may be null for an empty document
     * @return number of nodes assigned
     */
    public static int assign(Node root) {
        if (root == null) {
            return 0;
        }
        IdentityAssigner assigner = new IdentityAssigner();
        assigner.visit(root, new ArrayList<>());
        return assigner.nextId;
    }

    private void visit(Node node, List<Integer> path) {
        node.assignIdentity(nextId++, path, NodeKinds.classify(node));
        List<Node> children = node.children();
        for (int childIndex = 0; childIndex < children.size(); childIndex++) {
            path.add(childIndex);
            visit(children.get(childIndex), path);
            path.remove(path.size() - 1);
        }
    }
}
