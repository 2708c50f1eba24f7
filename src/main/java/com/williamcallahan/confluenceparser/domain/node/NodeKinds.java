package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;
import java.util.Set;

/**
 * Maps node types (and, for panels, macro names) to coarse semantic kinds.
 */
public final class NodeKinds {

    public static final String NOTIFICATION_KIND = "macro:notification";

    private static final Set<String> NOTIFICATION_MACROS = Set.of("info", "note", "tip", "warning");

    private NodeKinds() {}

    /**
     * Classifies a node type.
     *
     * @param type node type
     * @param macroName macro name for macro nodes, null otherwise
     * @return semantic kind
     */
    public static String classify(NodeType type, String macroName) {
        if (type == NodeType.PANEL_MACRO && macroName != null
                && NOTIFICATION_MACROS.contains(AsciiTextNormalizer.toLowerAscii(macroName))) {
            return NOTIFICATION_KIND;
        }
        return type.defaultKind();
    }

    static String classify(Node node) {
        String macroName = node instanceof MacroNode macro ? macro.macroName() : null;
        return classify(node.type(), macroName);
    }
}
