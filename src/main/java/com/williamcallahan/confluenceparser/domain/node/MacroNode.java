package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of structured macro nodes ({@code ac:structured-macro} / {@code ac:macro}).
 *
 * <p>Every macro keeps its {@link MacroDescriptor} so callers can reach parameters the
 * typed subclass does not model.</p>
 */
public abstract sealed class MacroNode extends Node
    permits StatusMacro, PanelMacro, CodeMacro, ExpandMacro, TocMacro, DetailsMacro, AttachmentsMacro,
        JiraMacro, ProfileMacro, AnchorMacro, ExcerptMacro, ExcerptIncludeMacro, IncludeMacro,
        ViewFileMacro, ViewPdfMacro, GadgetMacro, PagePropertiesMacro, PagePropertiesReportMacro,
        ChildrenDisplayMacro, TasksReportMacro, GenericMacro {

    private final MacroDescriptor descriptor;

    protected MacroNode(NodeType type, MacroDescriptor descriptor, List<? extends Node> children, NodeScope scope) {
        super(type, children, scope);
        this.descriptor = Objects.requireNonNull(descriptor, "Macro descriptor cannot be null");
    }

    public MacroDescriptor descriptor() {
        return descriptor;
    }

    public String macroName() {
        return descriptor.name();
    }

    public String macroId() {
        return descriptor.macroId();
    }

    public String localId() {
        return descriptor.localId();
    }

    public Map<String, String> parameters() {
        return descriptor.parameters();
    }
}
