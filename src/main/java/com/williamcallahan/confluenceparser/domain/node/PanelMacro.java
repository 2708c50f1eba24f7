package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Objects;

/**
 * Boxed content: the generic {@code panel} macro, the notification macros
 * ({@code info}, {@code note}, {@code tip}, {@code warning}) and embedded ADF panels.
 */
public final class PanelMacro extends MacroNode {

    private final PanelMacroType panelType;
    private final String macroType;
    private final PanelStyle style;

    /**
     * Creates a panel.
     *
     * @param descriptor macro identity and raw parameters
     * @param panelType semantic flavour
     * @param macroType source macro name, e.g. {@code "tip"}
     * @param style visual parameters
     * @param children panel body
     * @param scope construction scope
     */
    public PanelMacro(MacroDescriptor descriptor, PanelMacroType panelType, String macroType, PanelStyle style,
            List<? extends Node> children, NodeScope scope) {
        super(NodeType.PANEL_MACRO, descriptor, children, scope);
        this.panelType = Objects.requireNonNull(panelType, "Panel type cannot be null");
        this.macroType = macroType;
        this.style = style == null ? PanelStyle.EMPTY : style;
    }

    public PanelMacro(PanelMacroType panelType, PanelStyle style, List<? extends Node> children) {
        this(MacroDescriptor.of("panel"), panelType, "panel", style, children, NodeScope.NONE);
    }

    public PanelMacroType panelType() {
        return panelType;
    }

    public String macroType() {
        return macroType;
    }

    public PanelStyle style() {
        return style;
    }

    public String title() {
        return style.title();
    }
}
