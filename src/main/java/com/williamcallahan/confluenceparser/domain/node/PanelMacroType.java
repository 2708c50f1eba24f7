package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;

/**
 * Semantic flavour of a panel, which selects its icon and label.
 */
public enum PanelMacroType {
    INFO("ℹ️"),
    NOTE("📝"),
    SUCCESS("✅"),
    WARNING("⚠️"),
    ERROR("❌"),
    PANEL("📋");

    private final String icon;

    PanelMacroType(String icon) {
        this.icon = icon;
    }

    public String getIcon() {
        return icon;
    }

    /**
     * Maps a storage-format macro name to a panel type.
     *
     * <p>The notification macros do not map onto their literal names: {@code tip} is a
     * success panel, {@code note} a warning, {@code warning} an error.</p>
     *
     * @param macroName macro name such as {@code "tip"}
     * @return panel type, {@link #PANEL} for anything unrecognized
     */
    public static PanelMacroType fromMacroName(String macroName) {
        if (macroName == null) {
            return PANEL;
        }
        return switch (AsciiTextNormalizer.toLowerAscii(macroName)) {
            case "info" -> INFO;
            case "tip" -> SUCCESS;
            case "note" -> WARNING;
            case "warning" -> ERROR;
            default -> PANEL;
        };
    }

    /**
     * Maps an embedded ADF {@code panel-type} attribute to a panel type.
     * @param panelType attribute value such as {@code "note"}
     * @return panel type, {@link #PANEL} for anything unrecognized
     */
    public static PanelMacroType fromAdfPanelType(String panelType) {
        if (panelType == null) {
            return PANEL;
        }
        return switch (AsciiTextNormalizer.toLowerAscii(panelType)) {
            case "info" -> INFO;
            case "note" -> NOTE;
            case "success" -> SUCCESS;
            case "warning" -> WARNING;
            case "error" -> ERROR;
            default -> PANEL;
        };
    }
}
