package com.williamcallahan.confluenceparser.domain.node;

/**
 * Visual parameters of a panel macro.
 */
public record PanelStyle(
    String title,
    String bgColor,
    String borderStyle,
    String borderColor,
    String titleBgColor,
    String titleColor,
    String icon,
    String iconId,
    String iconText
) {

    public static final PanelStyle EMPTY = new PanelStyle(null, null, null, null, null, null, null, null, null);

    public static PanelStyle ofIconText(String iconText) {
        return new PanelStyle(null, null, null, null, null, null, null, null, iconText);
    }
}
