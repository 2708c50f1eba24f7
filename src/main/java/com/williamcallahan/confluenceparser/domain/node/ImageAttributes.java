package com.williamcallahan.confluenceparser.domain.node;

/**
 * Presentation attributes of an {@code ac:image}.
 */
public record ImageAttributes(
    String alt,
    String title,
    Integer width,
    Integer height,
    String align,
    String layout,
    Integer originalWidth,
    Integer originalHeight,
    Boolean customWidth,
    String src
) {

    public static final ImageAttributes EMPTY =
        new ImageAttributes(null, null, null, null, null, null, null, null, null, null);

    public static ImageAttributes ofAlt(String alt) {
        return new ImageAttributes(alt, null, null, null, null, null, null, null, null, null);
    }
}
