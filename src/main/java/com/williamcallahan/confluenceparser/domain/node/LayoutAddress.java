package com.williamcallahan.confluenceparser.domain.node;

/**
 * Position of a layout cell: the section's index within its layout and the cell's
 * index within that section.
 */
public record LayoutAddress(int sectionIndex, int cellIndex) {

    public LayoutAddress {
        if (sectionIndex < 0) {
            throw new IllegalArgumentException("Section index must be non-negative");
        }
        if (cellIndex < 0) {
            throw new IllegalArgumentException("Cell index must be non-negative");
        }
    }
}
