package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Report aggregating page properties across pages matching labels or CQL.
 */
public final class PagePropertiesReportMacro extends MacroNode {

    private final String labels;
    private final String spaceKey;
    private final String cql;
    private final Integer pageSize;
    private final String sortBy;
    private final String headings;

    public PagePropertiesReportMacro(MacroDescriptor descriptor, String labels, String spaceKey, String cql,
            Integer pageSize, String sortBy, String headings, NodeScope scope) {
        super(NodeType.PAGE_PROPERTIES_REPORT_MACRO, descriptor, List.of(), scope);
        this.labels = labels;
        this.spaceKey = spaceKey;
        this.cql = cql;
        this.pageSize = pageSize;
        this.sortBy = sortBy;
        this.headings = headings;
    }

    public String labels() {
        return labels;
    }

    public String spaceKey() {
        return spaceKey;
    }

    public String cql() {
        return cql;
    }

    public Integer pageSize() {
        return pageSize;
    }

    public String sortBy() {
        return sortBy;
    }

    public String headings() {
        return headings;
    }
}
