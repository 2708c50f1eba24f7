package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Jira issue or JQL query embed.
 */
public final class JiraMacro extends MacroNode {

    /** Server name Confluence writes for the built-in application link. */
    public static final String SYSTEM_SERVER = "System Jira";

    private final String key;
    private final String server;
    private final String serverId;
    private final String jqlQuery;
    private final Integer maximumIssues;

    public JiraMacro(MacroDescriptor descriptor, String key, String server, String serverId, String jqlQuery,
            Integer maximumIssues, NodeScope scope) {
        super(NodeType.JIRA_MACRO, descriptor, List.of(), scope);
        this.key = key;
        this.server = server;
        this.serverId = serverId;
        this.jqlQuery = jqlQuery;
        this.maximumIssues = maximumIssues;
    }

    public JiraMacro(String key, String server) {
        this(MacroDescriptor.of("jira"), key, server, null, null, null, NodeScope.NONE);
    }

    public String key() {
        return key;
    }

    public String server() {
        return server;
    }

    public String serverId() {
        return serverId;
    }

    public String jqlQuery() {
        return jqlQuery;
    }

    public Integer maximumIssues() {
        return maximumIssues;
    }
}
