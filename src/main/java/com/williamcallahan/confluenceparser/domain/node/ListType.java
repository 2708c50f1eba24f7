package com.williamcallahan.confluenceparser.domain.node;

public enum ListType {
    ORDERED("ordered"),
    UNORDERED("unordered"),
    TASK("task-list");

    private final String identifier;

    ListType(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
