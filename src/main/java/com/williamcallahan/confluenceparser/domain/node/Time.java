package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class Time extends Node {

    private final String datetime;

    public Time(String datetime, NodeScope scope) {
        super(NodeType.TIME, List.of(), scope);
        this.datetime = datetime;
    }

    public Time(String datetime) {
        this(datetime, NodeScope.NONE);
    }

    public String datetime() {
        return datetime;
    }
}
