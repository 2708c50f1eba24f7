package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class TasksReportMacro extends MacroNode {

    private final String spaces;
    private final String labels;
    private final String status;
    private final String assignees;
    private final Integer pageSize;
    private final Boolean missingRequiredParameters;

    public TasksReportMacro(MacroDescriptor descriptor, String spaces, String labels, String status,
            String assignees, Integer pageSize, Boolean missingRequiredParameters, NodeScope scope) {
        super(NodeType.TASKS_REPORT_MACRO, descriptor, List.of(), scope);
        this.spaces = spaces;
        this.labels = labels;
        this.status = status;
        this.assignees = assignees;
        this.pageSize = pageSize;
        this.missingRequiredParameters = missingRequiredParameters;
    }

    public TasksReportMacro(String spaces) {
        this(MacroDescriptor.of("tasks-report-macro"), spaces, null, null, null, null, null, NodeScope.NONE);
    }

    public String spaces() {
        return spaces;
    }

    public String labels() {
        return labels;
    }

    public String status() {
        return status;
    }

    public String assignees() {
        return assignees;
    }

    public Integer pageSize() {
        return pageSize;
    }

    public Boolean isMissingRequiredParameters() {
        return missingRequiredParameters;
    }
}
