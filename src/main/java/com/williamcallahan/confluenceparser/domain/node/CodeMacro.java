package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Code block; the source text comes verbatim from the plain-text body.
 */
public final class CodeMacro extends MacroNode {

    private final String language;
    private final String title;
    private final String code;
    private final Boolean lineNumbers;
    private final String theme;
    private final Boolean collapse;

    public CodeMacro(MacroDescriptor descriptor, String language, String title, String code, Boolean lineNumbers,
            String theme, Boolean collapse, NodeScope scope) {
        super(NodeType.CODE_MACRO, descriptor, List.of(), scope);
        this.language = language;
        this.title = title;
        this.code = code == null ? "" : code;
        this.lineNumbers = lineNumbers;
        this.theme = theme;
        this.collapse = collapse;
    }

    public CodeMacro(String language, String code) {
        this(MacroDescriptor.of("code"), language, null, code, null, null, null, NodeScope.NONE);
    }

    public String language() {
        return language;
    }

    public String title() {
        return title;
    }

    public String code() {
        return code;
    }

    public Boolean lineNumbers() {
        return lineNumbers;
    }

    public String theme() {
        return theme;
    }

    public Boolean collapse() {
        return collapse;
    }
}
