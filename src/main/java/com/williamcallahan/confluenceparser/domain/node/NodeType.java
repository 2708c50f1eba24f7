package com.williamcallahan.confluenceparser.domain.node;

/**
 * Discriminant of every concrete node variant.
 *
 * <p>Each constant carries the string identifier exposed as the node {@code type},
 * whether the variant lays out as a block, and the semantic kind it classifies to.
 * Panel macros are the one variant whose kind also depends on the macro name; see
 * {@link NodeKinds}.</p>
 */
public enum NodeType {
    TEXT("text", false, "text"),
    FRAGMENT("fragment", true, "fragment"),
    CONTAINER("container", true, "container"),
    PARAGRAPH("paragraph", true, "paragraph"),
    HEADING("heading", true, "heading"),
    TEXT_EFFECT("text_effect", false, "text_effect"),
    TEXT_BREAK("text_break", false, "text_break"),
    BLOCKQUOTE("blockquote", true, "blockquote"),
    LIST("list", true, "list"),
    LIST_ITEM("list_item", true, "list_item"),
    TABLE("table", true, "table"),
    TABLE_ROW("table_row", true, "table_row"),
    TABLE_CELL("table_cell", true, "table_cell"),
    LINK("link", false, "link"),
    RESOURCE_IDENTIFIER("resource_identifier", false, "resource_identifier"),
    IMAGE("image", false, "image"),
    EMOTICON("emoticon", false, "emoticon"),
    TIME("time", false, "date"),
    PLACEHOLDER("placeholder", false, "placeholder"),
    I18N("i18n", false, "i18n"),
    LAYOUT("layout", true, "layout"),
    LAYOUT_SECTION("layout_section", true, "layout_section"),
    LAYOUT_CELL("layout_cell", true, "layout_cell"),
    DECISION_LIST("decision_list", true, "decision_list"),
    DECISION_LIST_ITEM("decision_list_item", true, "decision_list_item"),
    STATUS_MACRO("status", false, "status"),
    PANEL_MACRO("panel", true, "macro:panel"),
    CODE_MACRO("code_block", true, "code_block"),
    EXPAND_MACRO("expand_macro", true, "macro:expand"),
    TOC_MACRO("toc_macro", true, "macro:toc"),
    DETAILS_MACRO("details_macro", true, "macro:details"),
    ATTACHMENTS_MACRO("attachments_macro", true, "macro:attachments"),
    JIRA_MACRO("jira_macro", false, "macro:jira"),
    PROFILE_MACRO("profile_macro", true, "macro:profile"),
    ANCHOR_MACRO("anchor_macro", false, "macro:anchor"),
    EXCERPT_MACRO("excerpt_macro", true, "macro:excerpt"),
    EXCERPT_INCLUDE_MACRO("excerpt_include_macro", true, "macro:excerpt_include"),
    INCLUDE_MACRO("include_macro", true, "macro:include"),
    VIEW_FILE_MACRO("view_file_macro", true, "macro:view_file"),
    VIEW_PDF_MACRO("view_pdf_macro", true, "macro:view_pdf"),
    GADGET_MACRO("gadget_macro", true, "macro:gadget"),
    PAGE_PROPERTIES_MACRO("page_properties_macro", true, "macro:page_properties"),
    PAGE_PROPERTIES_REPORT_MACRO("page_properties_report_macro", true, "macro:page_properties_report"),
    CHILDREN_DISPLAY_MACRO("children_display_macro", true, "macro:children_display"),
    TASKS_REPORT_MACRO("tasks_report_macro", true, "macro:tasks_report"),
    GENERIC_MACRO("macro", true, "macro");

    private final String identifier;
    private final boolean block;
    private final String defaultKind;

    NodeType(String identifier, boolean block, String defaultKind) {
        this.identifier = identifier;
        this.block = block;
        this.defaultKind = defaultKind;
    }

    /**
     * Gets the string identifier for this node type.
     * @return string identifier, e.g. {@code "heading"} or {@code "code_block"}
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Whether nodes of this type lay out as blocks unless the node overrides it.
     * @return true for block-level types
     */
    public boolean isBlock() {
        return block;
    }

    String defaultKind() {
        return defaultKind;
    }
}
