package com.williamcallahan.confluenceparser.render;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.BlogPostReference;
import com.williamcallahan.confluenceparser.domain.link.ContentEntityReference;
import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import com.williamcallahan.confluenceparser.domain.link.ShortcutReference;
import com.williamcallahan.confluenceparser.domain.link.SpaceReference;
import com.williamcallahan.confluenceparser.domain.link.UrlReference;
import com.williamcallahan.confluenceparser.domain.link.UserReference;
import com.williamcallahan.confluenceparser.domain.node.AnchorMacro;
import com.williamcallahan.confluenceparser.domain.node.AttachmentsMacro;
import com.williamcallahan.confluenceparser.domain.node.BlockquoteElement;
import com.williamcallahan.confluenceparser.domain.node.CodeMacro;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItem;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItemState;
import com.williamcallahan.confluenceparser.domain.node.Emoticon;
import com.williamcallahan.confluenceparser.domain.node.ExcerptIncludeMacro;
import com.williamcallahan.confluenceparser.domain.node.ExpandMacro;
import com.williamcallahan.confluenceparser.domain.node.GadgetMacro;
import com.williamcallahan.confluenceparser.domain.node.GenericMacro;
import com.williamcallahan.confluenceparser.domain.node.I18nElement;
import com.williamcallahan.confluenceparser.domain.node.Image;
import com.williamcallahan.confluenceparser.domain.node.IncludeMacro;
import com.williamcallahan.confluenceparser.domain.node.JiraMacro;
import com.williamcallahan.confluenceparser.domain.node.LinkElement;
import com.williamcallahan.confluenceparser.domain.node.ListElement;
import com.williamcallahan.confluenceparser.domain.node.ListItem;
import com.williamcallahan.confluenceparser.domain.node.ListType;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.domain.node.PagePropertiesReportMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacroType;
import com.williamcallahan.confluenceparser.domain.node.PlaceholderElement;
import com.williamcallahan.confluenceparser.domain.node.ProfileMacro;
import com.williamcallahan.confluenceparser.domain.node.ResourceIdentifier;
import com.williamcallahan.confluenceparser.domain.node.StatusMacro;
import com.williamcallahan.confluenceparser.domain.node.TableCell;
import com.williamcallahan.confluenceparser.domain.node.TableRow;
import com.williamcallahan.confluenceparser.domain.node.TasksReportMacro;
import com.williamcallahan.confluenceparser.domain.node.TaskListItemStatus;
import com.williamcallahan.confluenceparser.domain.node.Text;
import com.williamcallahan.confluenceparser.domain.node.TextBreakElement;
import com.williamcallahan.confluenceparser.domain.node.TextBreakType;
import com.williamcallahan.confluenceparser.domain.node.Time;
import com.williamcallahan.confluenceparser.domain.node.ViewFileMacro;
import com.williamcallahan.confluenceparser.domain.node.ViewPdfMacro;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node subtree as canonical plain text.
 *
 * <p>Block children are stripped and separated by a blank line; inline children
 * concatenate as is. Lists, tables, macros and resource identifiers use fixed
 * templates with emoji labels. Rendering is a pure function of the subtree.</p>
 */
public final class PlainTextRenderer {

    private static final String BLOCK_SEPARATOR = "\n\n";
    private static final String INDENT = "  ";

    private PlainTextRenderer() {
        // Utility class - no instantiation
    }

    /**
     * Renders a node and its descendants.
     * @param node node to render
     * @return plain text, possibly empty
     */
    public static String render(Node node) {
        return switch (node.type()) {
            case TEXT -> ((Text) node).text();
            case FRAGMENT, CONTAINER, LAYOUT, LAYOUT_SECTION, LAYOUT_CELL, TEXT_EFFECT, TABLE_CELL ->
                joinChildren(node.children(), BLOCK_SEPARATOR);
            case PARAGRAPH, HEADING -> joinChildren(node.children(), BLOCK_SEPARATOR).strip();
            case TEXT_BREAK -> ((TextBreakElement) node).breakType() == TextBreakType.HORIZONTAL_RULE ? "---" : "\n";
            case BLOCKQUOTE -> blockquote((BlockquoteElement) node);
            case LIST -> list((ListElement) node, 1);
            case LIST_ITEM -> listItem((ListItem) node, null, 1, 1);
            case TABLE -> table(node);
            case TABLE_ROW -> tableRow((TableRow) node);
            case LINK -> link((LinkElement) node);
            case RESOURCE_IDENTIFIER -> resourceIdentifier(((ResourceIdentifier) node).reference());
            case IMAGE -> image((Image) node);
            case EMOTICON -> emoticon((Emoticon) node);
            case TIME -> {
                String datetime = ((Time) node).datetime();
                yield isBlank(datetime) ? "📅 Date" : "📅 " + datetime;
            }
            case PLACEHOLDER -> labelled("📝", "Placeholder", ((PlaceholderElement) node).text());
            case I18N -> i18n((I18nElement) node);
            case DECISION_LIST -> decisionList(node);
            case DECISION_LIST_ITEM -> decisionItem((DecisionListItem) node);
            case STATUS_MACRO -> status((StatusMacro) node);
            case PANEL_MACRO -> panel((PanelMacro) node);
            case CODE_MACRO -> code((CodeMacro) node);
            case EXPAND_MACRO -> expand((ExpandMacro) node);
            case TOC_MACRO -> "📑 Table of Contents";
            case DETAILS_MACRO -> withContent("📋 Details", ": ", node);
            case ATTACHMENTS_MACRO -> withValue("📎 Attachments", ((AttachmentsMacro) node).patterns());
            case JIRA_MACRO -> jira((JiraMacro) node);
            case PROFILE_MACRO -> profile((ProfileMacro) node);
            case ANCHOR_MACRO -> labelled("⚓", "Anchor", ((AnchorMacro) node).anchorName());
            case EXCERPT_MACRO -> withContent("📄 Excerpt", ": ", node);
            case EXCERPT_INCLUDE_MACRO -> excerptInclude((ExcerptIncludeMacro) node);
            case INCLUDE_MACRO -> include((IncludeMacro) node);
            case VIEW_FILE_MACRO -> {
                String filename = ((ViewFileMacro) node).filename();
                yield filename == null ? "📁 File Viewer" : "📁 File: " + filename;
            }
            case VIEW_PDF_MACRO -> {
                String filename = ((ViewPdfMacro) node).filename();
                yield filename == null ? "📄 PDF Viewer" : "📄 PDF: " + filename;
            }
            case GADGET_MACRO -> labelled("🧩", "Gadget", ((GadgetMacro) node).url());
            case PAGE_PROPERTIES_MACRO -> withContent("📋 Page Properties", "\n", node);
            case PAGE_PROPERTIES_REPORT_MACRO ->
                withValue("📊 Page Properties Report", ((PagePropertiesReportMacro) node).labels());
            case CHILDREN_DISPLAY_MACRO -> "📂 Child Pages";
            case TASKS_REPORT_MACRO -> {
                String spaces = ((TasksReportMacro) node).spaces();
                yield isBlank(spaces) ? "📊 Tasks Report" : "📊 Tasks Report: " + spaces;
            }
            case GENERIC_MACRO -> genericMacro((GenericMacro) node);
        };
    }

    /**
     * Joins rendered children. Inline runs concatenate; when block children are present,
     * every block and every non-blank inline run is stripped and separated by {@code separator}.
     */
    private static String joinChildren(List<Node> children, String separator) {
        boolean hasBlock = false;
        for (Node child : children) {
            if (child.isBlock()) {
                hasBlock = true;
                break;
            }
        }
        if (!hasBlock) {
            StringBuilder inline = new StringBuilder();
            for (Node child : children) {
                inline.append(render(child));
            }
            return inline.toString();
        }
        List<String> parts = new ArrayList<>();
        StringBuilder inline = new StringBuilder();
        for (Node child : children) {
            if (child.isBlock()) {
                flushInline(inline, parts);
                addPart(parts, render(child), child instanceof ListElement);
            } else {
                inline.append(render(child));
            }
        }
        flushInline(inline, parts);
        return String.join(separator, parts);
    }

    private static void flushInline(StringBuilder inline, List<String> parts) {
        addPart(parts, inline.toString(), false);
        inline.setLength(0);
    }

    /** Lists keep their leading indentation so nested items stay aligned. */
    private static void addPart(List<String> parts, String rendered, boolean keepIndent) {
        String part = keepIndent ? rendered.stripTrailing() : rendered.strip();
        if (!part.isBlank()) {
            parts.add(part);
        }
    }

    private static String blockquote(BlockquoteElement blockquote) {
        String content = joinChildren(blockquote.children(), BLOCK_SEPARATOR).strip();
        if (content.isEmpty()) {
            return "";
        }
        List<String> quoted = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            quoted.add("> " + line);
        }
        return String.join("\n", quoted);
    }

    private static String list(ListElement list, int fallbackDepth) {
        List<String> lines = new ArrayList<>();
        int start = list.start() == null ? 1 : list.start();
        int position = 0;
        for (Node child : list.children()) {
            if (child instanceof ListItem item) {
                lines.add(listItem(item, list.listType(), start + position, fallbackDepth));
                position++;
            } else if (child instanceof ListElement nested) {
                addPart(lines, list(nested, fallbackDepth + 1), true);
            } else {
                addPart(lines, render(child), false);
            }
        }
        return String.join("\n", lines);
    }

    private static String listItem(ListItem item, ListType listType, int number, int fallbackDepth) {
        Integer scopedDepth = item.scope().listDepth();
        int depth = scopedDepth == null ? fallbackDepth : scopedDepth;
        String indent = INDENT.repeat(Math.max(0, depth - 1));
        return indent + marker(listType, item.status(), number) + itemBody(item, depth);
    }

    private static String marker(ListType listType, TaskListItemStatus status, int number) {
        if (listType == ListType.ORDERED) {
            return number + ". ";
        }
        if (status == TaskListItemStatus.COMPLETE) {
            return "✓ ";
        }
        if (status == TaskListItemStatus.INCOMPLETE) {
            return "○ ";
        }
        return "• ";
    }

    /** Item content on the first line, nested lists and further blocks on their own lines. */
    private static String itemBody(ListItem item, int depth) {
        List<String> parts = new ArrayList<>();
        StringBuilder inline = new StringBuilder();
        for (Node child : item.children()) {
            if (child instanceof ListElement nested) {
                flushInline(inline, parts);
                addPart(parts, list(nested, depth + 1), true);
            } else if (child.isBlock()) {
                flushInline(inline, parts);
                addPart(parts, render(child), false);
            } else {
                inline.append(render(child));
            }
        }
        flushInline(inline, parts);
        return String.join("\n", parts);
    }

    private static String table(Node table) {
        List<String> lines = new ArrayList<>();
        for (Node child : table.children()) {
            String rendered = child instanceof TableRow row ? tableRow(row) : render(child).strip();
            if (!rendered.isEmpty()) {
                lines.add(rendered);
            }
        }
        return String.join("\n", lines);
    }

    private static String tableRow(TableRow row) {
        List<String> cells = new ArrayList<>();
        for (Node child : row.children()) {
            if (child instanceof TableCell) {
                cells.add(joinChildren(child.children(), " ").strip());
            }
        }
        if (cells.isEmpty()) {
            return "";
        }
        return String.join(" | ", cells);
    }

    private static String link(LinkElement link) {
        List<String> identifiers = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        for (Node child : link.children()) {
            if (child instanceof ResourceIdentifier) {
                String rendered = render(child).strip();
                if (!rendered.isEmpty()) {
                    identifiers.add(rendered);
                }
            } else {
                body.append(render(child));
            }
        }
        String identifierText = String.join(" ", identifiers);
        String bodyText = body.toString().strip();
        if (!identifierText.isEmpty() && !bodyText.isEmpty()) {
            return identifierText + " " + bodyText;
        }
        if (!identifierText.isEmpty()) {
            return identifierText;
        }
        if (!bodyText.isEmpty()) {
            return bodyText;
        }
        return link.href() == null ? "" : link.href();
    }

    private static String resourceIdentifier(ResourceReference reference) {
        if (reference == null) {
            return "";
        }
        return switch (reference.kind()) {
            case PAGE -> "📄 Page";
            case BLOG_POST -> labelled("📝", "Blog", ((BlogPostReference) reference).postingDay());
            case ATTACHMENT -> labelled("📎", "Attachment", ((AttachmentReference) reference).filename());
            case URL -> labelled("🔗", "URL", ((UrlReference) reference).value());
            case USER -> {
                UserReference user = (UserReference) reference;
                yield labelled("👤", "User", !isBlank(user.accountId()) ? user.accountId() : user.userkey());
            }
            case SPACE -> labelled("🏠", "Space", ((SpaceReference) reference).spaceKey());
            case SHORTCUT -> labelled("🔗", "Shortcut", shortcutTarget((ShortcutReference) reference));
            case CONTENT_ENTITY -> labelled("📄", "Content", ((ContentEntityReference) reference).contentId());
        };
    }

    private static String shortcutTarget(ShortcutReference shortcut) {
        if (isBlank(shortcut.key())) {
            return shortcut.parameter();
        }
        return isBlank(shortcut.parameter()) ? shortcut.key() : shortcut.key() + "@" + shortcut.parameter();
    }

    private static String image(Image image) {
        String label = firstPresent(image.alt(), image.title(), image.filename(),
            image.url() == null ? null : image.url().value(), image.src());
        String text = "🖼️ Image: " + (label == null ? "Unknown" : label);
        String caption = joinChildren(image.children(), " ").strip();
        return caption.isEmpty() ? text : text + " - " + caption;
    }

    private static String emoticon(Emoticon emoticon) {
        if (!isBlank(emoticon.fallback())) {
            return emoticon.fallback();
        }
        if (!isBlank(emoticon.shortname())) {
            return emoticon.shortname();
        }
        return isBlank(emoticon.name()) ? "" : ":" + emoticon.name() + ":";
    }

    private static String i18n(I18nElement element) {
        return isBlank(element.key()) ? "🌐" : "🌐 " + element.key();
    }

    private static String decisionList(Node decisionList) {
        List<String> lines = new ArrayList<>();
        for (Node child : decisionList.children()) {
            String rendered = render(child).strip();
            if (!rendered.isEmpty()) {
                lines.add(rendered);
            }
        }
        return lines.isEmpty() ? "📋 Decision List" : String.join("\n", lines);
    }

    private static String decisionItem(DecisionListItem item) {
        String glyph = item.state() == DecisionListItemState.DECIDED ? "✅" : "⏳";
        String content = joinChildren(item.children(), " ").strip();
        return content.isEmpty() ? glyph : glyph + " " + content;
    }

    private static String status(StatusMacro status) {
        String text = "🏷️ Status: " + (isBlank(status.title()) ? "Status" : status.title());
        return isBlank(status.colour()) ? text : text + " (" + status.colour() + ")";
    }

    private static String panel(PanelMacro panel) {
        String iconText = panel.style().iconText();
        String header;
        if (panel.panelType() == PanelMacroType.PANEL && !isBlank(iconText)) {
            header = iconText;
        } else {
            header = panel.panelType().getIcon() + " " + panel.panelType().name();
        }
        String content = joinChildren(panel.children(), BLOCK_SEPARATOR).strip();
        return content.isEmpty() ? header : header + ": " + content;
    }

    private static String code(CodeMacro code) {
        String language = isBlank(code.language()) ? "" : code.language();
        return "```" + language + "\n" + trimBlankLines(code.code()) + "\n```";
    }

    /** Drops blank lines before the first and after the last line of code, keeping indentation. */
    private static String trimBlankLines(String code) {
        if (code == null) {
            return "";
        }
        String[] lines = code.split("\n", -1);
        int first = 0;
        int last = lines.length - 1;
        while (first <= last && lines[first].isBlank()) {
            first++;
        }
        while (last >= first && lines[last].isBlank()) {
            last--;
        }
        List<String> kept = new ArrayList<>();
        for (int lineIndex = first; lineIndex <= last; lineIndex++) {
            kept.add(lines[lineIndex].stripTrailing());
        }
        return String.join("\n", kept);
    }

    private static String expand(ExpandMacro expand) {
        String header = "▶ " + (isBlank(expand.title()) ? "Expand" : expand.title());
        String content = joinChildren(expand.children(), BLOCK_SEPARATOR).strip();
        return content.isEmpty() ? header : header + "\n" + content;
    }

    private static String jira(JiraMacro jira) {
        if (isBlank(jira.key())) {
            return "🎫 JIRA Issue";
        }
        String server = jira.server();
        if (isBlank(server) || JiraMacro.SYSTEM_SERVER.equals(server)) {
            return "🎫 " + jira.key();
        }
        return "🎫 " + jira.key() + " (" + server + ")";
    }

    private static String profile(ProfileMacro profile) {
        String accountId = profile.accountId();
        return isBlank(accountId) ? "👤 User Profile" : "👤 Profile: " + accountId;
    }

    private static String excerptInclude(ExcerptIncludeMacro excerptInclude) {
        String title = excerptInclude.contentTitle();
        if (isBlank(title)) {
            return "📝 Excerpt Include";
        }
        String postingDay = excerptInclude.postingDay();
        return isBlank(postingDay) ? "📝 Excerpt: " + title : "📝 Excerpt: " + title + " (" + postingDay + ")";
    }

    private static String include(IncludeMacro include) {
        String title = include.contentTitle();
        return isBlank(title) ? "📄 Include Page" : "📄 Include: " + title;
    }

    private static String genericMacro(GenericMacro macro) {
        String header = "⚙️ Macro: " + macro.macroName();
        String content = joinChildren(macro.children(), BLOCK_SEPARATOR).strip();
        if (content.isEmpty() && macro.plainTextBody() != null) {
            content = macro.plainTextBody().strip();
        }
        return content.isEmpty() ? header : header + "\n" + content;
    }

    private static String withContent(String header, String separator, Node macro) {
        String content = joinChildren(macro.children(), BLOCK_SEPARATOR).strip();
        return content.isEmpty() ? header : header + separator + content;
    }

    private static String withValue(String header, String value) {
        return isBlank(value) ? header : header + ": " + value;
    }

    private static String labelled(String icon, String label, String value) {
        String header = icon + " " + label;
        return isBlank(value) ? header : header + ": " + value;
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (!isBlank(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
