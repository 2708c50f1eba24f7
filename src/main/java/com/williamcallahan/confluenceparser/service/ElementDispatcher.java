package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.Link;
import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import com.williamcallahan.confluenceparser.domain.link.UrlReference;
import com.williamcallahan.confluenceparser.domain.node.BlockquoteElement;
import com.williamcallahan.confluenceparser.domain.node.ContainerElement;
import com.williamcallahan.confluenceparser.domain.node.Emoticon;
import com.williamcallahan.confluenceparser.domain.node.HeadingElement;
import com.williamcallahan.confluenceparser.domain.node.I18nElement;
import com.williamcallahan.confluenceparser.domain.node.Image;
import com.williamcallahan.confluenceparser.domain.node.ImageAttributes;
import com.williamcallahan.confluenceparser.domain.node.LayoutCell;
import com.williamcallahan.confluenceparser.domain.node.LayoutElement;
import com.williamcallahan.confluenceparser.domain.node.LayoutSection;
import com.williamcallahan.confluenceparser.domain.node.LinkElement;
import com.williamcallahan.confluenceparser.domain.node.LinkType;
import com.williamcallahan.confluenceparser.domain.node.ListElement;
import com.williamcallahan.confluenceparser.domain.node.ListItem;
import com.williamcallahan.confluenceparser.domain.node.ListType;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.domain.node.Paragraph;
import com.williamcallahan.confluenceparser.domain.node.PlaceholderElement;
import com.williamcallahan.confluenceparser.domain.node.ResourceIdentifier;
import com.williamcallahan.confluenceparser.domain.node.Table;
import com.williamcallahan.confluenceparser.domain.node.TableCell;
import com.williamcallahan.confluenceparser.domain.node.TableRow;
import com.williamcallahan.confluenceparser.domain.node.TaskListItemStatus;
import com.williamcallahan.confluenceparser.domain.node.Text;
import com.williamcallahan.confluenceparser.domain.node.TextBreakElement;
import com.williamcallahan.confluenceparser.domain.node.TextBreakType;
import com.williamcallahan.confluenceparser.domain.node.TextEffectElement;
import com.williamcallahan.confluenceparser.domain.node.TextEffectType;
import com.williamcallahan.confluenceparser.domain.node.Time;
import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;
import com.williamcallahan.confluenceparser.support.AttributeValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks one ingested element tree and builds document nodes from it.
 *
 * <p>Elements are matched by local name against a fixed registry. Structured macros go to
 * {@link MacroDispatcher}, extension wrappers to {@link AdfBridge}. Elements outside the
 * registry record {@code unknown_element:<tag>} and are dropped with their subtree.
 * An instance belongs to a single parse.</p>
 */
final class ElementDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ElementDispatcher.class);

    private static final String AC = "ac";
    private static final String RI = "ri";

    /** Structural wrappers whose children are lifted into the parent. */
    private static final Set<String> UNWRAPPED_TAGS = Set.of(
        "thead", "tbody", "tfoot", "root", "inline-comment-marker");

    /** Tags consumed without a node or a diagnostic. */
    private static final Set<String> IGNORED_TAGS = Set.of("colgroup", "col");

    private static final Set<String> CONTAINER_TAGS = Set.of(
        "div", "span", "section", "article", "center", "font", "small", "big", "mark", "main",
        "figure", "figcaption", "rich-text-body", "caption", "content", "adf-fallback", "adf-content");

    private final ParseDiagnostics diagnostics;
    private final MacroDispatcher macroDispatcher;
    private final AdfBridge adfBridge;

    ElementDispatcher(ParseDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.macroDispatcher = new MacroDispatcher(this, diagnostics);
        this.adfBridge = new AdfBridge(this, diagnostics);
    }

    /**
     * Parses the child nodes of an element in document order.
     *
     * @param parent element whose children are read
     * @param context recursion state for the children
     * @return nodes built from child text and elements
     */
    List<Node> parseChildren(Element parent, ParseContext context) {
        return parseNodes(parent.childNodes(), context);
    }

    /**
     * Parses sibling markup nodes. Whitespace-only text spanning a line break is layout and
     * is dropped, except between two inline siblings where it becomes a single space.
     */
    private List<Node> parseNodes(List<org.jsoup.nodes.Node> siblings, ParseContext context) {
        List<Node> out = new ArrayList<>();
        boolean pendingSpace = false;
        for (org.jsoup.nodes.Node child : siblings) {
            int start = out.size();
            if (child instanceof TextNode textNode) {
                String raw = textNode.getWholeText();
                if (isLayoutWhitespace(raw, context)) {
                    pendingSpace = !out.isEmpty() && flowsInline(out.get(out.size() - 1));
                    continue;
                }
                Text text = textLeaf(raw, context);
                if (text != null) {
                    out.add(text);
                }
            } else if (child instanceof Element element) {
                dispatch(element, context, out);
            }
            if (out.size() > start) {
                if (pendingSpace && flowsInline(out.get(start))) {
                    out.add(start, new Text(" ", context.scope()));
                }
                pendingSpace = false;
            }
        }
        return out;
    }

    private static boolean isLayoutWhitespace(String raw, ParseContext context) {
        return !context.preformatted() && !raw.isEmpty() && raw.isBlank() && raw.indexOf('\n') >= 0;
    }

    private static boolean flowsInline(Node node) {
        return !node.isBlock() && !(node instanceof TextBreakElement);
    }

    /**
     * Builds the nodes for one element and appends them to {@code out}.
     * Unwrapped elements may append several nodes; dropped elements append none.
     */
    void dispatch(Element element, ParseContext context, List<Node> out) {
        String tag = MarkupElements.localName(element);
        if (UNWRAPPED_TAGS.contains(tag)) {
            out.addAll(parseChildren(element, context));
            return;
        }
        if (IGNORED_TAGS.contains(tag)) {
            return;
        }
        Node node = build(tag, element, context);
        if (node != null) {
            out.add(node);
        }
    }

    private Node build(String tag, Element element, ParseContext context) {
        Node registered = switch (tag) {
            case "p" -> new Paragraph(parseChildren(element, context), context.scope());
            case "h1", "h2", "h3", "h4", "h5", "h6" ->
                new HeadingElement(tag.charAt(1) - '0', parseChildren(element, context), context.scope());
            case "blockquote" -> new BlockquoteElement(parseChildren(element, context), context.scope());
            case "hr" -> new TextBreakElement(TextBreakType.HORIZONTAL_RULE, context.scope());
            case "br" -> new TextBreakElement(TextBreakType.LINE_BREAK, context.scope());
            case "ul" -> new ListElement(ListType.UNORDERED, null, null, parseChildren(element, context),
                context.scope());
            case "ol" -> new ListElement(ListType.ORDERED,
                AttributeValues.parseInteger(MarkupElements.attribute(element, null, "start")), null,
                parseChildren(element, context), context.scope());
            case "li" -> listItem(element, context);
            case "table" -> new Table(parseChildren(element, context), context.scope());
            case "tr" -> new TableRow(parseChildren(element, context), context.scope());
            case "th", "td" -> new TableCell("th".equals(tag),
                AttributeValues.parseInteger(MarkupElements.attribute(element, null, "rowspan")),
                AttributeValues.parseInteger(MarkupElements.attribute(element, null, "colspan")),
                parseChildren(element, context), context.scope());
            case "pre" -> new TextEffectElement(TextEffectType.PREFORMATTED,
                parseChildren(element, context.enterPreformatted()), context.scope());
            case "a" -> anchorLink(element, context);
            case "link" -> storageLink(element, context);
            case "image", "img" -> image(element, context);
            case "emoticon" -> new Emoticon(
                MarkupElements.attribute(element, AC, "name"),
                MarkupElements.attribute(element, AC, "emoji-shortname"),
                MarkupElements.attribute(element, AC, "emoji-id"),
                MarkupElements.attribute(element, AC, "emoji-fallback"),
                context.scope());
            case "time" -> new Time(MarkupElements.attribute(element, AC, "datetime"), context.scope());
            case "placeholder" -> new PlaceholderElement(MarkupElements.attribute(element, AC, "type"),
                AttributeValues.blankToNull(element.text()), context.scope());
            case "i18n" -> new I18nElement(MarkupElements.attribute(element, "at", "key"), context.scope());
            case "layout" -> layout(element, context);
            case "layout-section" -> layoutSection(element, 0, context);
            case "layout-cell" -> {
                ParseContext cellContext = context.enterLayoutCell(0, 0);
                yield new LayoutCell(parseChildren(element, cellContext), cellContext.scope());
            }
            case "task-list" -> taskList(element, context);
            case "task", "task-item" -> parseTask(element, context);
            case "structured-macro", "macro" -> macroDispatcher.dispatch(element, context);
            case "adf-extension" -> adfBridge.extension(element, context);
            case "adf-node" -> adfBridge.node(element, null, context);
            default -> null;
        };
        if (registered != null || mayBuildNothing(tag)) {
            return registered;
        }
        TextEffectType effect = textEffect(tag);
        if (effect != null) {
            return new TextEffectElement(effect, parseChildren(element, context), context.scope());
        }
        if (ResourceIdentifierParser.isResourceIdentifier(element)) {
            return new ResourceIdentifier(ResourceIdentifierParser.parse(element), context.scope());
        }
        if (CONTAINER_TAGS.contains(tag)) {
            return new ContainerElement(tag, parseChildren(element, context), context.scope());
        }
        String qualifiedTag = AsciiTextNormalizer.toLowerAscii(element.tagName());
        diagnostics.record(ParseDiagnostics.UNKNOWN_ELEMENT, qualifiedTag);
        logger.debug("Skipping unknown element <{}>", qualifiedTag);
        return null;
    }

    /** Macro and ADF builders return null for content they record or skip themselves. */
    private static boolean mayBuildNothing(String tag) {
        return switch (tag) {
            case "structured-macro", "macro", "adf-extension", "adf-node" -> true;
            default -> false;
        };
    }

    private static TextEffectType textEffect(String tag) {
        return switch (tag) {
            case "strong", "b" -> TextEffectType.STRONG;
            case "em", "i" -> TextEffectType.EMPHASIS;
            case "u", "ins" -> TextEffectType.UNDERLINE;
            case "s", "del", "strike" -> TextEffectType.STRIKETHROUGH;
            case "sub" -> TextEffectType.SUBSCRIPT;
            case "sup" -> TextEffectType.SUPERSCRIPT;
            case "code", "tt" -> TextEffectType.MONOSPACE;
            default -> null;
        };
    }

    private Text textLeaf(String raw, ParseContext context) {
        if (raw.isEmpty()) {
            return null;
        }
        if (context.preformatted()) {
            return new Text(raw, context.scope());
        }
        return new Text(AsciiTextNormalizer.collapseWhitespace(raw), context.scope());
    }

    private ListItem listItem(Element element, ParseContext context) {
        ParseContext itemContext = context.enterListItem();
        return new ListItem(null, null, null, null, parseChildren(element, itemContext), itemContext.scope());
    }

    private ListElement taskList(Element element, ParseContext context) {
        List<Node> items = new ArrayList<>();
        for (Element child : element.children()) {
            dispatch(child, context, items);
        }
        return new ListElement(ListType.TASK, null, MarkupElements.attribute(element, AC, "local-id"), items,
            context.scope());
    }

    /**
     * Builds a task list item from {@code ac:task} (child elements or a {@code status}
     * attribute) or from {@code ac:task-item} (a {@code completed} flag).
     */
    ListItem parseTask(Element element, ParseContext context) {
        ParseContext itemContext = context.enterListItem();
        String localId = MarkupElements.attribute(element, AC, "local-id");
        if ("task-item".equals(MarkupElements.localName(element))) {
            Boolean completed = AttributeValues.parseBoolean(MarkupElements.attribute(element, AC, "completed"));
            TaskListItemStatus status = completed == null ? null
                : completed ? TaskListItemStatus.COMPLETE : TaskListItemStatus.INCOMPLETE;
            return new ListItem(status, MarkupElements.attribute(element, AC, "task-id"), null, localId,
                parseChildren(element, itemContext), itemContext.scope());
        }
        String statusValue = MarkupElements.childText(element, "task-status");
        if (statusValue == null) {
            statusValue = MarkupElements.attribute(element, AC, "status");
        }
        String taskId = MarkupElements.childText(element, "task-id");
        if (taskId == null) {
            taskId = MarkupElements.attribute(element, AC, "task-id");
        }
        String taskUuid = MarkupElements.childText(element, "task-uuid");
        Element body = MarkupElements.firstChildElement(element, "task-body");
        List<Node> content;
        if (body != null) {
            content = parseChildren(body, itemContext);
        } else {
            List<org.jsoup.nodes.Node> inline = new ArrayList<>();
            for (org.jsoup.nodes.Node child : element.childNodes()) {
                if (!(child instanceof Element field && isTaskField(field))) {
                    inline.add(child);
                }
            }
            content = parseNodes(inline, itemContext);
        }
        return new ListItem(TaskListItemStatus.fromValue(statusValue), taskId, taskUuid, localId, content,
            itemContext.scope());
    }

    private static boolean isTaskField(Element child) {
        return switch (MarkupElements.localName(child)) {
            case "task-id", "task-uuid", "task-status" -> true;
            default -> false;
        };
    }

    private LinkElement anchorLink(Element element, ParseContext context) {
        String href = MarkupElements.attribute(element, null, "href");
        LinkType linkType;
        if (href != null && AsciiTextNormalizer.toLowerAscii(href).startsWith("mailto:")) {
            linkType = LinkType.MAILTO;
        } else if (href != null && href.startsWith("#")) {
            linkType = LinkType.ANCHOR;
        } else {
            linkType = LinkType.EXTERNAL;
        }
        String anchor = linkType == LinkType.ANCHOR && href.length() > 1 ? href.substring(1) : null;
        Link link = new Link(href, null, anchor,
            MarkupElements.attribute(element, null, "data-card-appearance"), element.text().strip());
        return new LinkElement(linkType, href, link, parseChildren(element, context), context.scope());
    }

    /**
     * Builds an {@code ac:link}. Children are the embedded identifiers followed by the body;
     * the resolved {@link Link} carries the preferred identifier.
     */
    private LinkElement storageLink(Element element, ParseContext context) {
        List<Node> children = new ArrayList<>();
        List<ResourceReference> references = new ArrayList<>();
        List<Node> body = new ArrayList<>();
        for (Element child : element.children()) {
            String childTag = MarkupElements.localName(child);
            if (ResourceIdentifierParser.isResourceIdentifier(child)) {
                ResourceReference reference = ResourceIdentifierParser.parse(child);
                references.add(reference);
                children.add(new ResourceIdentifier(reference, context.scope()));
            } else if ("link-body".equals(childTag)) {
                body.addAll(parseChildren(child, context));
            } else if ("plain-text-link-body".equals(childTag)) {
                String verbatim = child.wholeText();
                if (!verbatim.isEmpty()) {
                    body.add(new Text(verbatim, context.scope()));
                }
            } else {
                dispatch(child, context, body);
            }
        }
        children.addAll(body);

        ResourceReference preferred = ResourceIdentifierParser.selectPreferred(references);
        String anchor = MarkupElements.attribute(element, AC, "anchor");
        String url = preferred instanceof UrlReference urlReference ? urlReference.value() : null;
        String bodyText = bodyText(body);
        Link link = new Link(url, preferred, anchor, MarkupElements.attribute(element, AC, "card-appearance"),
            bodyText);

        LinkType linkType;
        if (preferred != null) {
            linkType = LinkType.fromKind(preferred.kind());
        } else if (anchor != null) {
            linkType = LinkType.ANCHOR;
        } else {
            linkType = LinkType.UNKNOWN;
        }
        String href = url != null ? url : anchor != null ? "#" + anchor : null;
        return new LinkElement(linkType, href, link, children, context.scope());
    }

    private static String bodyText(List<Node> body) {
        StringBuilder text = new StringBuilder();
        for (Node node : body) {
            text.append(node.toText());
        }
        return text.toString().strip();
    }

    private Image image(Element element, ParseContext context) {
        boolean html = "img".equals(MarkupElements.localName(element));
        String prefix = html ? null : AC;
        ImageAttributes attributes = new ImageAttributes(
            MarkupElements.attribute(element, prefix, "alt"),
            MarkupElements.attribute(element, prefix, "title"),
            AttributeValues.parseInteger(MarkupElements.attribute(element, prefix, "width")),
            AttributeValues.parseInteger(MarkupElements.attribute(element, prefix, "height")),
            MarkupElements.attribute(element, prefix, "align"),
            MarkupElements.attribute(element, prefix, "layout"),
            AttributeValues.parseInteger(MarkupElements.attribute(element, prefix, "original-width")),
            AttributeValues.parseInteger(MarkupElements.attribute(element, prefix, "original-height")),
            AttributeValues.parseBoolean(MarkupElements.attribute(element, prefix, "custom-width")),
            MarkupElements.attribute(element, prefix, "src"));
        AttachmentReference attachment = null;
        UrlReference url = null;
        List<Node> caption = new ArrayList<>();
        for (Element child : element.children()) {
            String childTag = MarkupElements.localName(child);
            if ("caption".equals(childTag)) {
                caption.addAll(parseChildren(child, context));
                continue;
            }
            ResourceReference reference = ResourceIdentifierParser.parse(child);
            if (reference instanceof AttachmentReference attachmentReference && attachment == null) {
                attachment = attachmentReference;
            } else if (reference instanceof UrlReference urlReference && url == null) {
                url = urlReference;
            }
        }
        return new Image(attributes, attachment, url, caption, context.scope());
    }

    private LayoutElement layout(Element element, ParseContext context) {
        List<Node> sections = new ArrayList<>();
        int sectionIndex = 0;
        for (Element child : element.children()) {
            if ("layout-section".equals(MarkupElements.localName(child))) {
                sections.add(layoutSection(child, sectionIndex++, context));
            } else {
                dispatch(child, context, sections);
            }
        }
        return new LayoutElement(sections, context.scope());
    }

    private LayoutSection layoutSection(Element element, int sectionIndex, ParseContext context) {
        List<Node> cells = new ArrayList<>();
        int cellIndex = 0;
        for (Element child : element.children()) {
            if ("layout-cell".equals(MarkupElements.localName(child))) {
                ParseContext cellContext = context.enterLayoutCell(sectionIndex, cellIndex++);
                cells.add(new LayoutCell(parseChildren(child, cellContext), cellContext.scope()));
            } else {
                dispatch(child, context, cells);
            }
        }
        return new LayoutSection(MarkupElements.attribute(element, AC, "type"),
            MarkupElements.attribute(element, AC, "breakout-mode"), cells, context.scope());
    }
}
