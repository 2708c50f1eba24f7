package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.node.DecisionList;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItem;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItemState;
import com.williamcallahan.confluenceparser.domain.node.MacroDescriptor;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.domain.node.PanelMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacroType;
import com.williamcallahan.confluenceparser.domain.node.PanelStyle;
import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;
import com.williamcallahan.confluenceparser.support.AttributeValues;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps ADF nodes embedded through {@code ac:adf-extension} / {@code ac:adf-node} onto
 * first-class nodes.
 *
 * <p>Only {@code decision-list} and {@code panel} are mapped. When the direct mapping
 * leaves the node empty, the {@code ac:adf-fallback} markup fills it in.</p>
 */
final class AdfBridge {

    private static final Logger logger = LoggerFactory.getLogger(AdfBridge.class);

    private static final String AC = "ac";

    private final ElementDispatcher dispatcher;
    private final ParseDiagnostics diagnostics;

    AdfBridge(ElementDispatcher dispatcher, ParseDiagnostics diagnostics) {
        this.dispatcher = dispatcher;
        this.diagnostics = diagnostics;
    }

    /**
     * Maps an extension wrapper.
     *
     * @param extension {@code ac:adf-extension} element
     * @param context recursion state
     * @return mapped node, or null when the wrapper holds no ADF node or its type is not mapped
     */
    Node extension(Element extension, ParseContext context) {
        Element adfNode = MarkupElements.firstChildElement(extension, "adf-node");
        if (adfNode == null) {
            logger.debug("ADF extension without an adf-node, nothing to map");
            return null;
        }
        return node(adfNode, MarkupElements.firstChildElement(extension, "adf-fallback"), context);
    }

    /**
     * Maps a single ADF node.
     *
     * @param adfNode {@code ac:adf-node} element
     * @param fallback sibling {@code ac:adf-fallback} element, or null
     * @param context recursion state
     * @return mapped node, or null for an unmapped type
     */
    Node node(Element adfNode, Element fallback, ParseContext context) {
        String rawType = MarkupElements.attribute(adfNode, AC, "type");
        String type = rawType == null ? "" : AsciiTextNormalizer.toLowerAscii(rawType);
        return switch (type) {
            case "decision-list" -> decisionList(adfNode, fallback, context);
            case "panel" -> panel(adfNode, fallback, context);
            default -> {
                diagnostics.record(ParseDiagnostics.UNKNOWN_ADF_NODE_TYPE, rawType);
                logger.debug("Unmapped ADF node type '{}'", rawType);
                yield null;
            }
        };
    }

    private DecisionList decisionList(Element adfNode, Element fallback, ParseContext context) {
        String localId = nodeValue(adfNode, "local-id");
        DecisionListItemState listState = DecisionListItemState.fromValue(nodeValue(adfNode, "state"));
        List<Node> items = new ArrayList<>();
        for (Element child : adfNode.children()) {
            String childTag = MarkupElements.localName(child);
            if ("adf-node".equals(childTag)
                    && "decision-item".equalsIgnoreCase(MarkupElements.attribute(child, AC, "type"))) {
                items.add(decisionItem(child, listState, context));
            } else if ("ul".equals(childTag) || "ol".equals(childTag)) {
                addListItems(child, listState, context, items);
            }
        }
        if (items.isEmpty() && fallback != null) {
            for (Element list : fallback.select("ul, ol")) {
                if (!isNestedList(list, fallback)) {
                    addListItems(list, listState, context, items);
                }
            }
        }
        return new DecisionList(localId, items, context.scope());
    }

    private static boolean isNestedList(Element list, Element boundary) {
        for (Element ancestor = list.parent(); ancestor != null && ancestor != boundary; ancestor = ancestor.parent()) {
            String ancestorTag = MarkupElements.localName(ancestor);
            if ("ul".equals(ancestorTag) || "ol".equals(ancestorTag)) {
                return true;
            }
        }
        return false;
    }

    private DecisionListItem decisionItem(Element item, DecisionListItemState listState, ParseContext context) {
        DecisionListItemState state = DecisionListItemState.fromValue(nodeValue(item, "state"));
        return new DecisionListItem(state != null ? state : listState, nodeValue(item, "local-id"),
            content(item, context), context.scope());
    }

    private void addListItems(Element list, DecisionListItemState listState, ParseContext context,
            List<Node> items) {
        for (Element listItem : MarkupElements.childElements(list, "li")) {
            DecisionListItemState state = DecisionListItemState.fromValue(
                MarkupElements.attribute(listItem, null, "data-decision-state"));
            items.add(new DecisionListItem(state != null ? state : listState,
                MarkupElements.attribute(listItem, null, "data-local-id"),
                dispatcher.parseChildren(listItem, context), context.scope()));
        }
    }

    private PanelMacro panel(Element adfNode, Element fallback, ParseContext context) {
        String panelType = nodeValue(adfNode, "panel-type");
        String bgColor = nodeValue(adfNode, "bg-color");
        List<Node> children = content(adfNode, context);
        if (children.isEmpty() && fallback != null) {
            children = dispatcher.parseChildren(fallback, context);
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        for (Element attribute : MarkupElements.childElements(adfNode, "adf-attribute")) {
            String key = MarkupElements.attribute(attribute, AC, "key");
            if (key != null) {
                parameters.put(key, attribute.text().strip());
            }
        }
        MacroDescriptor descriptor = new MacroDescriptor("panel", null, nodeValue(adfNode, "local-id"), parameters);
        PanelStyle style = new PanelStyle(null, bgColor, null, null, null, null, null, null, null);
        return new PanelMacro(descriptor, PanelMacroType.fromAdfPanelType(panelType), "panel", style, children,
            context.scope());
    }

    /** Parses every {@code ac:adf-content} child of an ADF node in order. */
    private List<Node> content(Element adfNode, ParseContext context) {
        List<Node> children = new ArrayList<>();
        for (Element contentElement : MarkupElements.childElements(adfNode, "adf-content")) {
            children.addAll(dispatcher.parseChildren(contentElement, context));
        }
        return children;
    }

    /**
     * Reads an ADF node value from the element attribute, else from an {@code ac:adf-attribute} child.
     */
    private static String nodeValue(Element adfNode, String key) {
        String attributeValue = MarkupElements.attribute(adfNode, AC, key);
        if (attributeValue != null) {
            return attributeValue;
        }
        for (Element attribute : MarkupElements.childElements(adfNode, "adf-attribute")) {
            if (key.equalsIgnoreCase(MarkupElements.attribute(attribute, AC, "key"))) {
                return AttributeValues.blankToNull(attribute.text());
            }
        }
        return null;
    }
}
