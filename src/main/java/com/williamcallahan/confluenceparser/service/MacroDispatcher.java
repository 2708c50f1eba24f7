package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.BlogPostReference;
import com.williamcallahan.confluenceparser.domain.link.PageReference;
import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import com.williamcallahan.confluenceparser.domain.node.AnchorMacro;
import com.williamcallahan.confluenceparser.domain.node.AttachmentsMacro;
import com.williamcallahan.confluenceparser.domain.node.ChildrenDisplayMacro;
import com.williamcallahan.confluenceparser.domain.node.CodeMacro;
import com.williamcallahan.confluenceparser.domain.node.DetailsMacro;
import com.williamcallahan.confluenceparser.domain.node.ExcerptIncludeMacro;
import com.williamcallahan.confluenceparser.domain.node.ExcerptMacro;
import com.williamcallahan.confluenceparser.domain.node.ExpandMacro;
import com.williamcallahan.confluenceparser.domain.node.GadgetMacro;
import com.williamcallahan.confluenceparser.domain.node.GenericMacro;
import com.williamcallahan.confluenceparser.domain.node.IncludeMacro;
import com.williamcallahan.confluenceparser.domain.node.JiraMacro;
import com.williamcallahan.confluenceparser.domain.node.ListElement;
import com.williamcallahan.confluenceparser.domain.node.ListType;
import com.williamcallahan.confluenceparser.domain.node.MacroDescriptor;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.domain.node.PagePropertiesMacro;
import com.williamcallahan.confluenceparser.domain.node.PagePropertiesReportMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacroType;
import com.williamcallahan.confluenceparser.domain.node.PanelStyle;
import com.williamcallahan.confluenceparser.domain.node.ProfileMacro;
import com.williamcallahan.confluenceparser.domain.node.StatusMacro;
import com.williamcallahan.confluenceparser.domain.node.TasksReportMacro;
import com.williamcallahan.confluenceparser.domain.node.TocMacro;
import com.williamcallahan.confluenceparser.domain.node.ViewFileMacro;
import com.williamcallahan.confluenceparser.domain.node.ViewPdfMacro;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@code ac:structured-macro} / {@code ac:macro} elements to macro nodes by macro name.
 *
 * <p>Names without a registered builder still produce a {@link GenericMacro} and record
 * {@code unknown_macro:<name>}.</p>
 */
final class MacroDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(MacroDispatcher.class);

    @FunctionalInterface
    private interface MacroBuilder {
        Node build(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context);
    }

    private static final Map<String, MacroBuilder> BUILDERS = Map.ofEntries(
        Map.entry("status", MacroDispatcher::status),
        Map.entry("panel", MacroDispatcher::panel),
        Map.entry("info", MacroDispatcher::panel),
        Map.entry("note", MacroDispatcher::panel),
        Map.entry("tip", MacroDispatcher::panel),
        Map.entry("warning", MacroDispatcher::panel),
        Map.entry("code", MacroDispatcher::code),
        Map.entry("noformat", MacroDispatcher::code),
        Map.entry("expand", MacroDispatcher::expand),
        Map.entry("toc", MacroDispatcher::toc),
        Map.entry("details", MacroDispatcher::details),
        Map.entry("attachments", MacroDispatcher::attachments),
        Map.entry("jira", MacroDispatcher::jira),
        Map.entry("profile", MacroDispatcher::profile),
        Map.entry("anchor", MacroDispatcher::anchor),
        Map.entry("excerpt", MacroDispatcher::excerpt),
        Map.entry("excerpt-include", MacroDispatcher::excerptInclude),
        Map.entry("include", MacroDispatcher::include),
        Map.entry("view-file", MacroDispatcher::viewFile),
        Map.entry("viewfile", MacroDispatcher::viewFile),
        Map.entry("viewdoc", MacroDispatcher::viewFile),
        Map.entry("viewxls", MacroDispatcher::viewFile),
        Map.entry("viewppt", MacroDispatcher::viewFile),
        Map.entry("viewpdf", MacroDispatcher::viewPdf),
        Map.entry("view-pdf", MacroDispatcher::viewPdf),
        Map.entry("gadget", MacroDispatcher::gadget),
        Map.entry("page-properties", MacroDispatcher::pageProperties),
        Map.entry("page-properties-report", MacroDispatcher::pagePropertiesReport),
        Map.entry("detailssummary", MacroDispatcher::pagePropertiesReport),
        Map.entry("children", MacroDispatcher::childrenDisplay),
        Map.entry("children-display", MacroDispatcher::childrenDisplay),
        Map.entry("tasks-report-macro", MacroDispatcher::tasksReport),
        Map.entry("tasks-report", MacroDispatcher::tasksReport),
        Map.entry("task-list", MacroDispatcher::taskList));

    private final ElementDispatcher dispatcher;
    private final ParseDiagnostics diagnostics;

    MacroDispatcher(ElementDispatcher dispatcher, ParseDiagnostics diagnostics) {
        this.dispatcher = dispatcher;
        this.diagnostics = diagnostics;
    }

    Node dispatch(Element macroElement, ParseContext context) {
        MacroParameters macro = new MacroParameters(macroElement);
        MacroBuilder builder = BUILDERS.get(macro.key());
        if (builder != null) {
            return builder.build(macro, dispatcher, context);
        }
        diagnostics.record(ParseDiagnostics.UNKNOWN_MACRO, macro.name());
        logger.debug("Unknown macro '{}', keeping it as a generic macro", macro.name());
        return new GenericMacro(macro.descriptor(), macro.plainTextBody(), richBody(macro, dispatcher, context),
            context.scope());
    }

    private static List<Node> richBody(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        Element body = macro.richTextBody();
        return body == null ? List.of() : dispatcher.parseChildren(body, context);
    }

    private static Node status(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new StatusMacro(macro.descriptor(), macro.string("title"), macro.string("colour", "color"),
            macro.bool("subtle"), context.scope());
    }

    private static Node panel(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        PanelStyle style = new PanelStyle(
            macro.string("title"),
            macro.string("bgColor"),
            macro.string("borderStyle"),
            macro.string("borderColor"),
            macro.string("titleBGColor"),
            macro.string("titleColor"),
            macro.string("panelIcon"),
            macro.string("panelIconId"),
            macro.string("panelIconText"));
        return new PanelMacro(macro.descriptor(), PanelMacroType.fromMacroName(macro.key()), macro.key(), style,
            richBody(macro, dispatcher, context), context.scope());
    }

    private static Node code(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new CodeMacro(macro.descriptor(), macro.string("language"), macro.string("title"),
            macro.plainTextBody(), macro.bool("linenumbers"), macro.string("theme"), macro.bool("collapse"),
            context.scope());
    }

    private static Node expand(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new ExpandMacro(macro.descriptor(), macro.string("title"), macro.string("breakoutWidth"),
            richBody(macro, dispatcher, context), context.scope());
    }

    private static Node toc(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new TocMacro(macro.descriptor(), macro.string("style"), macro.integer("minLevel"),
            macro.integer("maxLevel"), macro.string("type"), macro.bool("outline"), context.scope());
    }

    private static Node details(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new DetailsMacro(macro.descriptor(), macro.string("id"), macro.bool("hidden"),
            richBody(macro, dispatcher, context), context.scope());
    }

    private static Node attachments(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new AttachmentsMacro(macro.descriptor(), macro.string("patterns"), macro.string("sortBy"),
            macro.bool("upload"), macro.bool("old"), context.scope());
    }

    private static Node jira(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new JiraMacro(macro.descriptor(), macro.string("key"), macro.string("server"),
            macro.string("serverId"), macro.string("jqlQuery"), macro.integer("maximumIssues"), context.scope());
    }

    private static Node profile(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new ProfileMacro(macro.descriptor(), macro.user("user"), context.scope());
    }

    private static Node anchor(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new AnchorMacro(macro.descriptor(), macro.string("", "anchor"), context.scope());
    }

    private static Node excerpt(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new ExcerptMacro(macro.descriptor(), macro.bool("hidden"),
            macro.string("atlassian-macro-output-type", "outputType"), richBody(macro, dispatcher, context),
            context.scope());
    }

    private static Node excerptInclude(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        ResourceReference source = macro.content("", "page");
        String title = null;
        String spaceKey = null;
        String postingDay = null;
        if (source instanceof PageReference page) {
            title = page.contentTitle();
            spaceKey = page.spaceKey();
        } else if (source instanceof BlogPostReference blogPost) {
            title = blogPost.contentTitle();
            spaceKey = blogPost.spaceKey();
            postingDay = blogPost.postingDay();
        }
        return new ExcerptIncludeMacro(macro.descriptor(), title, spaceKey, postingDay, macro.bool("nopanel"),
            context.scope());
    }

    private static Node include(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        ResourceReference source = macro.content("", "page");
        if (source instanceof PageReference page) {
            return new IncludeMacro(macro.descriptor(), page.contentTitle(), page.spaceKey(), context.scope());
        }
        if (source instanceof BlogPostReference blogPost) {
            return new IncludeMacro(macro.descriptor(), blogPost.contentTitle(), blogPost.spaceKey(),
                context.scope());
        }
        return new IncludeMacro(macro.descriptor(), null, null, context.scope());
    }

    private static Node viewFile(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        AttachmentReference attachment = macro.attachment("name", "version-at-save");
        return new ViewFileMacro(macro.descriptor(), attachment, macro.string("height"), macro.string("width"),
            context.scope());
    }

    private static Node viewPdf(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new ViewPdfMacro(macro.descriptor(), macro.attachment("name", "version-at-save"), context.scope());
    }

    private static Node gadget(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new GadgetMacro(macro.descriptor(), macro.string("url"), macro.string("width"),
            macro.string("height"), context.scope());
    }

    private static Node pageProperties(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new PagePropertiesMacro(macro.descriptor(), macro.string("id"), macro.bool("hidden"),
            richBody(macro, dispatcher, context), context.scope());
    }

    private static Node pagePropertiesReport(MacroParameters macro, ElementDispatcher dispatcher,
            ParseContext context) {
        return new PagePropertiesReportMacro(macro.descriptor(), macro.string("labels", "label"),
            macro.string("spaceKey", "spaces"), macro.string("cql"), macro.integer("pageSize"),
            macro.string("sortBy"), macro.string("headings"), context.scope());
    }

    private static Node childrenDisplay(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        ResourceReference parentPage = macro.content("page");
        return new ChildrenDisplayMacro(macro.descriptor(), macro.integer("depth"),
            macro.string("excerptType", "excerpt"), macro.string("sort"), macro.bool("reverse"), macro.bool("all"),
            macro.string("style"), parentPage instanceof PageReference page ? page : null,
            context.scope());
    }

    private static Node tasksReport(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        return new TasksReportMacro(macro.descriptor(), macro.string("spaces", "spaceAndPage"),
            macro.string("labels"), macro.string("status"), macro.string("assignees"), macro.integer("pageSize"),
            macro.bool("isMissingRequiredParameters"), context.scope());
    }

    /**
     * The {@code task-list} macro becomes a task list whose items are its {@code ac:task-item}
     * (or {@code ac:task}) children.
     */
    private static Node taskList(MacroParameters macro, ElementDispatcher dispatcher, ParseContext context) {
        MacroDescriptor descriptor = macro.descriptor();
        List<Node> items = new ArrayList<>();
        for (Element child : macro.element().children()) {
            String childName = MarkupElements.localName(child);
            if ("task-item".equals(childName) || "task".equals(childName)) {
                items.add(dispatcher.parseTask(child, context));
            } else if ("rich-text-body".equals(childName)) {
                items.addAll(dispatcher.parseChildren(child, context));
            }
        }
        String localId = descriptor.localId() != null ? descriptor.localId() : descriptor.macroId();
        return new ListElement(ListType.TASK, null, localId, items, context.scope());
    }
}
