package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.StorageDocument;
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
import com.williamcallahan.confluenceparser.domain.node.ListItem;
import com.williamcallahan.confluenceparser.domain.node.ListType;
import com.williamcallahan.confluenceparser.domain.node.MacroNode;
import com.williamcallahan.confluenceparser.domain.node.PagePropertiesMacro;
import com.williamcallahan.confluenceparser.domain.node.PagePropertiesReportMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacroType;
import com.williamcallahan.confluenceparser.domain.node.ProfileMacro;
import com.williamcallahan.confluenceparser.domain.node.StatusMacro;
import com.williamcallahan.confluenceparser.domain.node.TaskListItemStatus;
import com.williamcallahan.confluenceparser.domain.node.TasksReportMacro;
import com.williamcallahan.confluenceparser.domain.node.TocMacro;
import com.williamcallahan.confluenceparser.domain.node.ViewFileMacro;
import com.williamcallahan.confluenceparser.domain.node.ViewPdfMacro;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Verifies macro names map to their typed nodes, parameters and text templates.
 */
class MacroDispatcherTest {

    private final StorageFormatParser parser = new StorageFormatParser();

    @ParameterizedTest(name = "{0} macro becomes a {1} panel")
    @CsvSource({
        "info, INFO, ℹ️ INFO: Body",
        "tip, SUCCESS, ✅ SUCCESS: Body",
        "note, WARNING, ⚠️ WARNING: Body",
        "warning, ERROR, ❌ ERROR: Body",
        "panel, PANEL, 📋 PANEL: Body"
    })
    void notificationMacrosCollapseToPanels(String macroName, PanelMacroType expectedType, String expectedText) {
        StorageDocument document = parser.parse("<ac:structured-macro ac:name=\"" + macroName
            + "\"><ac:rich-text-body><p>Body</p></ac:rich-text-body></ac:structured-macro>");

        PanelMacro panel = (PanelMacro) document.root();
        assertEquals(expectedType, panel.panelType());
        assertEquals(macroName, panel.macroType());
        assertEquals(expectedText, document.text());
    }

    @Test
    @DisplayName("Notification panels share one kind while a plain panel keeps its own")
    void notificationKindIsShared() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="info"/>
            <ac:structured-macro ac:name="warning"/>
            <ac:structured-macro ac:name="panel"/>
            """);

        assertThat(document.findAll(PanelMacro.class))
            .extracting(MacroNode::kind)
            .containsExactly("macro:notification", "macro:notification", "macro:panel");
    }

    @Test
    void panelParametersPopulateStyle() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="panel" ac:macro-id="m-1">
              <ac:parameter ac:name="title">Important Note</ac:parameter>
              <ac:parameter ac:name="bgColor">#FFF2CC</ac:parameter>
              <ac:parameter ac:name="panelIconText">🎯</ac:parameter>
              <ac:rich-text-body><p>Custom</p></ac:rich-text-body>
            </ac:structured-macro>
            """);

        PanelMacro panel = document.findAll(PanelMacro.class).get(0);
        assertEquals("Important Note", panel.title());
        assertEquals("#FFF2CC", panel.style().bgColor());
        assertEquals("m-1", panel.macroId());
        assertEquals("🎯: Custom", document.text());
    }

    @Test
    void noformatIsCodeWithoutLanguage() {
        StorageDocument document = parser.parse(
            "<ac:structured-macro ac:name=\"noformat\"><ac:plain-text-body><![CDATA[raw text]]></ac:plain-text-body></ac:structured-macro>");

        CodeMacro code = (CodeMacro) document.root();
        assertNull(code.language());
        assertEquals("```\nraw text\n```", document.text());
    }

    @Test
    void expandAndDetailsRenderTheirBodies() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="expand">
              <ac:parameter ac:name="title">GET /users Response</ac:parameter>
              <ac:rich-text-body><p>Hidden content</p></ac:rich-text-body>
            </ac:structured-macro>
            <ac:macro ac:name="details"><ac:rich-text-body><p>Details content</p></ac:rich-text-body></ac:macro>
            """);

        assertEquals("GET /users Response", document.findAll(ExpandMacro.class).get(0).title());
        assertEquals("▶ GET /users Response\nHidden content", document.findAll(ExpandMacro.class).get(0).toText());
        assertEquals("📋 Details: Details content", document.findAll(DetailsMacro.class).get(0).toText());
    }

    @Test
    void jiraHidesDefaultServer() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="jira">
              <ac:parameter ac:name="key">ABC-1</ac:parameter>
              <ac:parameter ac:name="server">System Jira</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="jira">
              <ac:parameter ac:name="key">XYZ-9</ac:parameter>
              <ac:parameter ac:name="server">Partner Jira</ac:parameter>
              <ac:parameter ac:name="maximumIssues">20</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="jira"/>
            """);

        assertThat(document.findAll(JiraMacro.class))
            .extracting(JiraMacro::toText)
            .containsExactly("🎫 ABC-1", "🎫 XYZ-9 (Partner Jira)", "🎫 JIRA Issue");
        assertEquals(20, document.findAll(JiraMacro.class).get(1).maximumIssues());
    }

    @Test
    @DisplayName("Resource-identifier parameters are read as typed references")
    void identifierParametersResolve() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="profile">
              <ac:parameter ac:name="user"><ri:user ri:account-id="acc-1"/></ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="include">
              <ac:parameter ac:name=""><ac:link><ri:page ri:space-key="DOC" ri:content-title="Shared"/></ac:link></ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="excerpt-include">
              <ac:parameter ac:name=""><ri:blog-post ri:content-title="News" ri:posting-day="2024/01/02"/></ac:parameter>
              <ac:parameter ac:name="nopanel">true</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="viewpdf">
              <ac:parameter ac:name="name"><ri:attachment ri:filename="doc.pdf" ri:version-at-save="1"/></ac:parameter>
            </ac:structured-macro>
            """);

        ProfileMacro profile = document.findAll(ProfileMacro.class).get(0);
        assertEquals("acc-1", profile.accountId());
        assertEquals("👤 Profile: acc-1", profile.toText());

        IncludeMacro include = document.findAll(IncludeMacro.class).get(0);
        assertEquals("Shared", include.contentTitle());
        assertEquals("DOC", include.spaceKey());
        assertEquals("📄 Include: Shared", include.toText());

        ExcerptIncludeMacro excerptInclude = document.findAll(ExcerptIncludeMacro.class).get(0);
        assertEquals("2024/01/02", excerptInclude.postingDay());
        assertEquals(Boolean.TRUE, excerptInclude.noPanel());
        assertEquals("📝 Excerpt: News (2024/01/02)", excerptInclude.toText());

        ViewPdfMacro pdf = document.findAll(ViewPdfMacro.class).get(0);
        assertEquals("doc.pdf", pdf.filename());
        assertEquals("📄 PDF: doc.pdf", pdf.toText());
    }

    @Test
    void viewPdfAcceptsHyphenatedName() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="view-pdf">
              <ac:parameter ac:name="name"><ri:attachment ri:filename="a.pdf"/></ac:parameter>
            </ac:structured-macro>
            """);

        assertThat(document.diagnostics()).isEmpty();
        ViewPdfMacro pdf = (ViewPdfMacro) document.root();
        assertEquals("view_pdf_macro", pdf.typeName());
        assertEquals("📄 PDF: a.pdf", document.text());
    }

    @Test
    void viewFileAcceptsPlainFilenameAndAliases() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="view-file">
              <ac:parameter ac:name="name">report.docx</ac:parameter>
              <ac:parameter ac:name="version-at-save">2</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="viewxls">
              <ac:parameter ac:name="name"><ri:attachment ri:filename="sheet.xlsx"/></ac:parameter>
            </ac:structured-macro>
            """);

        assertThat(document.diagnostics()).isEmpty();
        assertThat(document.findAll(ViewFileMacro.class))
            .extracting(ViewFileMacro::filename)
            .containsExactly("report.docx", "sheet.xlsx");
        assertEquals(2, document.findAll(ViewFileMacro.class).get(0).versionAtSave());
        assertEquals("📁 File: report.docx", document.findAll(ViewFileMacro.class).get(0).toText());
    }

    @Test
    void simpleMacrosRenderLabels() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="toc"><ac:parameter ac:name="maxLevel">3</ac:parameter></ac:structured-macro>
            <ac:structured-macro ac:name="attachments"><ac:parameter ac:name="patterns">*.pdf</ac:parameter></ac:structured-macro>
            <ac:structured-macro ac:name="anchor"><ac:parameter ac:name="">top</ac:parameter></ac:structured-macro>
            <ac:structured-macro ac:name="gadget"><ac:parameter ac:name="url">https://g.example.com</ac:parameter></ac:structured-macro>
            <ac:structured-macro ac:name="children"/>
            """);

        assertEquals(3, document.findAll(TocMacro.class).get(0).maxLevel());
        assertEquals("📑 Table of Contents", document.findAll(TocMacro.class).get(0).toText());
        assertEquals("📎 Attachments: *.pdf", document.findAll(AttachmentsMacro.class).get(0).toText());
        assertEquals("⚓ Anchor: top", document.findAll(AnchorMacro.class).get(0).toText());
        assertEquals("🧩 Gadget: https://g.example.com", document.findAll(GadgetMacro.class).get(0).toText());
        assertEquals("📂 Child Pages", document.findAll(ChildrenDisplayMacro.class).get(0).toText());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void reportMacrosReadTheirParameters() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="tasks-report-macro">
              <ac:parameter ac:name="spaces">DOC</ac:parameter>
              <ac:parameter ac:name="isMissingRequiredParameters">false</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="detailssummary">
              <ac:parameter ac:name="labels">release</ac:parameter>
              <ac:parameter ac:name="pageSize">not-a-number</ac:parameter>
            </ac:structured-macro>
            <ac:structured-macro ac:name="page-properties">
              <ac:rich-text-body><p>Owner</p></ac:rich-text-body>
            </ac:structured-macro>
            <ac:structured-macro ac:name="excerpt"><ac:rich-text-body><p>Summary</p></ac:rich-text-body></ac:structured-macro>
            """);

        TasksReportMacro tasksReport = document.findAll(TasksReportMacro.class).get(0);
        assertFalse(tasksReport.isMissingRequiredParameters());
        assertEquals("📊 Tasks Report: DOC", tasksReport.toText());

        PagePropertiesReportMacro report = document.findAll(PagePropertiesReportMacro.class).get(0);
        assertNull(report.pageSize());
        assertEquals("📊 Page Properties Report: release", report.toText());

        assertEquals("📋 Page Properties\nOwner", document.findAll(PagePropertiesMacro.class).get(0).toText());
        assertEquals("📄 Excerpt: Summary", document.findAll(ExcerptMacro.class).get(0).toText());
    }

    @Test
    @DisplayName("The task-list macro yields a task list of its task items")
    void taskListMacroBuildsTaskList() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="task-list" ac:macro-id="tasklist-123">
                <ac:task-item ac:local-id="item-1" ac:task-id="task-1" completed="false">
                    Buy groceries
                </ac:task-item>
                <ac:task-item ac:local-id="item-2" ac:task-id="task-2" completed="true">
                    Walk the dog
                </ac:task-item>
            </ac:structured-macro>
            """);

        ListElement list = (ListElement) document.root();
        assertEquals(ListType.TASK, list.listType());
        assertEquals("tasklist-123", list.localId());
        assertThat(list.items()).extracting(ListItem::localId).containsExactly("item-1", "item-2");
        assertThat(list.items()).extracting(ListItem::status)
            .containsExactly(TaskListItemStatus.INCOMPLETE, TaskListItemStatus.COMPLETE);
        assertEquals("○ Buy groceries\n✓ Walk the dog", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void macroNameIsCaseInsensitive() {
        StorageDocument document = parser.parse(
            "<ac:structured-macro ac:name=\"Status\"><ac:parameter ac:name=\"title\">OK</ac:parameter></ac:structured-macro>");

        assertThat(document.diagnostics()).isEmpty();
        assertEquals("Status", ((StatusMacro) document.root()).macroName());
        assertEquals("🏷️ Status: OK", document.text());
    }

    @Test
    void notificationKindIgnoresMacroNameCase() {
        StorageDocument document = parser.parse(
            "<ac:structured-macro ac:name=\"Info\"><ac:rich-text-body><p>Hi</p></ac:rich-text-body></ac:structured-macro>");

        PanelMacro panel = (PanelMacro) document.root();
        assertEquals(PanelMacroType.INFO, panel.panelType());
        assertEquals("info", panel.macroType());
        assertEquals("macro:notification", panel.kind());
    }

    @Test
    @DisplayName("Unknown macros keep the name as written")
    void unknownMacroKeepsRawName() {
        StorageDocument document = parser.parse("<ac:structured-macro ac:name=\"XYZ\"/>");

        assertThat(document.diagnostics()).containsExactly("unknown_macro:XYZ");
        assertEquals("XYZ", ((GenericMacro) document.root()).macroName());
        assertEquals("⚙️ Macro: XYZ", document.text());
    }
}
