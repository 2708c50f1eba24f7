package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.StorageDocument;
import com.williamcallahan.confluenceparser.domain.node.BlockquoteElement;
import com.williamcallahan.confluenceparser.domain.node.CodeMacro;
import com.williamcallahan.confluenceparser.domain.node.Emoticon;
import com.williamcallahan.confluenceparser.domain.node.Fragment;
import com.williamcallahan.confluenceparser.domain.node.GenericMacro;
import com.williamcallahan.confluenceparser.domain.node.HeadingElement;
import com.williamcallahan.confluenceparser.domain.node.Image;
import com.williamcallahan.confluenceparser.domain.node.ListElement;
import com.williamcallahan.confluenceparser.domain.node.ListItem;
import com.williamcallahan.confluenceparser.domain.node.ListType;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.domain.node.Paragraph;
import com.williamcallahan.confluenceparser.domain.node.PlaceholderElement;
import com.williamcallahan.confluenceparser.domain.node.StatusMacro;
import com.williamcallahan.confluenceparser.domain.node.Table;
import com.williamcallahan.confluenceparser.domain.node.TableCell;
import com.williamcallahan.confluenceparser.domain.node.TableRow;
import com.williamcallahan.confluenceparser.domain.node.TaskListItemStatus;
import com.williamcallahan.confluenceparser.domain.node.Text;
import com.williamcallahan.confluenceparser.domain.node.TextEffectElement;
import com.williamcallahan.confluenceparser.domain.node.TextEffectType;
import com.williamcallahan.confluenceparser.domain.node.Time;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end parsing of storage-format fragments into document trees and text.
 */
class StorageFormatParserTest {

    private final StorageFormatParser parser = new StorageFormatParser();

    @Test
    @DisplayName("Several top-level nodes are wrapped in a fragment root")
    void multipleTopLevelNodesProduceFragment() {
        StorageDocument document = parser.parse("<h1>Title</h1><p>Body</p>");

        assertThat(document.root()).isInstanceOf(Fragment.class);
        assertThat(document.root().children()).hasSize(2);
        assertThat(document.content()).hasSize(2);
        assertEquals("Title\n\nBody", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("A single top-level node becomes the root directly")
    void singleTopLevelNodeIsRoot() {
        StorageDocument document = parser.parse("<h1>Title</h1>");

        assertThat(document.root()).isInstanceOf(HeadingElement.class);
        assertEquals(1, ((HeadingElement) document.root()).level());
    }

    @Test
    void emptyMarkupHasNoRoot() {
        StorageDocument document = parser.parse("");

        assertNull(document.root());
        assertThat(document.walk()).isEmpty();
        assertEquals("", document.text());
    }

    @Test
    void blankMarkupIsAnEmptyDocument() {
        StorageDocument document = parser.parse("  \n\t  \n");

        assertNull(document.root());
        assertThat(document.content()).isEmpty();
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("A line break between inline siblings reads as a space")
    void lineBreakBetweenInlineSiblingsBecomesSpace() {
        StorageDocument document = parser.parse("<p><strong>a</strong>\n<em>b</em></p>");

        Paragraph paragraph = (Paragraph) document.root();
        assertThat(paragraph.children()).hasSize(3);
        assertEquals(" ", ((Text) paragraph.children().get(1)).text());
        assertEquals("a b", document.text());
    }

    @Test
    void lineBreaksAroundBlocksAreDropped() {
        StorageDocument document = parser.parse("""
            <p>
              <strong>a</strong>
            </p>
            <ul>
              <li>one</li>
              <li>two</li>
            </ul>
            """);

        Paragraph paragraph = document.findAll(Paragraph.class).get(0);
        assertThat(paragraph.children()).singleElement().isInstanceOf(TextEffectElement.class);
        assertThat(document.findAll(ListElement.class).get(0).children()).hasSize(2);
        assertThat(document.findAll(Text.class)).noneMatch(text -> text.text().isBlank());
        assertEquals("a\n\n• one\n• two", document.text());
    }

    @Test
    void findAllWithoutFilterMatchesWalk() {
        StorageDocument document = parser.parse("""
            <h2>Tasks</h2>
            <ul><li>One <strong>bold</strong></li><li>Two</li></ul>
            <table><tr><td>a</td><td>b</td></tr></table>
            """);

        assertEquals(document.walk().size(), document.findAll().size());
        assertThat(document.findAll()).containsExactlyElementsOf(document.walk());
    }

    @Test
    @DisplayName("Searching several variants at once matches the single-variant searches")
    void multiVariantSearchMatchesIndividualSearches() {
        StorageDocument document = parser.parse("""
            <h1>Status</h1>
            <p>Now: <ac:structured-macro ac:name="status">
              <ac:parameter ac:name="title">Done</ac:parameter>
            </ac:structured-macro></p>
            <p><ac:placeholder>@ mention lead</ac:placeholder></p>
            """);

        List<List<Node>> buckets = document.findAll(HeadingElement.class, StatusMacro.class, PlaceholderElement.class);

        assertThat(buckets).hasSize(3);
        assertThat(buckets.get(0)).containsExactlyElementsOf(document.findAll(HeadingElement.class));
        assertThat(buckets.get(1)).containsExactlyElementsOf(document.findAll(StatusMacro.class));
        assertThat(buckets.get(2)).containsExactlyElementsOf(document.findAll(PlaceholderElement.class));
        assertThat(buckets.get(1)).hasSize(1);
    }

    @Test
    void orderedListNumbersFromStart() {
        StorageDocument document = parser.parse("<ol start=\"5\"><li>a</li><li>b</li><li>c</li></ol>");

        ListElement list = document.findAll(ListElement.class).get(0);
        assertEquals(5, list.start());
        assertEquals("5. a\n6. b\n7. c", document.text());
    }

    @Test
    void nonNumericListStartIsIgnored() {
        StorageDocument document = parser.parse("<ol start=\"x\"><li>a</li></ol>");

        assertNull(document.findAll(ListElement.class).get(0).start());
        assertEquals("1. a", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Nested list items are indented two spaces per level")
    void nestedListsIndent() {
        StorageDocument document = parser.parse("""
            <ul>
                <li>Top level item
                    <ul>
                        <li>Nested item 1</li>
                        <li>Nested item 2</li>
                    </ul>
                </li>
                <li>Second top item</li>
            </ul>
            """);

        assertEquals("• Top level item\n  • Nested item 1\n  • Nested item 2\n• Second top item", document.text());
        List<ListItem> items = document.findAll(ListItem.class);
        assertThat(items).extracting(ListItem::depth).containsExactly(1, 2, 2, 1);
    }

    @Test
    void unknownMacroKeepsGenericNode() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="xyz">
              <ac:parameter ac:name="param1">value1</ac:parameter>
              <ac:rich-text-body><p>This macro is not implemented</p></ac:rich-text-body>
            </ac:structured-macro>
            """);

        assertThat(document.diagnostics()).contains("unknown_macro:xyz");
        List<GenericMacro> macros = document.findAll(GenericMacro.class);
        assertThat(macros).hasSize(1);
        assertEquals("value1", macros.get(0).parameters().get("param1"));
        assertEquals("⚙️ Macro: xyz\nThis macro is not implemented", document.text());
    }

    @Test
    void unknownElementIsDroppedWithDiagnostic() {
        StorageDocument document = parser.parse("<p>Kept</p><unknown-element>This should be skipped</unknown-element>");

        assertThat(document.diagnostics()).containsExactly("unknown_element:unknown-element");
        assertEquals("Kept", document.text());
        assertThat(document.root()).isInstanceOf(Paragraph.class);
    }

    @Test
    @DisplayName("Raise-on-finish turns collected diagnostics into one aggregate failure")
    void raiseOnFinishThrowsAggregate() {
        StorageFormatParser strictParser = new StorageFormatParser(true);

        assertThatThrownBy(() -> strictParser.parse("<blink>x</blink><ac:structured-macro ac:name=\"xyz\"/>"))
            .isInstanceOf(ParsingDiagnosticsException.class)
            .satisfies(failure -> assertThat(((ParsingDiagnosticsException) failure).diagnostics())
                .containsExactly("unknown_element:blink", "unknown_macro:xyz"));
    }

    @Test
    void raiseOnFinishReturnsCleanDocuments() {
        StorageDocument document = new StorageFormatParser(true).parse("<p>Clean</p>");

        assertEquals("Clean", document.text());
        assertTrue(document.metadata().isClean());
    }

    @Test
    void diagnosticsDoNotLeakBetweenParses() {
        parser.parse("<blink>x</blink>");
        StorageDocument second = parser.parse("<p>ok</p>");

        assertThat(second.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Parsing the same markup twice yields the same structure and text")
    void parsingIsIdempotent() {
        String markup = """
            <h1>Doc</h1>
            <ac:layout><ac:layout-section ac:type="single"><ac:layout-cell>
              <ul><li>a<ol><li>b</li></ol></li></ul>
              <ac:structured-macro ac:name="info"><ac:rich-text-body><p>note</p></ac:rich-text-body></ac:structured-macro>
            </ac:layout-cell></ac:layout-section></ac:layout>
            """;

        StorageDocument first = new StorageFormatParser().parse(markup);
        StorageDocument second = new StorageFormatParser().parse(markup);

        assertEquals(signature(first), signature(second));
        assertEquals(first.text(), second.text());
    }

    @Test
    void codeMacroRendersFencedBlock() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="code">
              <ac:parameter ac:name="language">python</ac:parameter>
              <ac:plain-text-body><![CDATA[x=1]]></ac:plain-text-body>
            </ac:structured-macro>
            """);

        CodeMacro code = document.findAll(CodeMacro.class).get(0);
        assertEquals("python", code.language());
        assertEquals("x=1", code.code());
        assertEquals("```python\nx=1\n```", document.text());
    }

    @Test
    void codeMacroKeepsCdataVerbatim() {
        StorageDocument document = parser.parse("""
            <ac:structured-macro ac:name="code"><ac:plain-text-body><![CDATA[if (a < b && c) {
              return "&nbsp;";
            }]]></ac:plain-text-body></ac:structured-macro>
            """);

        CodeMacro code = document.findAll(CodeMacro.class).get(0);
        assertThat(code.code()).contains("a < b && c").contains("\"&nbsp;\"").contains("\n  return");
    }

    @Test
    void inlineFormattingConcatenates() {
        StorageDocument document = parser.parse("<p>This <strong>has</strong> <em>mixed</em> tails</p>");

        assertEquals("This has mixed tails", document.text());
        assertThat(document.findAll(TextEffectElement.class))
            .extracting(TextEffectElement::effect)
            .containsExactly(TextEffectType.STRONG, TextEffectType.EMPHASIS);
    }

    @Test
    void preformattedTextKeepsWhitespace() {
        StorageDocument document = parser.parse("<pre>  a\n    b</pre>");

        List<Text> texts = document.findAll(Text.class);
        assertThat(texts).hasSize(1);
        assertEquals("  a\n    b", texts.get(0).text());
    }

    @Test
    void inlineCommentMarkerIsUnwrapped() {
        StorageDocument document = parser.parse(
            "<p>Some text with <ac:inline-comment-marker ac:ref=\"c-1\">inline comment</ac:inline-comment-marker></p>");

        assertEquals("Some text with inline comment", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void tableSectionsFlattenAndColumnGroupsVanish() {
        StorageDocument document = parser.parse("""
            <table>
              <colgroup><col/><col/></colgroup>
              <thead><tr><th>Role</th><th>Assignee</th></tr></thead>
              <tbody><tr><td>Lead</td><td><ac:placeholder>@ mention lead</ac:placeholder></td></tr></tbody>
            </table>
            """);

        Table table = document.findAll(Table.class).get(0);
        assertThat(table.children()).allMatch(child -> child instanceof TableRow);
        assertThat(table.rows()).hasSize(2);
        assertTrue(table.hasHeaderRow());
        assertThat(document.findAll(TableCell.class)).hasSize(4);
        assertEquals("Role | Assignee\nLead | 📝 Placeholder: @ mention lead", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void taskListRendersStatusGlyphs() {
        StorageDocument document = parser.parse("""
            <ac:task-list>
                <ac:task>
                    <ac:task-id>1</ac:task-id>
                    <ac:task-status>complete</ac:task-status>
                    <ac:task-body>Set up project repository</ac:task-body>
                </ac:task>
                <ac:task>
                    <ac:task-id>2</ac:task-id>
                    <ac:task-status>incomplete</ac:task-status>
                    <ac:task-body>Implement core features</ac:task-body>
                </ac:task>
            </ac:task-list>
            """);

        ListElement list = document.findAll(ListElement.class).get(0);
        assertEquals(ListType.TASK, list.listType());
        assertThat(list.items()).extracting(ListItem::status)
            .containsExactly(TaskListItemStatus.COMPLETE, TaskListItemStatus.INCOMPLETE);
        assertThat(list.items()).extracting(ListItem::taskId).containsExactly("1", "2");
        assertEquals("✓ Set up project repository\n○ Implement core features", document.text());
    }

    @Test
    void taskWithStatusAttributeAndDirectText() {
        StorageDocument document = parser.parse("<ac:task-list><ac:task status=\"done\">Ship it</ac:task></ac:task-list>");

        ListItem item = document.findAll(ListItem.class).get(0);
        assertEquals(TaskListItemStatus.COMPLETE, item.status());
        assertEquals("✓ Ship it", document.text());
    }

    @Test
    void blockquotePrefixesEveryLine() {
        StorageDocument document = parser.parse("<blockquote><p>first</p><p>second</p></blockquote>");

        assertThat(document.root()).isInstanceOf(BlockquoteElement.class);
        assertEquals("> first\n> \n> second", document.text());
    }

    @Test
    void mediaElementsParse() {
        StorageDocument document = parser.parse("""
            <h1><ac:emoticon ac:name="blue-star" ac:emoji-shortname=":star:" ac:emoji-id="2b50" ac:emoji-fallback="⭐" />&nbsp;API Documentation</h1>
            <p>Example image: <ac:image ac:width="150"><ri:attachment ri:filename="api-flow.png"/></ac:image></p>
            <p><ac:time ac:datetime="2024-01-15T10:30:00Z" /></p>
            """);

        Emoticon emoticon = document.findAll(Emoticon.class).get(0);
        assertEquals("blue-star", emoticon.name());
        Image image = document.findAll(Image.class).get(0);
        assertEquals("api-flow.png", image.filename());
        assertEquals(150, image.attributes().width());
        assertEquals("2024-01-15T10:30:00Z", document.findAll(Time.class).get(0).datetime());
        assertEquals(
            "⭐ API Documentation\n\nExample image: 🖼️ Image: api-flow.png\n\n📅 2024-01-15T10:30:00Z",
            document.text());
    }

    @Test
    void htmlImageAndCaptionParse() {
        StorageDocument document = parser.parse("""
            <p><img src="https://example.com/a.png" alt="Diagram"/></p>
            <ac:image ac:alt="Test image"><ac:caption>The caption</ac:caption></ac:image>
            """);

        List<Image> images = document.findAll(Image.class);
        assertEquals("https://example.com/a.png", images.get(0).src());
        assertEquals("🖼️ Image: Diagram", images.get(0).toText());
        assertEquals("🖼️ Image: Test image - The caption", images.get(1).toText());
    }

    @Test
    void userWrittenRootElementIsUnwrapped() {
        StorageDocument document = parser.parse("<root><p>inside</p></root>");

        assertThat(document.root()).isInstanceOf(Paragraph.class);
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void statusInsideParagraphRendersInline() {
        StorageDocument document = parser.parse("""
            <p>Current status: <ac:structured-macro ac:name="status">
                <ac:parameter ac:name="title">In Progress</ac:parameter>
                <ac:parameter ac:name="colour">Yellow</ac:parameter>
            </ac:structured-macro></p>
            """);

        assertEquals("Current status: 🏷️ Status: In Progress (Yellow)", document.text());
    }

    private static List<String> signature(StorageDocument document) {
        List<String> signature = new ArrayList<>();
        for (Node node : document.walk()) {
            signature.add(node.typeName() + "/" + node.kind() + "/" + node.path());
        }
        return signature;
    }
}
