package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.StorageDocument;
import com.williamcallahan.confluenceparser.domain.node.DecisionList;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItem;
import com.williamcallahan.confluenceparser.domain.node.DecisionListItemState;
import com.williamcallahan.confluenceparser.domain.node.PanelMacro;
import com.williamcallahan.confluenceparser.domain.node.PanelMacroType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Verifies embedded ADF nodes map onto decision lists and panels.
 */
class AdfBridgeTest {

    private final StorageFormatParser parser = new StorageFormatParser();

    @Test
    @DisplayName("A decision list with no direct items is filled from the fallback markup")
    void decisionListFromFallback() {
        StorageDocument document = parser.parse("""
            <ac:adf-extension>
              <ac:adf-node type="decision-list">
                <ac:adf-attribute key="local-id">dec-1</ac:adf-attribute>
              </ac:adf-node>
              <ac:adf-fallback>
                <div><ul class="decision-list"><li data-decision-state="DECIDED">Decision</li></ul></div>
              </ac:adf-fallback>
            </ac:adf-extension>
            """);

        DecisionList list = (DecisionList) document.root();
        assertEquals("dec-1", list.localId());
        assertThat(list.items()).hasSize(1);
        assertEquals(DecisionListItemState.DECIDED, list.items().get(0).state());
        assertEquals("✅ Decision", document.text());
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void decisionListReadsDirectListItems() {
        StorageDocument document = parser.parse(
            "<ac:adf-node type=\"decision-list\"><ul><li>Direct decision</li></ul></ac:adf-node>");

        DecisionListItem item = document.findAll(DecisionListItem.class).get(0);
        assertNull(item.state());
        assertEquals("⏳ Direct decision", document.text());
    }

    @Test
    void decisionItemNodesCarryStateAndLocalId() {
        StorageDocument document = parser.parse("""
            <ac:adf-node type="decision-list">
              <ac:adf-attribute key="local-id">list-1</ac:adf-attribute>
              <ac:adf-attribute key="state">PENDING</ac:adf-attribute>
              <ac:adf-node type="decision-item">
                <ac:adf-attribute key="local-id">item-1</ac:adf-attribute>
                <ac:adf-attribute key="state">DECIDED</ac:adf-attribute>
                <ac:adf-content>Ship v2</ac:adf-content>
              </ac:adf-node>
              <ac:adf-node type="decision-item">
                <ac:adf-attribute key="local-id">item-2</ac:adf-attribute>
                <ac:adf-content>Drop v1</ac:adf-content>
              </ac:adf-node>
            </ac:adf-node>
            """);

        DecisionList list = (DecisionList) document.root();
        assertThat(list.items()).extracting(DecisionListItem::localId).containsExactly("item-1", "item-2");
        assertThat(list.items()).extracting(DecisionListItem::state)
            .containsExactly(DecisionListItemState.DECIDED, DecisionListItemState.PENDING);
        assertEquals("✅ Ship v2\n⏳ Drop v1", document.text());
    }

    @Test
    void emptyDecisionListHasPlaceholderText() {
        StorageDocument document = parser.parse("<ac:adf-node type=\"decision-list\"/>");

        assertEquals("📋 Decision List", document.text());
    }

    @Test
    void adfPanelMapsPanelType() {
        StorageDocument document = parser.parse("""
            <ac:adf-extension>
              <ac:adf-node type="panel">
                <ac:adf-attribute key="panel-type">note</ac:adf-attribute>
                <ac:adf-attribute key="bg-color">#EAE6FF</ac:adf-attribute>
                <ac:adf-content><p>Careful</p></ac:adf-content>
              </ac:adf-node>
              <ac:adf-fallback><div><p>Ignored fallback</p></div></ac:adf-fallback>
            </ac:adf-extension>
            """);

        PanelMacro panel = (PanelMacro) document.root();
        assertEquals(PanelMacroType.NOTE, panel.panelType());
        assertEquals("#EAE6FF", panel.style().bgColor());
        assertEquals("macro:panel", panel.kind());
        assertEquals("📝 NOTE: Careful", document.text());
    }

    @Test
    void emptyAdfPanelFallsBackToFallbackMarkup() {
        StorageDocument document = parser.parse("""
            <ac:adf-extension>
              <ac:adf-node type="panel"><ac:adf-attribute key="panel-type">warning</ac:adf-attribute></ac:adf-node>
              <ac:adf-fallback><p>From fallback</p></ac:adf-fallback>
            </ac:adf-extension>
            """);

        assertEquals("⚠️ WARNING: From fallback", document.text());
    }

    @Test
    void unknownAdfTypeIsDiagnosed() {
        StorageDocument document = parser.parse(
            "<ac:adf-extension><ac:adf-node type=\"custom\"/></ac:adf-extension>");

        assertNull(document.root());
        assertEquals(List.of("unknown_adf_node_type:custom"), document.diagnostics());
    }

    @Test
    void extensionWithoutNodeProducesNothing() {
        StorageDocument document = parser.parse(
            "<ac:adf-extension><ac:adf-fallback><p>Only fallback</p></ac:adf-fallback></ac:adf-extension>");

        assertNull(document.root());
        assertThat(document.diagnostics()).isEmpty();
    }
}
