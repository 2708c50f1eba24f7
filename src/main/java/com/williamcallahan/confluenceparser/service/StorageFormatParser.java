package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.StorageDocument;
import com.williamcallahan.confluenceparser.domain.node.Node;
import com.williamcallahan.confluenceparser.service.ingestion.MarkupIngestor;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Confluence storage-format markup into a {@link StorageDocument}.
 *
 * <p>Every call works on its own diagnostics and dispatcher, so one instance may be shared
 * between threads. Recoverable problems never stop the tree from being built; they are
 * attached to the document, or raised together at the end when {@code raiseOnFinish} is set.</p>
 */
public class StorageFormatParser {

    private static final Logger logger = LoggerFactory.getLogger(StorageFormatParser.class);

    private final boolean raiseOnFinish;
    private final MarkupIngestor ingestor = new MarkupIngestor();

    public StorageFormatParser() {
        this(false);
    }

    /**
     * Creates a parser.
     * @param raiseOnFinish whether a parse that recorded diagnostics throws instead of returning
     */
    public StorageFormatParser(boolean raiseOnFinish) {
        this.raiseOnFinish = raiseOnFinish;
    }

    public boolean isRaiseOnFinish() {
        return raiseOnFinish;
    }

    /**
     * Parses storage-format markup.
     *
     * @param markup markup fragment; may hold several top-level nodes
     * @return document with its tree, rendered text and diagnostics
     * @throws ParsingDiagnosticsException when {@code raiseOnFinish} is set and diagnostics were recorded
     */
    public StorageDocument parse(String markup) {
        Objects.requireNonNull(markup, "Markup cannot be null");
        if (markup.isBlank()) {
            logger.debug("Blank markup, returning an empty document");
            return StorageDocument.empty();
        }
        logger.debug("Parsing storage-format markup ({} chars)", markup.length());

        ParseDiagnostics diagnostics = new ParseDiagnostics();
        Element root = ingestor.ingest(markup, diagnostics);
        List<Node> content = new ElementDispatcher(diagnostics).parseChildren(root, ParseContext.ROOT);

        if (raiseOnFinish && !diagnostics.isEmpty()) {
            logger.debug("Parse finished with {} diagnostic(s), raising", diagnostics.size());
            throw new ParsingDiagnosticsException(diagnostics.snapshot());
        }
        StorageDocument document = StorageDocument.assemble(content, diagnostics.snapshot());
        logger.debug("Parsed {} top-level node(s) with {} diagnostic(s)", content.size(), diagnostics.size());
        return document;
    }
}
