package com.williamcallahan.confluenceparser.service.ingestion;

import com.williamcallahan.confluenceparser.service.ParseDiagnostics;
import com.williamcallahan.confluenceparser.support.SurrogateRepair;
import java.io.IOException;
import java.io.StringReader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Turns raw storage-format markup into a jsoup element whose children are the top-level content.
 *
 * <p>The markup is first checked as namespace-aware XML inside a synthetic root that
 * declares the three storage-format prefixes. Well-formed markup is then built with
 * jsoup's XML parser so element names, CDATA and whitespace survive unchanged. Markup
 * that is not well-formed is recorded as a diagnostic and re-read with jsoup's lenient
 * HTML parser.</p>
 */
public final class MarkupIngestor {

    public static final String MACRO_NAMESPACE = "http://atlassian.com/content";
    public static final String RESOURCE_IDENTIFIER_NAMESPACE = "http://atlassian.com/resource/identifier";
    public static final String TEMPLATE_NAMESPACE = "http://atlassian.com/template";

    static final String ROOT_TAG = "confluence-root";

    private static final Logger logger = LoggerFactory.getLogger(MarkupIngestor.class);

    private static final String ROOT_OPEN = "<" + ROOT_TAG
        + " xmlns:ac=\"" + MACRO_NAMESPACE + "\""
        + " xmlns:ri=\"" + RESOURCE_IDENTIFIER_NAMESPACE + "\""
        + " xmlns:at=\"" + TEMPLATE_NAMESPACE + "\">";
    private static final String ROOT_CLOSE = "</" + ROOT_TAG + ">";

    private static final Pattern XML_DECLARATION = Pattern.compile("^\\s*<\\?xml[^>]*\\?>");
    private static final Pattern CDATA_SECTION = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern NAMED_ENTITY = Pattern.compile("&([A-Za-z][A-Za-z0-9]*);");

    /**
     * Ingests markup.
     *
     * @param markup storage-format markup, possibly a fragment with several top-level nodes
     * @param diagnostics receives {@code XML parsing failed: <message>} when the lenient path is taken
     * @return container element holding the parsed top-level nodes
     */
    public Element ingest(String markup, ParseDiagnostics diagnostics) {
        String repaired = XML_DECLARATION.matcher(SurrogateRepair.stripUnpaired(markup)).replaceFirst("");
        String wrapped = ROOT_OPEN + translateHtmlEntities(repaired) + ROOT_CLOSE;
        try {
            checkWellFormed(wrapped);
        } catch (SAXException | IOException failure) {
            diagnostics.add("XML parsing failed: " + failure.getMessage());
            logger.warn("Strict XML parse failed, falling back to lenient HTML parsing: {}", failure.getMessage());
            return parseLeniently(repaired);
        }
        Document document = Jsoup.parse(wrapped, "", Parser.xmlParser());
        Element root = document.children().first();
        if (root == null) {
            throw new IllegalStateException("XML parser produced no root element for well-formed markup");
        }
        return root;
    }

    private static void checkWellFormed(String wrapped) throws SAXException, IOException {
        DocumentBuilder builder = newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                logger.debug("XML parser warning: {}", exception.getMessage());
            }

            @Override
            public void error(SAXParseException exception) throws SAXException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXException {
                throw exception;
            }
        });
        builder.parse(new InputSource(new StringReader(wrapped)));
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setNamespaceAware(true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException configurationFailure) {
            throw new IllegalStateException("XML parser does not support the required features", configurationFailure);
        }
    }

    private static Element parseLeniently(String markup) {
        Document document = Jsoup.parseBodyFragment(cdataToText(markup));
        return document.body();
    }

    /**
     * Rewrites HTML named entities (e.g. {@code &nbsp;}) as numeric character references
     * so that XML accepts them. The five XML entities and CDATA sections are left as is.
     */
    static String translateHtmlEntities(String markup) {
        if (markup.indexOf('&') < 0) {
            return markup;
        }
        StringBuilder translated = new StringBuilder(markup.length());
        Matcher cdata = CDATA_SECTION.matcher(markup);
        int cursor = 0;
        while (cdata.find()) {
            translated.append(translateEntitiesOutsideCdata(markup.substring(cursor, cdata.start())));
            translated.append(cdata.group());
            cursor = cdata.end();
        }
        translated.append(translateEntitiesOutsideCdata(markup.substring(cursor)));
        return translated.toString();
    }

    private static String translateEntitiesOutsideCdata(String segment) {
        Matcher entity = NAMED_ENTITY.matcher(segment);
        StringBuilder translated = new StringBuilder(segment.length());
        while (entity.find()) {
            String name = entity.group(1);
            String replacement = entity.group();
            if (!isXmlEntity(name) && Entities.isNamedEntity(name)) {
                StringBuilder references = new StringBuilder();
                Entities.getByName(name).codePoints()
                    .forEach(codePoint -> references.append("&#").append(codePoint).append(';'));
                replacement = references.toString();
            }
            entity.appendReplacement(translated, Matcher.quoteReplacement(replacement));
        }
        entity.appendTail(translated);
        return translated.toString();
    }

    private static boolean isXmlEntity(String name) {
        return switch (name) {
            case "amp", "lt", "gt", "quot", "apos" -> true;
            default -> false;
        };
    }

    /**
     * The HTML parser treats CDATA as a bogus comment, so sections are replaced by their
     * escaped text before lenient parsing.
     */
    private static String cdataToText(String markup) {
        Matcher cdata = CDATA_SECTION.matcher(markup);
        StringBuilder converted = new StringBuilder(markup.length());
        while (cdata.find()) {
            String escaped = Entities.escape(cdata.group(1), new Document.OutputSettings());
            cdata.appendReplacement(converted, Matcher.quoteReplacement(escaped));
        }
        cdata.appendTail(converted);
        return converted.toString();
    }
}
