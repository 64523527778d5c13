package me.christianrobert.cnxpretext.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the JAXP DOM parser.
 * Parses CNXML text into an immutable {@link SourceNode} tree and collects
 * well-formedness errors instead of throwing them.
 *
 * <p>The DOM is namespace aware (content, MathML and metadata namespaces must stay
 * distinguishable) and never resolves external DTDs or entities.</p>
 *
 * <p>Comments and processing instructions are dropped. Text and CDATA are kept,
 * with text following an element stored as that element's tail.</p>
 *
 * Note: Uses @Dependent scope because it is stateless and is both injected
 * (services) and instantiated with new (tests).
 */
@Dependent
public class CnxmlParser {

    private static final Logger log = LoggerFactory.getLogger(CnxmlParser.class);

    /**
     * Parses a complete CNXML document.
     *
     * @param source document text
     * @return ParseResult holding the root element, or the errors if the input is not well-formed
     */
    public ParseResult parse(String source) {
        List<String> errors = new ArrayList<>();
        if (source == null || source.isBlank()) {
            errors.add("Document is empty");
            return new ParseResult(null, errors, source);
        }

        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new CollectingErrorHandler(errors));
            Document document = builder.parse(new InputSource(new StringReader(source)));

            if (!errors.isEmpty()) {
                return new ParseResult(null, errors, source);
            }

            SourceNode root = toSourceNode(document.getDocumentElement(), "");
            log.trace("Parsed CNXML document with root element {}", root.getLocalName());
            return new ParseResult(root, errors, source);

        } catch (SAXParseException e) {
            String message = formatError(e);
            if (!errors.contains(message)) {
                errors.add(message);
            }
            log.debug("CNXML parse failed: {}", message);
            return new ParseResult(null, errors, source);

        } catch (SAXException | IOException e) {
            errors.add("Parse failed: " + e.getMessage());
            log.debug("CNXML parse failed", e);
            return new ParseResult(null, errors, source);

        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setExpandEntityReferences(true);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newDocumentBuilder();
    }

    /**
     * Converts a DOM element to a SourceNode. Text nodes between child elements
     * become the tail of the preceding element.
     */
    private SourceNode toSourceNode(Element element, String tail) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            String name = attr.getLocalName() != null ? attr.getLocalName() : attr.getName();
            attributes.put(name, attr.getValue());
        }

        StringBuilder leading = new StringBuilder();
        List<Element> childElements = new ArrayList<>();
        List<StringBuilder> tails = new ArrayList<>();

        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE -> {
                    childElements.add((Element) node);
                    tails.add(new StringBuilder());
                }
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                    StringBuilder target = tails.isEmpty() ? leading : tails.get(tails.size() - 1);
                    target.append(node.getNodeValue());
                }
                default -> {
                    // comments and processing instructions carry no content
                }
            }
        }

        List<SourceNode> children = new ArrayList<>(childElements.size());
        for (int i = 0; i < childElements.size(); i++) {
            children.add(toSourceNode(childElements.get(i), tails.get(i).toString()));
        }

        String localName = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        return new SourceNode(element.getNamespaceURI(), localName, attributes, leading.toString(), children, tail);
    }

    private static String formatError(SAXParseException e) {
        return "line " + e.getLineNumber() + ":" + e.getColumnNumber() + " " + e.getMessage();
    }

    /**
     * Records recoverable errors; fatal errors are rethrown so parsing stops.
     */
    private static class CollectingErrorHandler implements ErrorHandler {

        private final List<String> errors;

        CollectingErrorHandler(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void warning(SAXParseException exception) {
            log.trace("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            errors.add(formatError(exception));
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXParseException {
            errors.add(formatError(exception));
            throw exception;
        }
    }
}
