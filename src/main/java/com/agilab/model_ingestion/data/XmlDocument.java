package com.agilab.model_ingestion.data;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Handle over a decoded XML model document that answers XPath queries.
 *
 * <p>When the document was read with a namespace, that namespace is bound to the {@code ns} prefix,
 * so queries look like {@code //ns:t_object[ns:name='Gen1']}.</p>
 */
public final class XmlDocument {

    public static final String NAMESPACE_PREFIX = "ns";

    private final Path source;
    private final Document document;
    private final String namespace;
    private final String model;

    public XmlDocument(Path source, Document document, String namespace, String model) {
        this.source = source;
        this.document = document;
        this.namespace = namespace;
        this.model = model;
    }

    public Path getSource() {
        return source;
    }

    public Document getDocument() {
        return document;
    }

    public Element getRoot() {
        return document.getDocumentElement();
    }

    public Optional<String> getNamespace() {
        return Optional.ofNullable(namespace);
    }

    /**
     * Model name the document was opened for, when the reader was given one.
     */
    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    public List<Element> query(String expression) {
        var nodes = (NodeList) evaluate(expression, XPathConstants.NODESET);
        var elements = new ArrayList<Element>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) nodes.item(i));
            }
        }
        return elements;
    }

    public Optional<String> queryText(String expression) {
        var node = (Node) evaluate(expression, XPathConstants.NODE);
        return Optional.ofNullable(node).map(Node::getTextContent).map(String::trim);
    }

    private Object evaluate(String expression, javax.xml.namespace.QName returnType) {
        try {
            return newXPath().evaluate(expression, document, returnType);
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Invalid XPath expression: " + expression, e);
        }
    }

    // XPath instances are not thread safe, so each query gets its own
    private XPath newXPath() {
        var xpath = XPathFactory.newInstance().newXPath();
        if (namespace != null) {
            xpath.setNamespaceContext(new SingleNamespaceContext(namespace));
        }
        return xpath;
    }

    @Override
    public String toString() {
        return "XmlDocument(" + source + ")";
    }

    private record SingleNamespaceContext(String uri) implements NamespaceContext {

        @Override
        public String getNamespaceURI(String prefix) {
            return NAMESPACE_PREFIX.equals(prefix) ? uri : XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceUri) {
            return uri.equals(namespaceUri) ? NAMESPACE_PREFIX : null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceUri) {
            return uri.equals(namespaceUri)
                    ? List.of(NAMESPACE_PREFIX).iterator()
                    : Collections.emptyIterator();
        }
    }
}
