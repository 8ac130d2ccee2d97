package com.al.cdanormalizer.util;

import com.al.cdanormalizer.exception.MalformedDocumentException;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DOM and XPath helpers for structured clinical documents.
 *
 * <p>
 * Builders, XPath instances and compiled expressions are not thread-safe, so
 * each worker thread keeps its own. Expressions use the prefixes {@code hl7},
 * {@code pharm}, {@code xsi} and {@code sdtc}.
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class CdaXml {

    public static final String HL7_NS = "urn:hl7-org:v3";
    public static final String PHARM_NS = "urn:hl7-org:pharm";
    public static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;
    public static final String SDTC_NS = "urn:hl7-org:sdtc";

    private static final Map<String, String> PREFIXES = Map.of(
            "hl7", HL7_NS,
            "cda", HL7_NS,
            "pharm", PHARM_NS,
            "xsi", XSI_NS,
            "sdtc", SDTC_NS);

    private static final NamespaceContext NAMESPACES = new NamespaceContext() {
        @Override
        public String getNamespaceURI(String prefix) {
            return PREFIXES.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
        }

        @Override
        public String getPrefix(String namespaceURI) {
            return PREFIXES.entrySet().stream()
                    .filter(e -> e.getValue().equals(namespaceURI))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(null);
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            String prefix = getPrefix(namespaceURI);
            return prefix == null ? Collections.emptyIterator() : List.of(prefix).iterator();
        }
    };

    // Hardened builder: no DTDs, no external entities.
    private static final ThreadLocal<DocumentBuilder> BUILDER = ThreadLocal.withInitial(() -> {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setValidating(false);
            f.setXIncludeAware(false);
            f.setExpandEntityReferences(false);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            return f.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Failed to init secure XML builder", e);
        }
    });

    private static final ThreadLocal<XPath> XPATH = ThreadLocal.withInitial(() -> {
        XPath xpath = XPathFactory.newInstance().newXPath();
        xpath.setNamespaceContext(NAMESPACES);
        return xpath;
    });

    private static final ThreadLocal<Map<String, XPathExpression>> COMPILED = ThreadLocal.withInitial(HashMap::new);

    private static final String NARRATIVE_INDEX_KEY = "cda.narrativeIndex";

    /**
     * Private constructor to prevent instantiation.
     */
    private CdaXml() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Parse structured markup into a namespace-aware DOM.
     *
     * @param content     raw document content
     * @param contentHash hash used to identify the document in the error
     * @return parsed document
     * @throws MalformedDocumentException if the content is not well-formed XML
     */
    public static Document parse(String content, String contentHash) {
        DocumentBuilder builder = BUILDER.get();
        try {
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException(contentHash,
                    "Document is not well-formed structured markup: " + e.getMessage(), e);
        } finally {
            builder.reset();
        }
    }

    /**
     * Compile an expression, failing with {@link IllegalArgumentException} when it is invalid.
     */
    public static XPathExpression compile(String expression) {
        Map<String, XPathExpression> cache = COMPILED.get();
        XPathExpression compiled = cache.get(expression);
        if (compiled == null) {
            try {
                compiled = XPATH.get().compile(expression);
            } catch (XPathExpressionException e) {
                throw new IllegalArgumentException("Invalid path expression: " + expression, e);
            }
            cache.put(expression, compiled);
        }
        return compiled;
    }

    public static List<Node> nodes(Node context, String expression) {
        XPathExpression compiled = compile(expression);
        try {
            NodeList list = (NodeList) compiled.evaluate(context, XPathConstants.NODESET);
            List<Node> result = new ArrayList<>(list.getLength());
            for (int i = 0; i < list.getLength(); i++) {
                result.add(list.item(i));
            }
            return result;
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Path expression does not select nodes: " + expression, e);
        }
    }

    public static List<Element> elements(Node context, String expression) {
        List<Element> result = new ArrayList<>();
        for (Node node : nodes(context, expression)) {
            if (node instanceof Element) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static Element firstElement(Node context, String expression) {
        List<Element> found = elements(context, expression);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * String value of an expression, trimmed, or {@code null} when empty.
     */
    public static String text(Node context, String expression) {
        try {
            return StringUtils.trimToNull((String) compile(expression).evaluate(context, XPathConstants.STRING));
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Path expression cannot be evaluated: " + expression, e);
        }
    }

    /**
     * Direct children of {@code parent} in the HL7 namespace with the given local name.
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && HL7_NS.equals(child.getNamespaceURI())
                    && localName.equals(child.getLocalName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Element firstChildElement(Element parent) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * Evaluate a path and read the first node that carries a value.
     * Attributes yield their text; elements are read as coded or quantity values.
     */
    public static Optional<ExtractedValue> readValue(Node context, String expression) {
        for (Node node : nodes(context, expression)) {
            ExtractedValue value = node instanceof Attr
                    ? ExtractedValue.text(((Attr) node).getValue())
                    : node instanceof Element ? readElement((Element) node) : ExtractedValue.text(node.getTextContent());
            if (value.isPresent()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Read an element in the order displayName, originalText, quantity, value,
     * translation, then its own text.
     */
    public static ExtractedValue readElement(Element element) {
        String code = attribute(element, "code");
        String codeSystem = attribute(element, "codeSystem");
        Element translation = firstChild(element, "translation");
        if (code == null && translation != null) {
            code = attribute(translation, "code");
            codeSystem = attribute(translation, "codeSystem");
        }

        String raw = attribute(element, "displayName");
        if (raw == null) {
            raw = originalText(element);
        }
        if (raw == null) {
            raw = quantity(element);
        }
        if (raw == null && translation != null) {
            raw = attribute(translation, "displayName");
        }
        if (raw == null && firstChildElement(element) == null) {
            raw = StringUtils.trimToNull(StringUtils.normalizeSpace(element.getTextContent()));
        }
        return new ExtractedValue(raw, code, codeSystem);
    }

    private static String originalText(Element element) {
        Element originalText = firstChild(element, "originalText");
        if (originalText == null) {
            return null;
        }
        Element reference = firstChild(originalText, "reference");
        String ref = reference != null ? attribute(reference, "value") : null;
        if (ref != null && ref.startsWith("#")) {
            String referenced = narrativeById(element.getOwnerDocument(), ref.substring(1));
            if (referenced != null) {
                return referenced;
            }
        }
        return StringUtils.trimToNull(StringUtils.normalizeSpace(originalText.getTextContent()));
    }

    private static String narrativeById(Document document, String id) {
        if (document == null || id.isEmpty()) {
            return null;
        }
        Element candidate = narrativeIndex(document).get(id);
        return candidate != null ? StringUtils.trimToNull(StringUtils.normalizeSpace(candidate.getTextContent())) : null;
    }

    /**
     * Elements by their {@code ID} attribute, built on first use and kept as user
     * data on the document. The first element wins on duplicate ids.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Element> narrativeIndex(Document document) {
        Object cached = document.getUserData(NARRATIVE_INDEX_KEY);
        if (cached != null) {
            return (Map<String, Element>) cached;
        }
        Map<String, Element> index = new HashMap<>();
        NodeList all = document.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            String id = element.getAttribute("ID");
            if (!id.isEmpty()) {
                index.putIfAbsent(id, element);
            }
        }
        document.setUserData(NARRATIVE_INDEX_KEY, index, null);
        return index;
    }

    private static String quantity(Element element) {
        String value = attribute(element, "value");
        if (value != null) {
            return withUnit(value, attribute(element, "unit"));
        }
        Element low = firstChild(element, "low");
        Element high = firstChild(element, "high");
        String lowValue = low != null && low.hasAttribute("unit") ? attribute(low, "value") : null;
        String highValue = high != null && high.hasAttribute("unit") ? attribute(high, "value") : null;
        if (lowValue != null && highValue != null && !lowValue.equals(highValue)) {
            return withUnit(lowValue + "-" + highValue, attribute(high, "unit"));
        }
        if (lowValue != null) {
            return withUnit(lowValue, attribute(low, "unit"));
        }
        if (highValue != null) {
            return withUnit(highValue, attribute(high, "unit"));
        }
        Element period = firstChild(element, "period");
        if (period != null && attribute(period, "value") != null) {
            return "every " + withUnit(attribute(period, "value"), attribute(period, "unit"));
        }
        return null;
    }

    private static String withUnit(String value, String unit) {
        return unit == null || "1".equals(unit) ? value : value + " " + unit;
    }

    private static Element firstChild(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && localName.equals(child.getLocalName())) {
                return (Element) child;
            }
        }
        return null;
    }

    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? StringUtils.trimToNull(element.getAttribute(name)) : null;
    }
}
