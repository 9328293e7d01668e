package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.MalformedXmlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Small DOM helpers shared by the document and the ScalarVariable mapping.
 *
 * <p>Parsing keeps comments, whitespace and CDATA sections so that everything the model does not
 * own survives a round trip. DOCTYPE declarations are rejected.</p>
 */
final class XmlDomUtil {

    private static final Logger log = LoggerFactory.getLogger(XmlDomUtil.class);

    private XmlDomUtil() {}

    /** A new builder per call; DocumentBuilder is not thread safe. */
    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setIgnoringComments(false);
            dbf.setCoalescing(false);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DocumentBuilder db = dbf.newDocumentBuilder();
            db.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Unable to create an XML parser", e);
        }
    }

    static Document parse(byte[] xml) {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        try {
            return newDocumentBuilder().parse(new ByteArrayInputStream(xml));
        } catch (SAXParseException e) {
            throw new MalformedXmlException("modelDescription.xml is not well-formed: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new MalformedXmlException("modelDescription.xml is not well-formed: " + e.getMessage(), -1, -1, e);
        } catch (IOException e) {
            // reading from a byte array
            throw new UncheckedIOException(e);
        }
    }

    static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                out.add((Element) n);
            }
        }
        return out;
    }

    static Element firstChildElement(Element parent, String tagName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && tagName.equals(((Element) n).getTagName())) {
                return (Element) n;
            }
        }
        return null;
    }

    static String attributeOrNull(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    static boolean isWhitespaceText(Node n) {
        return n != null && n.getNodeType() == Node.TEXT_NODE && n.getNodeValue().isBlank();
    }

    /** The whitespace text directly before {@code e}, or {@code null} when the element is not indented. */
    static String leadingIndent(Element e) {
        Node prev = e.getPreviousSibling();
        return isWhitespaceText(prev) ? prev.getNodeValue() : null;
    }

    /** Remove an element together with the indentation text in front of it. */
    static void removeWithIndent(Element e) {
        Node parent = e.getParentNode();
        if (parent == null) return;
        Node prev = e.getPreviousSibling();
        if (isWhitespaceText(prev)) {
            parent.removeChild(prev);
        }
        parent.removeChild(e);
    }
}
