package info.isaksson.erland.fmuhandler.xml;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.ProcessingInstruction;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic serialization of a model description DOM.
 *
 * <p>Output rules:</p>
 * <ul>
 *   <li>fixed declaration {@code <?xml version="1.0" encoding="UTF-8"?>} followed by a newline,</li>
 *   <li>attributes sorted by name, always double quoted,</li>
 *   <li>elements without children are self-closed,</li>
 *   <li>text, comments, CDATA sections and processing instructions are written as stored, so
 *       indentation of the source document is kept,</li>
 *   <li>every top-level node is followed by a newline.</li>
 * </ul>
 *
 * <p>We write the tree ourselves instead of using a {@code Transformer}, whose indentation and
 * attribute order differ between JDK versions.</p>
 */
public final class ModelDescriptionWriter {

    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private ModelDescriptionWriter() {}

    public static byte[] toBytes(Document doc) {
        return toString(doc).getBytes(StandardCharsets.UTF_8);
    }

    public static String toString(Document doc) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        StringBuilder out = new StringBuilder(16 * 1024);
        out.append(DECLARATION).append('\n');
        for (Node n = doc.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.DOCUMENT_TYPE_NODE) continue;
            writeNode(n, out);
            out.append('\n');
        }
        return out.toString();
    }

    private static void writeNode(Node n, StringBuilder out) {
        switch (n.getNodeType()) {
            case Node.ELEMENT_NODE:
                writeElement((Element) n, out);
                break;
            case Node.TEXT_NODE:
                escapeText(n.getNodeValue(), out);
                break;
            case Node.CDATA_SECTION_NODE:
                out.append("<![CDATA[").append(n.getNodeValue()).append("]]>");
                break;
            case Node.COMMENT_NODE:
                out.append("<!--").append(n.getNodeValue()).append("-->");
                break;
            case Node.PROCESSING_INSTRUCTION_NODE:
                ProcessingInstruction pi = (ProcessingInstruction) n;
                out.append("<?").append(pi.getTarget());
                if (pi.getData() != null && !pi.getData().isEmpty()) {
                    out.append(' ').append(pi.getData());
                }
                out.append("?>");
                break;
            case Node.ENTITY_REFERENCE_NODE:
                out.append('&').append(n.getNodeName()).append(';');
                break;
            default:
                throw new IllegalStateException("Unsupported DOM node type " + n.getNodeType() + " (" + n.getNodeName() + ")");
        }
    }

    private static void writeElement(Element e, StringBuilder out) {
        out.append('<').append(e.getTagName());

        NamedNodeMap attrs = e.getAttributes();
        Map<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            sorted.put(a.getName(), a.getValue());
        }
        for (Map.Entry<String, String> a : sorted.entrySet()) {
            out.append(' ').append(a.getKey()).append("=\"");
            escapeAttr(a.getValue(), out);
            out.append('"');
        }

        if (!e.hasChildNodes()) {
            out.append("/>");
            return;
        }
        out.append('>');
        for (Node c = e.getFirstChild(); c != null; c = c.getNextSibling()) {
            writeNode(c, out);
        }
        out.append("</").append(e.getTagName()).append('>');
    }

    static void escapeAttr(String s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\t': out.append("&#9;"); break;
                case '\n': out.append("&#10;"); break;
                case '\r': out.append("&#13;"); break;
                default: out.append(c);
            }
        }
    }

    static void escapeText(String s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '\r': out.append("&#13;"); break;
                default: out.append(c);
            }
        }
    }
}
