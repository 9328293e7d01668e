package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.ModelDescriptionParseException;
import info.isaksson.erland.fmuhandler.model.Causality;
import info.isaksson.erland.fmuhandler.model.Initial;
import info.isaksson.erland.fmuhandler.model.ScalarVariable;
import info.isaksson.erland.fmuhandler.model.StartValue;
import info.isaksson.erland.fmuhandler.model.ValueType;
import info.isaksson.erland.fmuhandler.model.Variability;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@code <ScalarVariable>} element to a {@link ScalarVariable} and back.
 *
 * <p>Reading captures every attribute of the element and of its typed child. Writing only
 * touches those two elements; other children (such as {@code <Annotations>}) stay in place.</p>
 */
public final class ScalarVariableXml {

    public static final String ELEMENT = "ScalarVariable";

    private ScalarVariableXml() {}

    /**
     * @throws ModelDescriptionParseException if a required attribute is missing, an enum literal is
     *         unknown, or the element does not have exactly one typed value child
     * @throws info.isaksson.erland.fmuhandler.error.InvalidValueException if {@code start} is not a
     *         literal of the declared type
     */
    public static ScalarVariable read(Element element) {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        if (!ELEMENT.equals(element.getTagName())) {
            throw new ModelDescriptionParseException("Expected <" + ELEMENT + "> but found <" + element.getTagName() + ">");
        }

        String name = XmlDomUtil.attributeOrNull(element, "name");
        if (name == null || name.isBlank()) {
            throw new ModelDescriptionParseException("ScalarVariable without name attribute"
                    + describeValueReference(element));
        }

        String vrText = XmlDomUtil.attributeOrNull(element, "valueReference");
        if (vrText == null) {
            throw new ModelDescriptionParseException("Missing valueReference attribute", name);
        }
        long valueReference;
        try {
            valueReference = Long.parseLong(vrText.trim());
        } catch (NumberFormatException e) {
            throw new ModelDescriptionParseException("valueReference is not a number: " + vrText, name, e);
        }
        if (valueReference < 0 || valueReference > ScalarVariable.MAX_VALUE_REFERENCE) {
            throw new ModelDescriptionParseException("valueReference out of unsigned 32-bit range: " + vrText, name);
        }

        Element typed = typedChild(element, name);
        ValueType valueType = ValueType.fromXmlName(typed.getTagName());

        ScalarVariable.Builder b = ScalarVariable.builder(name, valueReference, valueType)
                .description(XmlDomUtil.attributeOrNull(element, "description"));
        try {
            String v = XmlDomUtil.attributeOrNull(element, "causality");
            if (v != null) b.causality(Causality.fromXml(v));
            v = XmlDomUtil.attributeOrNull(element, "variability");
            if (v != null) b.variability(Variability.fromXml(v));
            v = XmlDomUtil.attributeOrNull(element, "initial");
            if (v != null) b.initial(Initial.fromXml(v));
        } catch (IllegalArgumentException e) {
            throw new ModelDescriptionParseException(e.getMessage(), name, e);
        }

        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (!ScalarVariable.MODELED_ATTRIBUTES.contains(a.getName())) {
                b.attribute(a.getName(), a.getValue());
            }
        }

        NamedNodeMap typedAttrs = typed.getAttributes();
        for (int i = 0; i < typedAttrs.getLength(); i++) {
            Attr a = (Attr) typedAttrs.item(i);
            if ("start".equals(a.getName())) {
                b.start(valueType.parseStart(name, a.getValue()));
            } else {
                b.facet(a.getName(), a.getValue());
            }
        }
        return b.build();
    }

    /**
     * Write the state of {@code variable} into an existing {@code <ScalarVariable>} element.
     * When the value type changed, the typed child is replaced by an element of the new type at
     * the same position.
     */
    public static void write(ScalarVariable variable, Element element) {
        if (variable == null) throw new IllegalArgumentException("variable must not be null");
        if (element == null) throw new IllegalArgumentException("element must not be null");

        clearAttributes(element);
        writeAttributes(variable, element);

        Element typed = findTypedChild(element);
        if (typed == null) {
            typed = element.getOwnerDocument().createElement(variable.valueType.xmlName);
            element.insertBefore(typed, element.getFirstChild());
        } else if (!typed.getTagName().equals(variable.valueType.xmlName)) {
            Element replacement = element.getOwnerDocument().createElement(variable.valueType.xmlName);
            while (typed.getFirstChild() != null) {
                replacement.appendChild(typed.getFirstChild());
            }
            element.replaceChild(replacement, typed);
            typed = replacement;
        }
        clearAttributes(typed);
        writeTypedAttributes(variable, typed);
    }

    /**
     * Build a new element for {@code variable}. With a non-null {@code indent} (the whitespace
     * placed in front of sibling ScalarVariables) the typed child is put on its own line.
     */
    public static Element create(Document doc, ScalarVariable variable, String indent) {
        Element element = doc.createElement(ELEMENT);
        writeAttributes(variable, element);
        Element typed = doc.createElement(variable.valueType.xmlName);
        writeTypedAttributes(variable, typed);
        if (indent != null) {
            element.appendChild(doc.createTextNode(indent + "  "));
            element.appendChild(typed);
            element.appendChild(doc.createTextNode(indent));
        } else {
            element.appendChild(typed);
        }
        return element;
    }

    private static void writeAttributes(ScalarVariable v, Element element) {
        element.setAttribute("name", v.name);
        element.setAttribute("valueReference", Long.toString(v.valueReference));
        if (v.description != null) element.setAttribute("description", v.description);
        if (v.causality != null) element.setAttribute("causality", v.causality.xmlValue);
        if (v.variability != null) element.setAttribute("variability", v.variability.xmlValue);
        if (v.initial != null) element.setAttribute("initial", v.initial.xmlValue);
        for (Map.Entry<String, String> e : v.otherAttributes.entrySet()) {
            element.setAttribute(e.getKey(), e.getValue());
        }
    }

    private static void writeTypedAttributes(ScalarVariable v, Element typed) {
        for (Map.Entry<String, String> e : v.facets.entrySet()) {
            typed.setAttribute(e.getKey(), e.getValue());
        }
        StartValue start = v.start;
        if (start != null) {
            typed.setAttribute("start", start.text);
        }
    }

    private static void clearAttributes(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        List<Attr> toRemove = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            toRemove.add((Attr) attrs.item(i));
        }
        for (Attr a : toRemove) {
            element.removeAttributeNode(a);
        }
    }

    private static Element typedChild(Element element, String name) {
        Element found = null;
        Element firstUnknown = null;
        for (Element child : XmlDomUtil.childElements(element)) {
            if (ValueType.fromXmlName(child.getTagName()) != null) {
                if (found != null) {
                    throw new ModelDescriptionParseException("More than one typed value element (<"
                            + found.getTagName() + "> and <" + child.getTagName() + ">)", name);
                }
                found = child;
            } else if (firstUnknown == null && !"Annotations".equals(child.getTagName())) {
                firstUnknown = child;
            }
        }
        if (found == null) {
            if (firstUnknown != null) {
                throw new ModelDescriptionParseException("Unrecognized value element <" + firstUnknown.getTagName()
                        + "> (expected Real, Integer, Boolean, String or Enumeration)", name);
            }
            throw new ModelDescriptionParseException("Missing typed value element (Real, Integer, Boolean, String or Enumeration)", name);
        }
        return found;
    }

    private static Element findTypedChild(Element element) {
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && ValueType.fromXmlName(((Element) n).getTagName()) != null) {
                return (Element) n;
            }
        }
        return null;
    }

    private static String describeValueReference(Element element) {
        String vr = XmlDomUtil.attributeOrNull(element, "valueReference");
        return vr == null ? "" : " (valueReference " + vr + ")";
    }
}
