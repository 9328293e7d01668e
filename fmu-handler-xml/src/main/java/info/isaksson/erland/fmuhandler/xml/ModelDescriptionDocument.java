package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.DuplicateVariableException;
import info.isaksson.erland.fmuhandler.error.ModelDescriptionParseException;
import info.isaksson.erland.fmuhandler.error.VariableNotFoundException;
import info.isaksson.erland.fmuhandler.model.ScalarVariable;
import info.isaksson.erland.fmuhandler.model.ScalarVariableQuery;
import info.isaksson.erland.fmuhandler.model.StartValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory FMI 2.0 model description.
 *
 * <p>The parsed DOM tree is kept as the source of truth for everything that is not a
 * ScalarVariable. Each variable is held as an immutable {@link ScalarVariable} next to the
 * element it was read from; every mutation installs a new value and rewrites that element, so
 * {@link #toXmlBytes()} always reflects the model.</p>
 *
 * <p>Not thread safe.</p>
 */
public final class ModelDescriptionDocument {

    private static final Logger log = LoggerFactory.getLogger(ModelDescriptionDocument.class);

    public static final String ROOT_ELEMENT = "fmiModelDescription";
    public static final String MODEL_VARIABLES = "ModelVariables";
    public static final String MODEL_STRUCTURE = "ModelStructure";

    private static final class Entry {
        ScalarVariable variable;
        final Element element;

        Entry(ScalarVariable variable, Element element) {
            this.variable = variable;
            this.element = element;
        }
    }

    private final Document dom;
    private final Element modelVariables;
    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Entry> byName = new HashMap<>();

    private ModelDescriptionDocument(Document dom, Element modelVariables) {
        this.dom = dom;
        this.modelVariables = modelVariables;
    }

    /**
     * Parse the bytes of a {@code modelDescription.xml}.
     *
     * @throws info.isaksson.erland.fmuhandler.error.MalformedXmlException if the bytes are not well-formed XML
     * @throws ModelDescriptionParseException if the structure is not a usable model description
     * @throws info.isaksson.erland.fmuhandler.error.InvalidValueException if a start value does not match its type
     */
    public static ModelDescriptionDocument parse(byte[] xml) {
        Document dom = XmlDomUtil.parse(xml);
        Element root = dom.getDocumentElement();
        if (root == null || !ROOT_ELEMENT.equals(root.getTagName())) {
            throw new ModelDescriptionParseException("Root element must be <" + ROOT_ELEMENT + "> but was <"
                    + (root == null ? "" : root.getTagName()) + ">");
        }
        Element mv = XmlDomUtil.firstChildElement(root, MODEL_VARIABLES);
        if (mv == null) {
            throw new ModelDescriptionParseException("Missing <" + MODEL_VARIABLES + "> element");
        }

        ModelDescriptionDocument doc = new ModelDescriptionDocument(dom, mv);
        for (Element e : XmlDomUtil.childElements(mv)) {
            if (!ScalarVariableXml.ELEMENT.equals(e.getTagName())) {
                log.debug("Ignoring <{}> inside <{}>", e.getTagName(), MODEL_VARIABLES);
                continue;
            }
            ScalarVariable v = ScalarVariableXml.read(e);
            if (doc.byName.containsKey(v.name)) {
                throw new ModelDescriptionParseException("Duplicate ScalarVariable name: " + v.name, v.name);
            }
            Entry entry = new Entry(v, e);
            doc.entries.add(entry);
            doc.byName.put(v.name, entry);
        }
        if (doc.entries.isEmpty()) {
            throw new ModelDescriptionParseException("<" + MODEL_VARIABLES + "> contains no ScalarVariable");
        }
        log.debug("Parsed model description '{}' with {} scalar variables", doc.modelName(), doc.entries.size());
        return doc;
    }

    public String modelName() {
        return XmlDomUtil.attributeOrNull(dom.getDocumentElement(), "modelName");
    }

    public String guid() {
        return XmlDomUtil.attributeOrNull(dom.getDocumentElement(), "guid");
    }

    public String fmiVersion() {
        return XmlDomUtil.attributeOrNull(dom.getDocumentElement(), "fmiVersion");
    }

    /** All variables in document order. */
    public List<ScalarVariable> scalarVariables() {
        List<ScalarVariable> out = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            out.add(e.variable);
        }
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return entries.size();
    }

    public ScalarVariable getVariableByName(String name) {
        return entry(name).variable;
    }

    public Optional<ScalarVariable> findVariable(String name) {
        Entry e = name == null ? null : byName.get(name);
        return e == null ? Optional.empty() : Optional.of(e.variable);
    }

    public boolean containsVariable(String name) {
        return name != null && byName.containsKey(name);
    }

    /** Matching variables in document order. */
    public List<ScalarVariable> query(ScalarVariableQuery query) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        return entries.stream()
                .map(e -> e.variable)
                .filter(query::matches)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Replace the start value of a variable. The value is checked against the variable's type;
     * see {@link info.isaksson.erland.fmuhandler.model.ValueType#coerce}.
     *
     * @return the updated variable
     * @throws VariableNotFoundException if no variable has this name
     * @throws info.isaksson.erland.fmuhandler.error.InvalidValueException if the value does not fit the type
     */
    public ScalarVariable setStartValue(String name, Object value) {
        Entry e = entry(name);
        StartValue start = e.variable.valueType.coerce(name, value);
        ScalarVariable updated = e.variable.withStart(start);
        install(e, updated);
        log.debug("Set start of {} to {}", name, start.text);
        return updated;
    }

    /**
     * Apply {@code change} to a variable and store the result. The function may rename the
     * variable or change its value type.
     *
     * @return the updated variable
     * @throws VariableNotFoundException if no variable has this name
     * @throws DuplicateVariableException if the new name is taken by another variable
     */
    public ScalarVariable updateVariable(String name, UnaryOperator<ScalarVariable> change) {
        if (change == null) throw new IllegalArgumentException("change must not be null");
        Entry e = entry(name);
        ScalarVariable updated = change.apply(e.variable);
        if (updated == null) throw new IllegalArgumentException("change must not return null");
        if (!updated.name.equals(name)) {
            if (byName.containsKey(updated.name)) {
                throw new DuplicateVariableException(updated.name);
            }
            byName.remove(name);
            byName.put(updated.name, e);
        }
        install(e, updated);
        return updated;
    }

    /**
     * Append a variable after the last existing one.
     *
     * @throws DuplicateVariableException if the name is already used
     */
    public void addVariable(ScalarVariable variable) {
        if (variable == null) throw new IllegalArgumentException("variable must not be null");
        if (byName.containsKey(variable.name)) {
            throw new DuplicateVariableException(variable.name);
        }

        Element last = entries.isEmpty() ? null : entries.get(entries.size() - 1).element;
        String indent = last == null ? null : XmlDomUtil.leadingIndent(last);
        Element element = ScalarVariableXml.create(dom, variable, indent);

        Node anchor = last == null ? modelVariables.getFirstChild() : last.getNextSibling();
        if (indent != null) {
            modelVariables.insertBefore(dom.createTextNode(indent), anchor);
        }
        modelVariables.insertBefore(element, anchor);

        Entry entry = new Entry(variable, element);
        entries.add(entry);
        byName.put(variable.name, entry);
        log.debug("Added {}", variable);
    }

    /**
     * Remove a variable and its element.
     *
     * <p>Index based references in {@code <ModelStructure>} are not renumbered.</p>
     *
     * @return the removed variable
     * @throws VariableNotFoundException if no variable has this name
     */
    public ScalarVariable deleteVariable(String name) {
        Entry e = entry(name);
        int index = entries.indexOf(e);
        XmlDomUtil.removeWithIndent(e.element);
        entries.remove(index);
        byName.remove(name);
        if (XmlDomUtil.firstChildElement(dom.getDocumentElement(), MODEL_STRUCTURE) != null) {
            log.warn("Deleted ScalarVariable {} (index {}); <{}> references are not renumbered",
                    name, index + 1, MODEL_STRUCTURE);
        } else {
            log.debug("Deleted ScalarVariable {}", name);
        }
        return e.variable;
    }

    /** Deterministic UTF-8 serialization, see {@link ModelDescriptionWriter}. */
    public byte[] toXmlBytes() {
        return ModelDescriptionWriter.toBytes(dom);
    }

    public String toXmlString() {
        return ModelDescriptionWriter.toString(dom);
    }

    /** Validate the current state against the bundled FMI 2.0 schema. */
    public ValidationResult validate() {
        return validate(SchemaValidator.fmi2());
    }

    public ValidationResult validate(SchemaValidator validator) {
        if (validator == null) throw new IllegalArgumentException("validator must not be null");
        return validator.validate(toXmlBytes());
    }

    private Entry entry(String name) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        Entry e = byName.get(name);
        if (e == null) {
            throw new VariableNotFoundException(name);
        }
        return e;
    }

    private void install(Entry e, ScalarVariable updated) {
        ScalarVariableXml.write(updated, e.element);
        e.variable = updated;
    }
}
