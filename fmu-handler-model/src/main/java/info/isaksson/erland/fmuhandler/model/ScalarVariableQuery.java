package info.isaksson.erland.fmuhandler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Query-by-example over ScalarVariables.
 *
 * <p>Every criterion left {@code null} matches anything; a variable matches when all set
 * criteria match. {@link #any()} matches every variable.</p>
 *
 * <pre>{@code
 * doc.query(ScalarVariableQuery.any().withCausality(Causality.PARAMETER).withValueType(ValueType.REAL));
 * }</pre>
 */
public final class ScalarVariableQuery {

    private static final ScalarVariableQuery ANY =
            new ScalarVariableQuery(null, null, null, null, null, null, null, null, null);

    public final String name;
    public final Long valueReference;
    public final Causality causality;
    public final Variability variability;
    public final Initial initial;
    public final ValueType valueType;
    public final String description;
    /** Compared after coercion to the variable's type, so {@code 1} matches a Real start of {@code 1.0}. */
    public final Object start;
    public final Map<String, String> facets;

    private ScalarVariableQuery(
            String name,
            Long valueReference,
            Causality causality,
            Variability variability,
            Initial initial,
            ValueType valueType,
            String description,
            Object start,
            Map<String, String> facets
    ) {
        this.name = name;
        this.valueReference = valueReference;
        this.causality = causality;
        this.variability = variability;
        this.initial = initial;
        this.valueType = valueType;
        this.description = description;
        this.start = start;
        this.facets = facets == null || facets.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(facets));
    }

    public static ScalarVariableQuery any() {
        return ANY;
    }

    public static ScalarVariableQuery byName(String name) {
        return ANY.withName(name);
    }

    public ScalarVariableQuery withName(String name) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withValueReference(long valueReference) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withCausality(Causality causality) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withVariability(Variability variability) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withInitial(Initial initial) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withValueType(ValueType valueType) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withDescription(String description) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withStart(Object start) {
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, facets);
    }

    public ScalarVariableQuery withFacet(String key, String value) {
        Map<String, String> f = new LinkedHashMap<>(facets);
        f.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return new ScalarVariableQuery(name, valueReference, causality, variability, initial, valueType, description, start, f);
    }

    /**
     * Causality is compared against the declared attribute, not the FMI default, so a query for
     * {@link Causality#LOCAL} does not match variables without a causality attribute.
     */
    public boolean matches(ScalarVariable v) {
        if (v == null) return false;
        if (name != null && !name.equals(v.name)) return false;
        if (valueReference != null && valueReference != v.valueReference) return false;
        if (causality != null && causality != v.causality) return false;
        if (variability != null && variability != v.variability) return false;
        if (initial != null && initial != v.initial) return false;
        if (valueType != null && valueType != v.valueType) return false;
        if (description != null && !description.equals(v.description)) return false;
        if (start != null) {
            if (v.start == null) return false;
            StartValue wanted = v.valueType.tryCoerce(start);
            if (!v.start.equals(wanted)) return false;
        }
        for (Map.Entry<String, String> e : facets.entrySet()) {
            if (!e.getValue().equals(v.facets.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ScalarVariableQuery{");
        if (name != null) sb.append("name=").append(name).append(';');
        if (valueReference != null) sb.append("valueReference=").append(valueReference).append(';');
        if (causality != null) sb.append("causality=").append(causality.xmlValue).append(';');
        if (variability != null) sb.append("variability=").append(variability.xmlValue).append(';');
        if (initial != null) sb.append("initial=").append(initial.xmlValue).append(';');
        if (valueType != null) sb.append("valueType=").append(valueType.xmlName).append(';');
        if (description != null) sb.append("description=").append(description).append(';');
        if (start != null) sb.append("start=").append(start).append(';');
        if (!facets.isEmpty()) sb.append("facets=").append(facets).append(';');
        return sb.append('}').toString();
    }
}
