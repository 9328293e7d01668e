package info.isaksson.erland.fmuhandler.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * One {@code <ScalarVariable>} of an FMI 2.0 model description.
 *
 * <p>Immutable. Changes are made by building a modified copy ({@code with...} methods or
 * {@link #toBuilder()}) and handing it to the owning document, which keeps the XML element in
 * sync. Equality is by {@link #name} only, since names are unique within a document.</p>
 *
 * <p>Attributes that are not modeled explicitly are never dropped: {@link #otherAttributes}
 * holds the remaining attributes of the {@code <ScalarVariable>} element and {@link #facets} the
 * attributes of the typed child other than {@code start} ({@code unit}, {@code min},
 * {@code max}, {@code declaredType}, ...), both as raw text.</p>
 */
public final class ScalarVariable {

    /** Attributes of the ScalarVariable element that have typed fields. */
    public static final Set<String> MODELED_ATTRIBUTES =
            Set.of("name", "valueReference", "description", "causality", "variability", "initial");

    public static final long MAX_VALUE_REFERENCE = 0xFFFFFFFFL;

    public final String name;
    public final long valueReference;
    public final String description;
    /** {@code null} when the attribute is absent; see {@link #effectiveCausality()}. */
    public final Causality causality;
    public final Variability variability;
    public final Initial initial;
    public final ValueType valueType;
    /** {@code null} when the typed child has no {@code start} attribute. */
    public final StartValue start;
    public final Map<String, String> facets;
    public final Map<String, String> otherAttributes;

    private ScalarVariable(Builder b) {
        if (b.name == null || b.name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (b.valueReference < 0 || b.valueReference > MAX_VALUE_REFERENCE) {
            throw new IllegalArgumentException("valueReference out of unsigned 32-bit range: " + b.valueReference);
        }
        if (b.valueType == null) {
            throw new IllegalArgumentException("valueType must not be null");
        }
        if (b.start != null && b.start.type != b.valueType) {
            throw new IllegalArgumentException("start value of type " + b.start.type.xmlName
                    + " does not match valueType " + b.valueType.xmlName + " of " + b.name);
        }
        if (b.facets.containsKey("start")) {
            throw new IllegalArgumentException("start is not a facet, use start(...)");
        }
        for (String key : b.otherAttributes.keySet()) {
            if (MODELED_ATTRIBUTES.contains(key)) {
                throw new IllegalArgumentException("attribute " + key + " is modeled and cannot be set as an opaque attribute");
            }
        }
        this.name = b.name;
        this.valueReference = b.valueReference;
        this.description = b.description;
        this.causality = b.causality;
        this.variability = b.variability;
        this.initial = b.initial;
        this.valueType = b.valueType;
        this.start = b.start;
        this.facets = Collections.unmodifiableMap(new TreeMap<>(b.facets));
        this.otherAttributes = Collections.unmodifiableMap(new TreeMap<>(b.otherAttributes));
    }

    public static Builder builder(String name, long valueReference, ValueType valueType) {
        return new Builder().name(name).valueReference(valueReference).valueType(valueType);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.name = name;
        b.valueReference = valueReference;
        b.description = description;
        b.causality = causality;
        b.variability = variability;
        b.initial = initial;
        b.valueType = valueType;
        b.start = start;
        b.facets.putAll(facets);
        b.otherAttributes.putAll(otherAttributes);
        return b;
    }

    public Causality effectiveCausality() {
        return causality == null ? Causality.LOCAL : causality;
    }

    public Variability effectiveVariability() {
        return variability == null ? Variability.CONTINUOUS : variability;
    }

    /** Convenience for the most common facet; {@code null} for non-Real variables or when absent. */
    public String unit() {
        return facets.get("unit");
    }

    public ScalarVariable withStart(StartValue start) {
        return toBuilder().start(start).build();
    }

    public ScalarVariable withDescription(String description) {
        return toBuilder().description(description).build();
    }

    public ScalarVariable withCausality(Causality causality) {
        return toBuilder().causality(causality).build();
    }

    public ScalarVariable withVariability(Variability variability) {
        return toBuilder().variability(variability).build();
    }

    public ScalarVariable withInitial(Initial initial) {
        return toBuilder().initial(initial).build();
    }

    public ScalarVariable withValueReference(long valueReference) {
        return toBuilder().valueReference(valueReference).build();
    }

    public ScalarVariable withFacet(String key, String value) {
        return toBuilder().facet(key, value).build();
    }

    public ScalarVariable withoutFacet(String key) {
        return toBuilder().removeFacet(key).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarVariable)) return false;
        return name.equals(((ScalarVariable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    /** Field-by-field comparison, unlike {@link #equals(Object)}. */
    public boolean sameContent(ScalarVariable other) {
        if (other == null) return false;
        return name.equals(other.name)
                && valueReference == other.valueReference
                && Objects.equals(description, other.description)
                && causality == other.causality
                && variability == other.variability
                && initial == other.initial
                && valueType == other.valueType
                && Objects.equals(start, other.start)
                && facets.equals(other.facets)
                && otherAttributes.equals(other.otherAttributes);
    }

    @Override
    public String toString() {
        return "ScalarVariable{" +
                "name='" + name + '\'' +
                ", valueReference=" + valueReference +
                (causality != null ? ", causality=" + causality.xmlValue : "") +
                (variability != null ? ", variability=" + variability.xmlValue : "") +
                (initial != null ? ", initial=" + initial.xmlValue : "") +
                ", type=" + valueType.xmlName +
                (start != null ? ", start=" + start.text : "") +
                (facets.isEmpty() ? "" : ", facets=" + facets) +
                '}';
    }

    public static final class Builder {
        private String name;
        private long valueReference;
        private String description;
        private Causality causality;
        private Variability variability;
        private Initial initial;
        private ValueType valueType;
        private StartValue start;
        private final Map<String, String> facets = new TreeMap<>();
        private final Map<String, String> otherAttributes = new TreeMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder valueReference(long valueReference) {
            this.valueReference = valueReference;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder causality(Causality causality) {
            this.causality = causality;
            return this;
        }

        public Builder variability(Variability variability) {
            this.variability = variability;
            return this;
        }

        public Builder initial(Initial initial) {
            this.initial = initial;
            return this;
        }

        /** Changing the type drops a start value of the previous type. */
        public Builder valueType(ValueType valueType) {
            if (this.start != null && this.start.type != valueType) {
                this.start = null;
            }
            this.valueType = valueType;
            return this;
        }

        public Builder start(StartValue start) {
            this.start = start;
            return this;
        }

        /** Type-checked start value, see {@link ValueType#coerce}. Requires the value type to be set first. */
        public Builder startValue(Object value) {
            if (valueType == null) {
                throw new IllegalStateException("valueType must be set before startValue");
            }
            this.start = value == null ? null : valueType.coerce(name, value);
            return this;
        }

        public Builder facet(String key, String value) {
            if (key == null || key.isBlank()) throw new IllegalArgumentException("facet key must not be blank");
            if (value == null) {
                facets.remove(key);
            } else {
                facets.put(key, value);
            }
            return this;
        }

        public Builder removeFacet(String key) {
            facets.remove(key);
            return this;
        }

        public Builder attribute(String key, String value) {
            if (key == null || key.isBlank()) throw new IllegalArgumentException("attribute key must not be blank");
            if (value == null) {
                otherAttributes.remove(key);
            } else {
                otherAttributes.put(key, value);
            }
            return this;
        }

        public ScalarVariable build() {
            return new ScalarVariable(this);
        }
    }
}
