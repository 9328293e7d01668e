package info.isaksson.erland.fmuhandler.model;

import java.util.Objects;

/**
 * Start value of a ScalarVariable, tagged with its {@link ValueType}.
 *
 * <p>{@link #value} is a {@link Double} for Real, an {@link Integer} for Integer and Enumeration,
 * a {@link Boolean} for Boolean and a {@link String} for String. {@link #text} is the literal that
 * is written to the {@code start} attribute: the original text for values read from XML, a
 * canonical rendering for values set through the API.</p>
 *
 * <p>Instances are created through {@link ValueType#parseStart} and {@link ValueType#coerce}.</p>
 */
public final class StartValue {

    public final ValueType type;
    public final Object value;
    public final String text;

    StartValue(ValueType type, Object value, String text) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public double asReal() {
        require(ValueType.REAL);
        return (Double) value;
    }

    /** Integer value; also valid for Enumeration variables. */
    public int asInteger() {
        if (type != ValueType.INTEGER && type != ValueType.ENUMERATION) {
            throw new IllegalStateException("start value is " + type.xmlName + ", not Integer");
        }
        return (Integer) value;
    }

    public boolean asBoolean() {
        require(ValueType.BOOLEAN);
        return (Boolean) value;
    }

    public String asString() {
        require(ValueType.STRING);
        return (String) value;
    }

    private void require(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("start value is " + type.xmlName + ", not " + expected.xmlName);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StartValue)) return false;
        StartValue that = (StartValue) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type.xmlName + "(" + text + ")";
    }
}
