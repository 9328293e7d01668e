package info.isaksson.erland.fmuhandler.model;

import info.isaksson.erland.fmuhandler.error.InvalidValueException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * The typed value element nested in a ScalarVariable ({@code <Real>}, {@code <Integer>}, ...).
 *
 * <p>Each constant owns the parse/format/type-check rules for its start values, so callers never
 * switch on the runtime class of a value. Conversions are strict: an Integer variable never
 * accepts a fractional number and a Real variable never accepts a boolean or a non-numeric
 * string.</p>
 */
public enum ValueType {
    REAL("Real") {
        @Override
        StartValue parseLexical(String text) {
            String t = text.trim();
            if (!DOUBLE_LEXICAL.matcher(t).matches()) {
                throw new IllegalArgumentException("not an xs:double literal");
            }
            double d;
            switch (t) {
                case "INF":
                    d = Double.POSITIVE_INFINITY;
                    break;
                case "-INF":
                    d = Double.NEGATIVE_INFINITY;
                    break;
                case "NaN":
                    d = Double.NaN;
                    break;
                default:
                    d = Double.parseDouble(t);
            }
            return new StartValue(this, d, text);
        }

        @Override
        StartValue fromObject(Object value) {
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("a number is required");
            }
            Number n = (Number) value;
            double d = n.doubleValue();
            if (Double.isInfinite(d) && (n instanceof BigDecimal || n instanceof BigInteger)) {
                throw new IllegalArgumentException("out of double range");
            }
            return new StartValue(this, d, formatDouble(d));
        }
    },

    INTEGER("Integer") {
        @Override
        StartValue parseLexical(String text) {
            return new StartValue(this, parseInt(text), text);
        }

        @Override
        StartValue fromObject(Object value) {
            int i = intFromNumber(value);
            return new StartValue(this, i, Integer.toString(i));
        }
    },

    BOOLEAN("Boolean") {
        @Override
        StartValue parseLexical(String text) {
            switch (text.trim()) {
                case "true":
                case "1":
                    return new StartValue(this, Boolean.TRUE, text);
                case "false":
                case "0":
                    return new StartValue(this, Boolean.FALSE, text);
                default:
                    throw new IllegalArgumentException("not an xs:boolean literal");
            }
        }

        @Override
        StartValue fromObject(Object value) {
            if (!(value instanceof Boolean)) {
                throw new IllegalArgumentException("a boolean is required");
            }
            Boolean b = (Boolean) value;
            return new StartValue(this, b, b.toString());
        }
    },

    STRING("String") {
        @Override
        StartValue parseLexical(String text) {
            return new StartValue(this, text, text);
        }

        @Override
        StartValue fromObject(Object value) {
            if (!(value instanceof CharSequence)) {
                throw new IllegalArgumentException("a string is required");
            }
            String s = value.toString();
            return new StartValue(this, s, s);
        }
    },

    /** Enumeration start values are the integer item index, as in FMI 2.0. */
    ENUMERATION("Enumeration") {
        @Override
        StartValue parseLexical(String text) {
            return new StartValue(this, parseInt(text), text);
        }

        @Override
        StartValue fromObject(Object value) {
            int i = intFromNumber(value);
            return new StartValue(this, i, Integer.toString(i));
        }
    };

    private static final Pattern DOUBLE_LEXICAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|-?INF|NaN");
    private static final Pattern INT_LEXICAL = Pattern.compile("[+-]?\\d+");

    /** Element name of the typed child, e.g. {@code Real}. */
    public final String xmlName;

    ValueType(String xmlName) {
        this.xmlName = xmlName;
    }

    abstract StartValue parseLexical(String text);

    abstract StartValue fromObject(Object value);

    /**
     * Parse the text of a {@code start} attribute.
     *
     * @throws InvalidValueException if the text is not a literal of this type
     */
    public StartValue parseStart(String variableName, String text) {
        if (text == null) {
            throw new InvalidValueException(variableName, this, null, "start text is missing");
        }
        try {
            return parseLexical(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidValueException(variableName, this, text, e.getMessage());
        }
    }

    /**
     * Type-check a caller supplied value and turn it into a start value of this type.
     * Strings are accepted for every type and must then be a valid literal; {@link #STRING}
     * accepts character sequences only.
     *
     * @throws InvalidValueException if the value does not fit this type
     */
    public StartValue coerce(String variableName, Object value) {
        if (value == null) {
            throw new InvalidValueException(variableName, this, null, "value must not be null");
        }
        if (value instanceof StartValue) {
            StartValue sv = (StartValue) value;
            if (sv.type != this) {
                throw new InvalidValueException(variableName, this, sv.value, "start value is of type " + sv.type.xmlName);
            }
            return sv;
        }
        try {
            if (this != STRING && value instanceof CharSequence) {
                return parseLexical(value.toString());
            }
            return fromObject(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidValueException(variableName, this, value, e.getMessage());
        }
    }

    /** Like {@link #coerce} but returns {@code null} instead of throwing. */
    public StartValue tryCoerce(Object value) {
        if (value == null) return null;
        try {
            return coerce(null, value);
        } catch (InvalidValueException e) {
            return null;
        }
    }

    /** Resolve a typed child element name; {@code null} if the element is not a value type. */
    public static ValueType fromXmlName(String elementName) {
        if (elementName == null) return null;
        for (ValueType t : values()) {
            if (t.xmlName.equals(elementName)) return t;
        }
        return null;
    }

    static String formatDouble(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (d == Double.POSITIVE_INFINITY) return "INF";
        if (d == Double.NEGATIVE_INFINITY) return "-INF";
        return Double.toString(d);
    }

    private static int parseInt(String text) {
        String t = text.trim();
        if (!INT_LEXICAL.matcher(t).matches()) {
            throw new IllegalArgumentException("not an xs:int literal");
        }
        BigInteger big = new BigInteger(t.startsWith("+") ? t.substring(1) : t);
        return toIntExact(big);
    }

    private static int intFromNumber(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            return toIntExact(BigInteger.valueOf((Long) value));
        }
        if (value instanceof BigInteger) {
            return toIntExact((BigInteger) value);
        }
        if (value instanceof Number) {
            throw new IllegalArgumentException("integral number required, no truncation is applied");
        }
        throw new IllegalArgumentException("an integer is required");
    }

    private static int toIntExact(BigInteger big) {
        if (big.bitLength() > 31) {
            throw new IllegalArgumentException("out of 32-bit integer range");
        }
        return big.intValue();
    }
}
