package info.isaksson.erland.fmuhandler.model;

/**
 * FMI 2.0 causality of a ScalarVariable: how it takes part in the simulation.
 * When the attribute is absent the FMI default is {@link #LOCAL}.
 */
public enum Causality {
    PARAMETER("parameter"),
    CALCULATED_PARAMETER("calculatedParameter"),
    INPUT("input"),
    OUTPUT("output"),
    LOCAL("local"),
    INDEPENDENT("independent");

    /** Literal used in the {@code causality} attribute. */
    public final String xmlValue;

    Causality(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    public static Causality fromXml(String v) {
        if (v == null) throw new IllegalArgumentException("causality must not be null");
        for (Causality c : values()) {
            if (c.xmlValue.equals(v.trim())) return c;
        }
        throw new IllegalArgumentException("Invalid causality: " + v
                + " (expected one of: parameter|calculatedParameter|input|output|local|independent)");
    }
}
