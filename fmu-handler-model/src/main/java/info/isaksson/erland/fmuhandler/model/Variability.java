package info.isaksson.erland.fmuhandler.model;

/** FMI 2.0 variability (update frequency class). Absent means {@link #CONTINUOUS}. */
public enum Variability {
    CONSTANT("constant"),
    FIXED("fixed"),
    TUNABLE("tunable"),
    DISCRETE("discrete"),
    CONTINUOUS("continuous");

    public final String xmlValue;

    Variability(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    public static Variability fromXml(String v) {
        if (v == null) throw new IllegalArgumentException("variability must not be null");
        for (Variability x : values()) {
            if (x.xmlValue.equals(v.trim())) return x;
        }
        throw new IllegalArgumentException("Invalid variability: " + v
                + " (expected one of: constant|fixed|tunable|discrete|continuous)");
    }
}
