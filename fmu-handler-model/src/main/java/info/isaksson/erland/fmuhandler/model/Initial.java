package info.isaksson.erland.fmuhandler.model;

public enum Initial {
    EXACT("exact"),
    APPROX("approx"),
    CALCULATED("calculated");

    public final String xmlValue;

    Initial(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    public static Initial fromXml(String v) {
        if (v == null) throw new IllegalArgumentException("initial must not be null");
        for (Initial i : values()) {
            if (i.xmlValue.equals(v.trim())) return i;
        }
        throw new IllegalArgumentException("Invalid initial: " + v + " (expected one of: exact|approx|calculated)");
    }
}
