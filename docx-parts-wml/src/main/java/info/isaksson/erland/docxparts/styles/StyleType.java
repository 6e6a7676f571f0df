package info.isaksson.erland.docxparts.styles;

/** Style category, as carried by {@code w:style/@w:type}. */
public enum StyleType {
    PARAGRAPH("paragraph"),
    CHARACTER("character"),
    TABLE("table"),
    NUMBERING("numbering");

    private final String xmlValue;

    StyleType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    public String xmlValue() {
        return xmlValue;
    }

    /** Parses {@code w:type}; an absent value means paragraph. */
    public static StyleType fromXml(String v) {
        if (v == null || v.isBlank()) return PARAGRAPH;
        for (StyleType t : values()) {
            if (t.xmlValue.equals(v.trim())) return t;
        }
        throw new IllegalArgumentException("Unknown style type: " + v);
    }
}
