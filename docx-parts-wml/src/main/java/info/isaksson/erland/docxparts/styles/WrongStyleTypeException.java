package info.isaksson.erland.docxparts.styles;

/** The resolved style exists but belongs to another style category than requested. */
public class WrongStyleTypeException extends StyleLookupException {

    private final StyleType actual;
    private final StyleType expected;

    public WrongStyleTypeException(String styleName, StyleType actual, StyleType expected) {
        super("assigned style '" + styleName + "' is type " + actual.xmlValue() + ", need type " + expected.xmlValue());
        this.actual = actual;
        this.expected = expected;
    }

    public StyleType getActual() {
        return actual;
    }

    public StyleType getExpected() {
        return expected;
    }
}
