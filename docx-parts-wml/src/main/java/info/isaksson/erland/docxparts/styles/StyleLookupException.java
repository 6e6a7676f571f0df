package info.isaksson.erland.docxparts.styles;

/** A style name or style object cannot be used for the requested lookup. */
public abstract class StyleLookupException extends IllegalArgumentException {

    protected StyleLookupException(String message) {
        super(message);
    }
}
