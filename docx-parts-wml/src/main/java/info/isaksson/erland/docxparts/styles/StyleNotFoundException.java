package info.isaksson.erland.docxparts.styles;

/** No style with the given name exists in the document. */
public class StyleNotFoundException extends StyleLookupException {

    private final String styleName;

    public StyleNotFoundException(String styleName) {
        super("no style with name '" + styleName + "'");
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }
}
