package info.isaksson.erland.docxparts.opc;

/**
 * Closed set of relationship types understood by this library.
 *
 * <p>A <em>singleton</em> type may appear at most once among the outbound relationships of one
 * source (part or package).</p>
 */
public enum RelationshipType {
    OFFICE_DOCUMENT(Ns.OFFICE + "officeDocument", true),
    CORE_PROPERTIES("http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties", true),
    EXTENDED_PROPERTIES(Ns.OFFICE + "extended-properties", true),
    STYLES(Ns.OFFICE + "styles", true),
    NUMBERING(Ns.OFFICE + "numbering", true),
    SETTINGS(Ns.OFFICE + "settings", true),
    WEB_SETTINGS(Ns.OFFICE + "webSettings", true),
    FONT_TABLE(Ns.OFFICE + "fontTable", true),
    THEME(Ns.OFFICE + "theme", true),
    FOOTNOTES(Ns.OFFICE + "footnotes", true),
    ENDNOTES(Ns.OFFICE + "endnotes", true),
    COMMENTS(Ns.OFFICE + "comments", true),
    HEADER(Ns.OFFICE + "header", false),
    FOOTER(Ns.OFFICE + "footer", false),
    IMAGE(Ns.OFFICE + "image", false),
    HYPERLINK(Ns.OFFICE + "hyperlink", false),
    CUSTOM_XML(Ns.OFFICE + "customXml", false);

    private final String uri;
    private final boolean singleton;

    RelationshipType(String uri, boolean singleton) {
        this.uri = uri;
        this.singleton = singleton;
    }

    public String uri() {
        return uri;
    }

    public boolean isSingleton() {
        return singleton;
    }

    /** Returns the type for a relationship URI, or {@code null} when the URI is not in the closed set. */
    public static RelationshipType fromUri(String uri) {
        if (uri == null) return null;
        String u = uri.trim();
        for (RelationshipType t : values()) {
            if (t.uri.equals(u)) return t;
        }
        return null;
    }

    private static final class Ns {
        static final String OFFICE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/";
    }
}
