package info.isaksson.erland.docxparts.opc;

/** Generic content types. */
public final class ContentTypes {

    public static final String XML = "application/xml";

    private ContentTypes() {}

    /** True for content types whose blob is an XML document. */
    public static boolean isXml(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.trim().toLowerCase();
        return ct.endsWith("+xml") || ct.equals(XML) || ct.equals("text/xml");
    }
}
