package info.isaksson.erland.docxparts.wml;

/** Content types of the WordprocessingML parts this library models. */
public final class WmlContentTypes {

    private static final String PREFIX = "application/vnd.openxmlformats-officedocument.wordprocessingml.";

    public static final String DOCUMENT_MAIN = PREFIX + "document.main+xml";
    public static final String STYLES = PREFIX + "styles+xml";
    public static final String NUMBERING = PREFIX + "numbering+xml";
    public static final String SETTINGS = PREFIX + "settings+xml";
    public static final String HEADER = PREFIX + "header+xml";
    public static final String FOOTER = PREFIX + "footer+xml";

    private WmlContentTypes() {}
}
