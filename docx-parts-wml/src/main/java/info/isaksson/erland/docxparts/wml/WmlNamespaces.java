package info.isaksson.erland.docxparts.wml;

/** WordprocessingML namespace URIs. */
public final class WmlNamespaces {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    private WmlNamespaces() {}
}
