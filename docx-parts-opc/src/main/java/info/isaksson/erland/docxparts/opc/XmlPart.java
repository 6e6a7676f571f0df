package info.isaksson.erland.docxparts.opc;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;

/**
 * A part whose content is an XML document, kept as a live DOM and serialized on demand.
 */
public class XmlPart extends Part {

    private final Document document;

    public XmlPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, null, requireRoot(document, partName, pkg));
        this.document = document;
    }

    // runs before the part is added to its package
    private static OpcPackage requireRoot(Document document, PartName partName, OpcPackage pkg) {
        if (document == null || document.getDocumentElement() == null) {
            throw new IllegalArgumentException("document must have a root element: " + partName);
        }
        return pkg;
    }

    public static XmlPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new XmlPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    public Document document() {
        return document;
    }

    /** Root element of the part's XML subtree. */
    public Element element() {
        return document.getDocumentElement();
    }

    @Override
    public byte[] blob() {
        return OxmlSupport.serialize(document);
    }
}
