package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.story.Header;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;

import java.io.IOException;

/** Definition of a section header. */
public class HeaderPart extends StoryPart {

    public HeaderPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static HeaderPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new HeaderPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    /** New unrelated header part at the next free {@code /word/header%d.xml}. */
    public static HeaderPart newPart(OpcPackage pkg) {
        if (pkg == null) throw new IllegalArgumentException("pkg must not be null");
        PartName partName = pkg.nextPartName("/word/header%d.xml");
        return new HeaderPart(partName, WmlContentTypes.HEADER, Templates.load("default-header.xml"), pkg);
    }

    public Header header() {
        return new Header(element(), this);
    }
}
