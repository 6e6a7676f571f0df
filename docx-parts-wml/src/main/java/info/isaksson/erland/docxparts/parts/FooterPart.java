package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.story.Footer;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;

import java.io.IOException;

/** Definition of a section footer. */
public class FooterPart extends StoryPart {

    public FooterPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static FooterPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new FooterPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    /**
     * A new footer part holding one empty "Footer"-styled paragraph, named with the next free
     * {@code /word/footer%d.xml}. Nothing relates to it yet.
     */
    public static FooterPart newPart(OpcPackage pkg) {
        if (pkg == null) throw new IllegalArgumentException("pkg must not be null");
        PartName partName = pkg.nextPartName("/word/footer%d.xml");
        return new FooterPart(partName, WmlContentTypes.FOOTER, Templates.load("default-footer.xml"), pkg);
    }

    public Footer footer() {
        return new Footer(element(), this);
    }
}
