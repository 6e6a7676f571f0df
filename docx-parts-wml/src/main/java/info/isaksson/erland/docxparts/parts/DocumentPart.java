package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.Part;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.opc.RelationshipType;
import info.isaksson.erland.docxparts.story.Story;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.Wml;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Main document part ({@code /word/document.xml}). */
public class DocumentPart extends StoryPart {

    public DocumentPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static DocumentPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new DocumentPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    /** An empty document with a single section. */
    public static DocumentPart defaultPart(OpcPackage pkg) {
        PartName partName = pkg.availablePartName("/word/document.xml", "/word/document%d.xml");
        return new DocumentPart(partName, WmlContentTypes.DOCUMENT_MAIN, Templates.load("default-document.xml"), pkg);
    }

    public Story body() {
        Element body = Wml.child(element(), "body");
        if (body == null) {
            throw new IllegalStateException(partName() + " has no w:body");
        }
        return new Story(body, this);
    }

    /** Create a new footer part, relate it from this part and return it. */
    public FooterPart addFooterPart() {
        FooterPart footer = FooterPart.newPart(opcPackage());
        relateTo(footer, RelationshipType.FOOTER);
        return footer;
    }

    public HeaderPart addHeaderPart() {
        HeaderPart header = HeaderPart.newPart(opcPackage());
        relateTo(header, RelationshipType.HEADER);
        return header;
    }

    public List<FooterPart> footerParts() {
        List<FooterPart> out = new ArrayList<>();
        for (Part p : rels().partsWithRelType(RelationshipType.FOOTER)) {
            if (p instanceof FooterPart f) out.add(f);
        }
        return out;
    }

    public List<HeaderPart> headerParts() {
        List<HeaderPart> out = new ArrayList<>();
        for (Part p : rels().partsWithRelType(RelationshipType.HEADER)) {
            if (p instanceof HeaderPart h) out.add(h);
        }
        return out;
    }
}
