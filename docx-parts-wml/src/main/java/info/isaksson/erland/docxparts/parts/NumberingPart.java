package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.numbering.NumberingDefinitions;
import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.opc.XmlPart;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;

import java.io.IOException;

/** Numbering definitions part ({@code /word/numbering.xml}). */
public class NumberingPart extends XmlPart {

    public NumberingPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static NumberingPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new NumberingPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    /** An empty numbering part ({@code <w:numbering/>}). */
    public static NumberingPart defaultPart(OpcPackage pkg) {
        PartName partName = pkg.availablePartName("/word/numbering.xml", "/word/numbering%d.xml");
        return new NumberingPart(partName, WmlContentTypes.NUMBERING, Templates.load("default-numbering.xml"), pkg);
    }

    public NumberingDefinitions numberingDefinitions() {
        return new NumberingDefinitions(element());
    }
}
