package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.opc.XmlPart;
import info.isaksson.erland.docxparts.styles.Styles;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;

import java.io.IOException;

/** Styles part ({@code /word/styles.xml}). */
public class StylesPart extends XmlPart {

    public StylesPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static StylesPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new StylesPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    /** A styles part holding the default style set, named {@code /word/styles.xml} when that name is free. */
    public static StylesPart defaultPart(OpcPackage pkg) {
        PartName partName = pkg.availablePartName("/word/styles.xml", "/word/styles%d.xml");
        return new StylesPart(partName, WmlContentTypes.STYLES, Templates.load("default-styles.xml"), pkg);
    }

    public Styles styles() {
        return new Styles(element());
    }
}
