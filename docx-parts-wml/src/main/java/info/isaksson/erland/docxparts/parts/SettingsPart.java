package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.OxmlSupport;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.opc.XmlPart;
import info.isaksson.erland.docxparts.settings.Settings;
import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.WmlContentTypes;
import org.w3c.dom.Document;

import java.io.IOException;

/** Document settings part ({@code /word/settings.xml}). */
public class SettingsPart extends XmlPart {

    public SettingsPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public static SettingsPart load(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        return new SettingsPart(partName, contentType, OxmlSupport.parse(blob, partName), pkg);
    }

    public static SettingsPart defaultPart(OpcPackage pkg) {
        PartName partName = pkg.availablePartName("/word/settings.xml", "/word/settings%d.xml");
        return new SettingsPart(partName, WmlContentTypes.SETTINGS, Templates.load("default-settings.xml"), pkg);
    }

    public Settings settings() {
        return new Settings(element());
    }
}
