package info.isaksson.erland.docxparts.wml;

import info.isaksson.erland.docxparts.opc.PartFactory;
import info.isaksson.erland.docxparts.parts.DocumentPart;
import info.isaksson.erland.docxparts.parts.FooterPart;
import info.isaksson.erland.docxparts.parts.HeaderPart;
import info.isaksson.erland.docxparts.parts.NumberingPart;
import info.isaksson.erland.docxparts.parts.SettingsPart;
import info.isaksson.erland.docxparts.parts.StylesPart;

/** Part factory that maps WordprocessingML content types to their part classes. */
public final class WmlPartFactory {

    private WmlPartFactory() {}

    public static PartFactory create() {
        return new PartFactory()
                .register(WmlContentTypes.DOCUMENT_MAIN, DocumentPart::load)
                .register(WmlContentTypes.HEADER, HeaderPart::load)
                .register(WmlContentTypes.FOOTER, FooterPart::load)
                .register(WmlContentTypes.STYLES, StylesPart::load)
                .register(WmlContentTypes.NUMBERING, NumberingPart::load)
                .register(WmlContentTypes.SETTINGS, SettingsPart::load);
    }
}
