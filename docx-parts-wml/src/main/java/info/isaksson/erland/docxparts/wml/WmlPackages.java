package info.isaksson.erland.docxparts.wml;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.RelationshipType;
import info.isaksson.erland.docxparts.parts.DocumentPart;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/** Entry points for WordprocessingML packages. */
public final class WmlPackages {

    private WmlPackages() {}

    /**
     * A new package holding only an empty main document part and core properties. Styles,
     * settings and numbering are created when first requested.
     */
    public static OpcPackage create() {
        OpcPackage pkg = new OpcPackage(WmlPartFactory.create());
        pkg.relateTo(DocumentPart.defaultPart(pkg), RelationshipType.OFFICE_DOCUMENT);
        return pkg;
    }

    public static OpcPackage open(Path path) throws IOException {
        return OpcPackage.open(path, WmlPartFactory.create());
    }

    public static OpcPackage open(InputStream in) throws IOException {
        return OpcPackage.open(in, WmlPartFactory.create());
    }

    /** The main document part of {@code pkg}. */
    public static DocumentPart documentPart(OpcPackage pkg) {
        if (pkg.mainDocumentPart() instanceof DocumentPart doc) {
            return doc;
        }
        throw new IllegalStateException("main document part is not a WordprocessingML document: " + pkg.mainDocumentPart());
    }
}
