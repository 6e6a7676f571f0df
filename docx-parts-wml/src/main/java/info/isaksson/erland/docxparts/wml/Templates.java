package info.isaksson.erland.docxparts.wml;

import info.isaksson.erland.docxparts.opc.OxmlSupport;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Bundled XML templates for newly created parts. */
public final class Templates {

    private static final String BASE = "/info/isaksson/erland/docxparts/templates/";

    private Templates() {}

    /** Fresh DOM copy of template {@code name} (e.g. {@code default-styles.xml}). */
    public static Document load(String name) {
        try {
            return OxmlSupport.template(Templates.class, BASE + name);
        } catch (IOException e) {
            throw new UncheckedIOException("bundled template unreadable: " + name, e);
        }
    }
}
