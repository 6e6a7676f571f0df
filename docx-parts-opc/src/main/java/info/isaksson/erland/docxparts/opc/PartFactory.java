package info.isaksson.erland.docxparts.opc;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Chooses the concrete {@link Part} class for a content type when a package is loaded.
 *
 * <p>Unregistered XML content types load as {@link XmlPart}; anything else as a plain
 * {@link Part}.</p>
 */
public final class PartFactory {

    @FunctionalInterface
    public interface PartConstructor {
        Part create(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException;
    }

    private final Map<String, PartConstructor> byContentType = new HashMap<>();

    public PartFactory register(String contentType, PartConstructor constructor) {
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType must not be blank");
        }
        if (constructor == null) throw new IllegalArgumentException("constructor must not be null");
        byContentType.put(contentType, constructor);
        return this;
    }

    public Part create(PartName partName, String contentType, byte[] blob, OpcPackage pkg) throws IOException {
        PartConstructor c = byContentType.get(contentType);
        if (c != null) {
            return c.create(partName, contentType, blob, pkg);
        }
        if (ContentTypes.isXml(contentType)) {
            return XmlPart.load(partName, contentType, blob, pkg);
        }
        return new Part(partName, contentType, blob, pkg);
    }
}
