package info.isaksson.erland.docxparts.opc;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;

/**
 * Absolute pack URI of a part, e.g. {@code /word/footer1.xml}.
 *
 * <p>Immutable value type over the package layer's validated part name. Names compare
 * case-insensitively and keep their percent-encoding, so {@code /word/media/image%201.png}
 * is the name of the part a relationship target {@code media/image%201.png} points at.</p>
 */
public final class PartName implements Comparable<PartName> {

    private final PackagePartName name;

    private PartName(PackagePartName name) {
        this.name = name;
    }

    public static PartName of(String uri) {
        if (uri == null) throw new IllegalArgumentException("uri must not be null");
        try {
            return new PartName(PackagingURIHelper.createPartName(uri));
        } catch (InvalidFormatException e) {
            throw new IllegalArgumentException("invalid part name: " + uri, e);
        }
    }

    static PartName of(PackagePartName name) {
        return new PartName(name);
    }

    PackagePartName packagePartName() {
        return name;
    }

    /** The string form, e.g. {@code /word/footer1.xml}. */
    public String uri() {
        return name.getName();
    }

    /** Directory portion including the trailing slash, e.g. {@code /word/}. */
    public String baseUri() {
        String uri = uri();
        return uri.substring(0, uri.lastIndexOf('/') + 1);
    }

    /** Last path segment, e.g. {@code footer1.xml}. */
    public String filename() {
        String uri = uri();
        return uri.substring(uri.lastIndexOf('/') + 1);
    }

    /** Extension without the dot, lowercase; empty when the filename has none. */
    public String extension() {
        return name.getExtension().toLowerCase();
    }

    @Override
    public int compareTo(PartName o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartName)) return false;
        return name.equals(((PartName) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return uri();
    }
}
