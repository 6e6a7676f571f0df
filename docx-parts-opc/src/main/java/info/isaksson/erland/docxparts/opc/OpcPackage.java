package info.isaksson.erland.docxparts.opc;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidOperationException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageProperties;
import org.apache.poi.openxml4j.opc.internal.PackagePropertiesPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory OPC package backed by Apache POI's openxml4j package model.
 *
 * <p>Every part of the package is available as a {@link Part} built by the package's
 * {@link PartFactory}. Parts and relationships this library does not model (charts,
 * thumbnails, custom parts) are kept as plain parts and saved unchanged. Core properties
 * live in the package itself and are not a {@link Part}.</p>
 *
 * <p>Not thread-safe: one thread (or an external lock) per package.</p>
 */
public class OpcPackage {

    private static final Logger log = LoggerFactory.getLogger(OpcPackage.class);

    private final OPCPackage opc;
    private final PartFactory partFactory;
    private final Map<PartName, Part> parts = new TreeMap<>();
    private final Relationships rels;
    private PartName loading;

    /** A new, empty package with fresh core properties. */
    public OpcPackage() {
        this(new PartFactory());
    }

    public OpcPackage(PartFactory partFactory) {
        this(OPCPackage.create(new ByteArrayOutputStream()), partFactory);
        CoreProperties props = coreProperties();
        props.setTitle("Word Document");
        props.setAuthor("");
        props.setLastModifiedBy("docx-parts");
        props.setRevision(1);
        props.setModified(Instant.now());
        packageProperties().setCreatedProperty(Optional.empty());
    }

    private OpcPackage(OPCPackage opc, PartFactory partFactory) {
        if (partFactory == null) throw new IllegalArgumentException("partFactory must not be null");
        this.opc = opc;
        this.partFactory = partFactory;
        this.rels = new Relationships(this, "/", () -> this.opc);
    }

    public static OpcPackage open(Path path) throws IOException {
        return open(path, new PartFactory());
    }

    public static OpcPackage open(Path path, PartFactory partFactory) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return open(in, partFactory);
        }
    }

    /** Read a package from a ZIP stream. The stream is consumed. */
    public static OpcPackage open(InputStream in, PartFactory partFactory) throws IOException {
        if (in == null) throw new IllegalArgumentException("in must not be null");
        if (partFactory == null) throw new IllegalArgumentException("partFactory must not be null");
        OPCPackage opc;
        try {
            opc = OPCPackage.open(in);
        } catch (InvalidFormatException | InvalidOperationException | IllegalArgumentException e) {
            // NotOfficeXmlFileException and friends are IllegalArgumentExceptions
            throw new IOException("not a valid OPC package: " + e.getMessage(), e);
        }
        OpcPackage pkg = new OpcPackage(opc, partFactory);
        try {
            pkg.loadParts();
        } catch (IOException | RuntimeException e) {
            opc.revert();
            throw e;
        }
        return pkg;
    }

    private void loadParts() throws IOException {
        for (PackagePart pp : packageParts()) {
            PartName name = PartName.of(pp.getPartName());
            byte[] blob;
            try (InputStream in = pp.getInputStream()) {
                blob = in.readAllBytes();
            }
            loading = name;
            try {
                partFactory.create(name, pp.getContentType(), blob, this);
            } finally {
                loading = null;
            }
        }
        log.debug("Loaded {} parts", parts.size());
    }

    private List<PackagePart> packageParts() throws IOException {
        List<PackagePart> out = new ArrayList<>();
        try {
            for (PackagePart pp : opc.getParts()) {
                if (pp.isRelationshipPart() || pp instanceof PackagePropertiesPart) continue;
                out.add(pp);
            }
        } catch (InvalidFormatException e) {
            throw new IOException("cannot list parts: " + e.getMessage(), e);
        }
        return out;
    }

    /** Adds a newly constructed part to this package. */
    void register(Part part) {
        PartName name = part.partName();
        if (parts.containsKey(name)) {
            throw new IllegalStateException("package already contains a part named " + name);
        }
        if (!name.equals(loading)) {
            if (opc.containPart(name.packagePartName())) {
                throw new IllegalStateException("package already contains a part named " + name);
            }
            if (opc.createPart(name.packagePartName(), part.contentType()) == null) {
                throw new IllegalArgumentException("cannot create part " + name + " with content type " + part.contentType());
            }
        }
        parts.put(name, part);
    }

    PackagePart packagePart(PartName name) {
        PackagePart pp = opc.getPart(name.packagePartName());
        if (pp == null) {
            throw new IllegalStateException("package has no part named " + name);
        }
        return pp;
    }

    public PartFactory partFactory() {
        return partFactory;
    }

    /** Package-level relationships. */
    public Relationships rels() {
        return rels;
    }

    public String relateTo(Part target, RelationshipType type) {
        if (target != null && target.opcPackage() != this) {
            throw new IllegalArgumentException("part belongs to another package: " + target.partName());
        }
        return rels.getOrAdd(type, target).rId();
    }

    /**
     * @throws RelationshipNotFoundException when the package has no relationship of {@code type}
     */
    public Part partRelatedBy(RelationshipType type) {
        return rels.partWithRelType(type);
    }

    /** Target of the package's office-document relationship. */
    public Part mainDocumentPart() {
        return partRelatedBy(RelationshipType.OFFICE_DOCUMENT);
    }

    /** All parts of the package in part name order. */
    public List<Part> parts() {
        return new ArrayList<>(parts.values());
    }

    /** The part named {@code partName}, or {@code null}. */
    public Part part(PartName partName) {
        return parts.get(partName);
    }

    /**
     * First part name produced by {@code template} (which contains one {@code %d}) for n = 1, 2, ...
     * that the package does not use.
     */
    public PartName nextPartName(String template) {
        if (template == null || !template.contains("%d")) {
            throw new IllegalArgumentException("template must contain %d: " + template);
        }
        for (int n = 1; ; n++) {
            PartName candidate = PartName.of(String.format(template, n));
            if (!isUsed(candidate)) return candidate;
        }
    }

    /** {@code preferred} when the package does not use it, otherwise {@link #nextPartName(String)}. */
    public PartName availablePartName(String preferred, String template) {
        PartName p = PartName.of(preferred);
        return isUsed(p) ? nextPartName(template) : p;
    }

    private boolean isUsed(PartName name) {
        return parts.containsKey(name) || opc.containPart(name.packagePartName());
    }

    /** Core document properties; the package always has them. */
    public CoreProperties coreProperties() {
        return new CoreProperties(packageProperties());
    }

    private PackageProperties packageProperties() {
        try {
            return opc.getPackageProperties();
        } catch (InvalidFormatException e) {
            throw new IllegalStateException("cannot read core properties: " + e.getMessage(), e);
        }
    }

    public void save(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            save(out);
        }
        log.debug("Saved package to {}", path);
    }

    /** Write the package as a ZIP stream. */
    public void save(OutputStream out) throws IOException {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        for (Part part : parts.values()) {
            PackagePart pp = packagePart(part.partName());
            // part output streams append to existing content
            pp.clear();
            try (OutputStream partOut = pp.getOutputStream()) {
                partOut.write(part.blob());
            }
        }
        opc.save(out);
    }
}
