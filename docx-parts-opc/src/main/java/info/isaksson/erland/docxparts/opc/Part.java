package info.isaksson.erland.docxparts.opc;

/**
 * A part of an OPC package: a named blob with a content type and outbound relationships.
 *
 * <p>Constructing a part adds it to its package under {@code partName}; the blob is written
 * to the package when it is saved. The package reference is a back-reference only: a part
 * never owns its package.</p>
 */
public class Part {

    private final PartName partName;
    private final String contentType;
    private final byte[] blob;
    private final OpcPackage pkg;
    private final Relationships rels;

    public Part(PartName partName, String contentType, byte[] blob, OpcPackage pkg) {
        if (partName == null) throw new IllegalArgumentException("partName must not be null");
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType must not be blank");
        }
        if (pkg == null) throw new IllegalArgumentException("pkg must not be null");
        this.partName = partName;
        this.contentType = contentType;
        this.blob = blob == null ? new byte[0] : blob;
        this.pkg = pkg;
        this.rels = new Relationships(pkg, partName.uri(), () -> pkg.packagePart(partName));
        pkg.register(this);
    }

    public PartName partName() {
        return partName;
    }

    public String contentType() {
        return contentType;
    }

    /** Serialized content of this part. */
    public byte[] blob() {
        return blob.clone();
    }

    /** The package this part belongs to. */
    public OpcPackage opcPackage() {
        return pkg;
    }

    public Relationships rels() {
        return rels;
    }

    /**
     * Relate this part to {@code target} by {@code type}, reusing an identical existing
     * relationship.
     *
     * @return the {@code rId} of the relationship
     */
    public String relateTo(Part target, RelationshipType type) {
        if (target != null && target.opcPackage() != pkg) {
            throw new IllegalArgumentException("cannot relate " + partName + " to a part of another package: " + target.partName());
        }
        return rels.getOrAdd(type, target).rId();
    }

    /** Relate this part to an external resource (e.g. a hyperlink URL). */
    public String relateToExternal(String ref, RelationshipType type) {
        return rels.getOrAddExternal(type, ref).rId();
    }

    /**
     * The part related to this one by {@code type}.
     *
     * @throws RelationshipNotFoundException when no such relationship exists
     */
    public Part partRelatedBy(RelationshipType type) {
        return rels.partWithRelType(type);
    }

    /** The part related by {@code type}, or {@code null} when there is none. */
    public Part findRelated(RelationshipType type) {
        return rels.findPartWithRelType(type);
    }

    /** Target part of relationship {@code rId}, or {@code null} when it is external or missing. */
    public Part relatedPart(String rId) {
        Relationship r = rels.get(rId);
        return r == null || r.isExternal() ? null : r.target();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + partName + "]";
    }
}
