package info.isaksson.erland.docxparts.opc;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;

/**
 * A directed, typed edge from a source (part or package) to a target part, or to an external
 * resource when {@link #isExternal()}.
 *
 * <p>Snapshot of one persisted relationship. Relationships whose type this library does not
 * know keep their type URI and report {@code null} from {@link #type()}.</p>
 */
public final class Relationship {
    private final OpcPackage pkg;
    private final String rId;
    private final String typeUri;
    private final boolean external;
    private final String externalRef;
    private final PartName targetName;

    Relationship(OpcPackage pkg, PackageRelationship rel) {
        this.pkg = pkg;
        this.rId = rel.getId();
        this.typeUri = rel.getRelationshipType();
        this.external = rel.getTargetMode() == TargetMode.EXTERNAL;
        this.externalRef = external ? rel.getTargetURI().toString() : null;
        this.targetName = external ? null : internalTarget(rel);
    }

    private static PartName internalTarget(PackageRelationship rel) {
        try {
            return PartName.of(PackagingURIHelper.createPartName(rel.getTargetURI()));
        } catch (InvalidFormatException | IllegalArgumentException e) {
            // unresolvable target URI, treated like a missing target
            return null;
        }
    }

    public String rId() {
        return rId;
    }

    /** Known type of this relationship, or {@code null} for a type outside {@link RelationshipType}. */
    public RelationshipType type() {
        return RelationshipType.fromUri(typeUri);
    }

    public String typeUri() {
        return typeUri;
    }

    public boolean isExternal() {
        return external;
    }

    /** Name of the target part, or {@code null} for external or unresolvable targets. */
    public PartName targetName() {
        return targetName;
    }

    /**
     * Target part, or {@code null} when the package has no part of that name.
     *
     * @throws IllegalStateException for external relationships
     */
    public Part target() {
        if (external) {
            throw new IllegalStateException("external relationship " + rId + " has no target part");
        }
        return targetName == null ? null : pkg.part(targetName);
    }

    /** External reference, e.g. a hyperlink URL; {@code null} for internal relationships. */
    public String externalRef() {
        return externalRef;
    }

    @Override
    public String toString() {
        return rId + " " + typeUri + " -> " + (external ? externalRef : targetName);
    }
}
