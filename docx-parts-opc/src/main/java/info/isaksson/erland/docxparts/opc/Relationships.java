package info.isaksson.erland.docxparts.opc;

import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.RelationshipSource;
import org.apache.poi.openxml4j.opc.TargetMode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Outbound relationships of one source (part or package), in {@code rId} order.
 *
 * <p>A live view: every call reads the relationships the package holds for the source, so
 * relationships of types outside {@link RelationshipType} are kept and saved untouched.
 * New {@code rId}s are assigned by the package layer and never reuse an existing one.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class Relationships {

    private final OpcPackage pkg;
    private final String source;
    private final Supplier<RelationshipSource> sourceLookup;

    Relationships(OpcPackage pkg, String source, Supplier<RelationshipSource> sourceLookup) {
        this.pkg = pkg;
        this.source = source;
        this.sourceLookup = sourceLookup;
    }

    public List<Relationship> all() {
        List<Relationship> out = new ArrayList<>();
        for (PackageRelationship r : packageRelationships()) {
            out.add(new Relationship(pkg, r));
        }
        return out;
    }

    public Relationship get(String rId) {
        for (Relationship r : all()) {
            if (r.rId().equals(rId)) return r;
        }
        return null;
    }

    public int size() {
        return all().size();
    }

    public boolean isEmpty() {
        return all().isEmpty();
    }

    /**
     * Returns the existing relationship of {@code type} to {@code target}, adding a new one when
     * there is none.
     *
     * @throws IllegalStateException if {@code type} is a singleton type and the source already
     *                               relates a different part by that type
     */
    public Relationship getOrAdd(RelationshipType type, Part target) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (target == null) throw new IllegalArgumentException("target must not be null");
        for (Relationship r : all()) {
            if (r.type() == type && !r.isExternal() && target.partName().equals(r.targetName())) {
                return r;
            }
        }
        requireSingletonFree(type);
        PackageRelationship added = sourceLookup.get()
                .addRelationship(target.partName().packagePartName(), TargetMode.INTERNAL, type.uri());
        return new Relationship(pkg, added);
    }

    /** Same as {@link #getOrAdd} for an external target reference, e.g. a hyperlink URL. */
    public Relationship getOrAddExternal(RelationshipType type, String ref) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (ref == null || ref.isBlank()) throw new IllegalArgumentException("ref must not be blank");
        for (Relationship r : all()) {
            if (r.type() == type && r.isExternal() && ref.equals(r.externalRef())) {
                return r;
            }
        }
        requireSingletonFree(type);
        return new Relationship(pkg, sourceLookup.get().addExternalRelationship(ref, type.uri()));
    }

    /**
     * The single target part related by {@code type}.
     *
     * @throws RelationshipNotFoundException when there is no such relationship
     * @throws IllegalStateException when more than one part is related by {@code type}
     */
    public Part partWithRelType(RelationshipType type) {
        Part p = findPartWithRelType(type);
        if (p == null) {
            throw new RelationshipNotFoundException(type, source);
        }
        return p;
    }

    /** Like {@link #partWithRelType} but returns {@code null} when there is no such relationship. */
    public Part findPartWithRelType(RelationshipType type) {
        List<Part> matches = partsWithRelType(type);
        if (matches.size() > 1) {
            throw new IllegalStateException("multiple relationships of type " + type + " from " + source);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * All internal targets related by {@code type}, in {@code rId} order. Relationships whose
     * target part is missing from the package are left out.
     */
    public List<Part> partsWithRelType(RelationshipType type) {
        List<Part> out = new ArrayList<>();
        for (Relationship r : all()) {
            if (r.type() != type || r.isExternal()) continue;
            Part target = r.target();
            if (target != null) out.add(target);
        }
        return out;
    }

    // counts exactly what findPartWithRelType would see
    private void requireSingletonFree(RelationshipType type) {
        if (!type.isSingleton()) return;
        List<Part> existing = partsWithRelType(type);
        if (!existing.isEmpty()) {
            throw new IllegalStateException(
                    "relationship of singleton type " + type + " already exists from " + source + " to " + existing.get(0).partName());
        }
    }

    private Iterable<PackageRelationship> packageRelationships() {
        try {
            return sourceLookup.get().getRelationships();
        } catch (OpenXML4JException e) {
            throw new IllegalStateException("cannot read relationships of " + source, e);
        }
    }
}
