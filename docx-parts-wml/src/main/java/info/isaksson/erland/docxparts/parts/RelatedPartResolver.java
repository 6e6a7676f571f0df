package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.Part;
import info.isaksson.erland.docxparts.opc.XmlPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Get-or-create over the typed relationships of one source part: returns the part related by
 * a dependent kind, creating and relating the kind's default part when there is none.
 */
final class RelatedPartResolver {

    private static final Logger log = LoggerFactory.getLogger(RelatedPartResolver.class);

    private final Part source;

    RelatedPartResolver(Part source) {
        this.source = source;
    }

    /**
     * @throws IllegalStateException when the existing target is not of the kind's part class
     */
    <P extends XmlPart> P resolve(DependentPartKind<P> kind) {
        Part existing = source.findRelated(kind.relationshipType());
        if (existing != null) {
            if (!kind.partClass().isInstance(existing)) {
                throw new IllegalStateException(kind + " relationship from " + source.partName()
                        + " targets " + existing + ", expected " + kind.partClass().getSimpleName());
            }
            return kind.partClass().cast(existing);
        }

        P created = kind.createDefault(source.opcPackage());
        source.relateTo(created, kind.relationshipType());
        log.debug("Created default {} part {} for {}", kind, created.partName(), source.partName());
        return created;
    }

    /** The part related by {@code kind}, or {@code null}; never creates anything. */
    <P extends XmlPart> P find(DependentPartKind<P> kind) {
        Part existing = source.findRelated(kind.relationshipType());
        return kind.partClass().isInstance(existing) ? kind.partClass().cast(existing) : null;
    }
}
