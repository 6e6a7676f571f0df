package info.isaksson.erland.docxparts.opc;

import java.util.NoSuchElementException;

/** Thrown when a source has no relationship of the requested type. */
public class RelationshipNotFoundException extends NoSuchElementException {

    private final RelationshipType type;

    public RelationshipNotFoundException(RelationshipType type, String source) {
        super("no relationship of type " + type + " from " + source);
        this.type = type;
    }

    public RelationshipType getType() {
        return type;
    }
}
