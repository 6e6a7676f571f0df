package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.RelationshipType;
import info.isaksson.erland.docxparts.opc.XmlPart;

import java.util.List;
import java.util.function.Function;

/**
 * The closed set of parts a story part depends on and can materialize on demand: each kind
 * ties a relationship type to its part class and default factory.
 */
public final class DependentPartKind<P extends XmlPart> {

    public static final DependentPartKind<StylesPart> STYLES =
            new DependentPartKind<>(RelationshipType.STYLES, StylesPart.class, StylesPart::defaultPart);
    public static final DependentPartKind<NumberingPart> NUMBERING =
            new DependentPartKind<>(RelationshipType.NUMBERING, NumberingPart.class, NumberingPart::defaultPart);
    public static final DependentPartKind<SettingsPart> SETTINGS =
            new DependentPartKind<>(RelationshipType.SETTINGS, SettingsPart.class, SettingsPart::defaultPart);

    private static final List<DependentPartKind<?>> VALUES = List.of(STYLES, NUMBERING, SETTINGS);

    private final RelationshipType relationshipType;
    private final Class<P> partClass;
    private final Function<OpcPackage, P> defaultFactory;

    private DependentPartKind(RelationshipType relationshipType, Class<P> partClass, Function<OpcPackage, P> defaultFactory) {
        this.relationshipType = relationshipType;
        this.partClass = partClass;
        this.defaultFactory = defaultFactory;
    }

    public static List<DependentPartKind<?>> values() {
        return VALUES;
    }

    public RelationshipType relationshipType() {
        return relationshipType;
    }

    public Class<P> partClass() {
        return partClass;
    }

    P createDefault(OpcPackage pkg) {
        return defaultFactory.apply(pkg);
    }

    @Override
    public String toString() {
        return relationshipType.name();
    }
}
