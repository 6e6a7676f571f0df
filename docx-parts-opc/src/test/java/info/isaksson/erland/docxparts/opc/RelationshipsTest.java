package info.isaksson.erland.docxparts.opc;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RelationshipsTest {

    private final OpcPackage pkg = new OpcPackage();

    private XmlPart xmlPart(String name) {
        return new XmlPart(PartName.of(name), ContentTypes.XML, OxmlSupport.newDocument("urn:test", "t:root"), pkg);
    }

    @Test
    void getOrAddReusesIdenticalRelationship() {
        XmlPart source = xmlPart("/word/footer1.xml");
        XmlPart target = xmlPart("/word/styles.xml");

        String first = source.relateTo(target, RelationshipType.STYLES);
        String second = source.relateTo(target, RelationshipType.STYLES);

        assertEquals("rId1", first);
        assertEquals(first, second);
        assertEquals(1, source.rels().size());
        assertSame(target, source.partRelatedBy(RelationshipType.STYLES));
    }

    @Test
    void singletonTypeRejectsSecondTarget() {
        XmlPart source = xmlPart("/word/footer1.xml");
        source.relateTo(xmlPart("/word/styles.xml"), RelationshipType.STYLES);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> source.relateTo(xmlPart("/word/styles2.xml"), RelationshipType.STYLES));
        assertTrue(ex.getMessage().contains("STYLES"));
        assertEquals(1, source.rels().size());
    }

    @Test
    void externalRelationshipOfSingletonTypeDoesNotBlockAnInternalOne() {
        XmlPart source = xmlPart("/word/footer1.xml");
        source.relateToExternal("https://example.com/styles.xml", RelationshipType.STYLES);

        assertNull(source.findRelated(RelationshipType.STYLES));
        XmlPart styles = xmlPart("/word/styles.xml");
        source.relateTo(styles, RelationshipType.STYLES);

        assertSame(styles, source.findRelated(RelationshipType.STYLES));
        assertEquals(2, source.rels().size());
    }

    @Test
    void nonSingletonTypeAllowsManyTargets() {
        XmlPart doc = xmlPart("/word/document.xml");
        doc.relateTo(xmlPart("/word/footer1.xml"), RelationshipType.FOOTER);
        doc.relateTo(xmlPart("/word/footer2.xml"), RelationshipType.FOOTER);

        assertEquals(2, doc.rels().partsWithRelType(RelationshipType.FOOTER).size());
        assertThrows(IllegalStateException.class, () -> doc.findRelated(RelationshipType.FOOTER));
    }

    @Test
    void missingRelationshipThrowsFromStrictLookupOnly() {
        XmlPart source = xmlPart("/word/footer1.xml");

        RelationshipNotFoundException ex = assertThrows(RelationshipNotFoundException.class,
                () -> source.partRelatedBy(RelationshipType.NUMBERING));
        assertEquals(RelationshipType.NUMBERING, ex.getType());
        assertNull(source.findRelated(RelationshipType.NUMBERING));
    }

    @Test
    void newRIdsNeverReuseExistingOnes() {
        XmlPart doc = xmlPart("/word/document.xml");
        String a = doc.relateTo(xmlPart("/word/footer1.xml"), RelationshipType.FOOTER);
        String b = doc.relateTo(xmlPart("/word/footer2.xml"), RelationshipType.FOOTER);
        String c = doc.relateToExternal("https://example.com/", RelationshipType.HYPERLINK);

        assertEquals(3, Set.of(a, b, c).size());
    }

    @Test
    void externalRelationshipsKeepTheirReference() {
        XmlPart source = xmlPart("/word/document.xml");
        String rId = source.relateToExternal("https://example.com/", RelationshipType.HYPERLINK);

        Relationship r = source.rels().get(rId);
        assertTrue(r.isExternal());
        assertEquals("https://example.com/", r.externalRef());
        assertNull(r.targetName());
        assertNull(source.relatedPart(rId));
        assertEquals(rId, source.relateToExternal("https://example.com/", RelationshipType.HYPERLINK));
    }

    @Test
    void cannotRelateAcrossPackages() {
        XmlPart source = xmlPart("/word/footer1.xml");
        XmlPart foreign = new XmlPart(PartName.of("/word/styles.xml"), ContentTypes.XML,
                OxmlSupport.newDocument("urn:test", "t:root"), new OpcPackage());

        assertThrows(IllegalArgumentException.class, () -> source.relateTo(foreign, RelationshipType.STYLES));
    }

    @Test
    void duplicatePartNamesAreRejected() {
        xmlPart("/word/styles.xml");

        assertThrows(IllegalStateException.class, () -> xmlPart("/word/styles.xml"));
    }
}
