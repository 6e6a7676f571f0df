package info.isaksson.erland.docxparts.opc;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;

import static info.isaksson.erland.docxparts.opc.ZipFixture.MAIN_CT;
import static org.junit.jupiter.api.Assertions.*;

public class CorePropertiesTest {

    private static final String CORE_CT = "application/vnd.openxmlformats-package.core-properties+xml";

    @Test
    void newPackageCarriesFreshDocumentValues() {
        CoreProperties props = new OpcPackage().coreProperties();

        assertEquals("Word Document", props.getTitle());
        assertEquals("docx-parts", props.getLastModifiedBy());
        assertEquals(1, props.getRevision());
        assertNotNull(props.getModified());
        assertNull(props.getCreated());
        assertEquals("", props.getAuthor());
    }

    @Test
    void readsAndWritesProperties() {
        CoreProperties props = new OpcPackage().coreProperties();
        props.setAuthor("Erland");
        props.setKeywords("footer, styles");
        props.setCreated(Instant.parse("2024-03-01T10:15:30.250Z"));
        props.setRevision(7);

        assertEquals("Erland", props.getAuthor());
        assertEquals("footer, styles", props.getKeywords());
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), props.getCreated());
        assertEquals(7, props.getRevision());
    }

    @Test
    void rejectsInvalidValues() {
        CoreProperties props = new OpcPackage().coreProperties();
        assertThrows(IllegalArgumentException.class, () -> props.setRevision(0));
        assertThrows(IllegalArgumentException.class, () -> props.setTitle("x".repeat(256)));
        assertThrows(IllegalArgumentException.class, () -> props.setModified(null));
    }

    @Test
    void datesSurviveSaveAndOpen() throws IOException {
        OpcPackage pkg = new OpcPackage();
        pkg.coreProperties().setCreated(Instant.parse("2013-12-23T23:15:00Z"));
        pkg.coreProperties().setModified(Instant.parse("2014-01-02T08:00:00Z"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pkg.save(out);
        CoreProperties reopened = OpcPackage.open(new ByteArrayInputStream(out.toByteArray()), new PartFactory())
                .coreProperties();

        assertEquals(Instant.parse("2013-12-23T23:15:00Z"), reopened.getCreated());
        assertEquals(Instant.parse("2014-01-02T08:00:00Z"), reopened.getModified());
    }

    @Test
    void readsPersistedPropertiesAndToleratesGaps() throws IOException {
        ZipFixture zip = new ZipFixture()
                .contentTypes("/word/document.xml", MAIN_CT, "/docProps/core.xml", CORE_CT)
                .rels("_rels/.rels",
                        "rId1", RelationshipType.OFFICE_DOCUMENT.uri(), "word/document.xml",
                        "rId2", RelationshipType.CORE_PROPERTIES.uri(), "docProps/core.xml")
                .put("word/document.xml", "<w:document xmlns:w=\"urn:w\"/>")
                .put("docProps/core.xml",
                        "<cp:coreProperties"
                        + " xmlns:cp=\"http://schemas.openxmlformats.org/package/2006/metadata/core-properties\""
                        + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
                        + " xmlns:dcterms=\"http://purl.org/dc/terms/\""
                        + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                        + "<dc:title>Fixture</dc:title>"
                        + "<cp:revision>three</cp:revision>"
                        + "<dcterms:modified xsi:type=\"dcterms:W3CDTF\">2013-12-23T23:15:00Z</dcterms:modified>"
                        + "</cp:coreProperties>");

        OpcPackage pkg = OpcPackage.open(zip.stream(), new PartFactory());
        CoreProperties props = pkg.coreProperties();

        assertEquals("Fixture", props.getTitle());
        assertEquals("", props.getSubject());
        assertEquals(0, props.getRevision());
        assertNull(props.getCreated());
        assertEquals(Instant.parse("2013-12-23T23:15:00Z"), props.getModified());
        assertNull(pkg.part(PartName.of("/docProps/core.xml")));
    }
}
