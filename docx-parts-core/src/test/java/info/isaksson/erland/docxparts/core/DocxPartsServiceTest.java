package info.isaksson.erland.docxparts.core;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.parts.DocumentPart;
import info.isaksson.erland.docxparts.parts.FooterPart;
import info.isaksson.erland.docxparts.wml.WmlPackages;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DocxPartsServiceTest {

    /** Document with one body paragraph, one footer and one header; only the document has styles. */
    private static Path fixture() throws IOException {
        OpcPackage pkg = WmlPackages.create();
        DocumentPart doc = WmlPackages.documentPart(pkg);
        doc.body().addParagraph("Hello", "Heading 1");
        doc.coreProperties().setTitle("Fixture");
        FooterPart footer = doc.addFooterPart();
        footer.element().setAttribute("id", "6");
        doc.addHeaderPart();

        Path file = Files.createTempDirectory("docx-parts-core").resolve("fixture.docx");
        pkg.save(file);
        return file;
    }

    @Test
    void inspectReportsWithoutCreatingParts() throws IOException {
        Path input = fixture();
        byte[] before = Files.readAllBytes(input);

        PackageReport report = new DocxPartsService().inspect(input, new DocxPartsOptions());

        assertEquals("Fixture", report.title);
        assertEquals(3, report.storyParts.size());
        StoryPartReport doc = report.storyParts.get(0);
        assertEquals("/word/document.xml", doc.partName);
        assertEquals(StoryPartReport.Kind.DOCUMENT, doc.kind);
        assertEquals(1, doc.paragraphCount);
        assertEquals(Map.of("STYLES", "/word/styles.xml"), doc.related);
        assertEquals(StoryPartReport.Kind.HEADER, report.storyParts.get(1).kind);
        StoryPartReport footer = report.storyParts.get(2);
        assertEquals(StoryPartReport.Kind.FOOTER, footer.kind);
        assertEquals(7, footer.nextId);
        assertTrue(footer.related.isEmpty());
        assertEquals(0, report.createdCount());
        assertArrayEquals(before, Files.readAllBytes(input));
    }

    @Test
    void materializeCreatesOnlyMissingSelectedParts() throws IOException {
        Path input = fixture();
        Path output = input.resolveSibling("out/materialized.docx");
        DocxPartsOptions options = new DocxPartsOptions();
        options.headers = false;
        options.numbering = true;

        PackageReport report = new DocxPartsService().materialize(input, output, options);

        assertEquals(2, report.storyParts.size());
        StoryPartReport doc = report.storyParts.get(0);
        assertEquals(List.of("NUMBERING", "SETTINGS"), doc.created);
        assertEquals(3, doc.related.size());
        StoryPartReport footer = report.storyParts.get(1);
        assertEquals(List.of("STYLES", "NUMBERING", "SETTINGS"), footer.created);
        assertEquals(5, report.createdCount());

        PackageReport again = new DocxPartsService().inspect(output, options);
        assertEquals(3, again.storyParts.get(1).related.size());
        assertEquals(report.partCount, again.partCount);
    }

    @Test
    void materializingTwiceCreatesNothingTheSecondTime() throws IOException {
        Path input = fixture();
        Path once = input.resolveSibling("once.docx");
        Path twice = input.resolveSibling("twice.docx");
        DocxPartsService service = new DocxPartsService();

        service.materialize(input, once, null);
        PackageReport second = service.materialize(once, twice, null);

        assertEquals(0, second.createdCount());
    }

    @Test
    void nullArgumentsAreRejected() {
        DocxPartsService service = new DocxPartsService();
        assertThrows(IllegalArgumentException.class, () -> service.inspect(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.materialize(Path.of("a.docx"), null, null));
    }
}
