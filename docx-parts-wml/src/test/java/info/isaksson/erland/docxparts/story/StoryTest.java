package info.isaksson.erland.docxparts.story;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.parts.DocumentPart;
import info.isaksson.erland.docxparts.parts.FooterPart;
import info.isaksson.erland.docxparts.styles.StyleNotFoundException;
import info.isaksson.erland.docxparts.styles.WrongStyleTypeException;
import info.isaksson.erland.docxparts.wml.Wml;
import info.isaksson.erland.docxparts.wml.WmlPackages;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StoryTest {

    @Test
    void newFooterHasOneFooterStyledParagraph() {
        FooterPart part = WmlPackages.documentPart(WmlPackages.create()).addFooterPart();
        Footer footer = part.footer();

        List<Paragraph> paragraphs = footer.paragraphs();
        assertEquals(1, paragraphs.size());
        assertEquals("Footer", paragraphs.get(0).styleId());
        assertEquals("Footer", paragraphs.get(0).style().name());
        assertEquals("", footer.text());
        assertSame(part, footer.part());
    }

    @Test
    void bodyParagraphsGoBeforeTheSectionProperties() {
        DocumentPart doc = WmlPackages.documentPart(WmlPackages.create());
        Story body = doc.body();

        body.addParagraph("Introduction", "Heading 1");
        body.addParagraph("Plain text", null);

        List<Paragraph> paragraphs = body.paragraphs();
        assertEquals(2, paragraphs.size());
        assertEquals("Heading1", paragraphs.get(0).styleId());
        assertNull(paragraphs.get(1).styleId());
        assertEquals("Normal", paragraphs.get(1).style().styleId());
        assertEquals("Introduction\nPlain text", body.text());
        assertEquals("sectPr", ((Element) body.element().getLastChild()).getLocalName());
    }

    @Test
    void setStyleRoutesLookupsThroughTheOwningPart() {
        OpcPackage pkg = WmlPackages.create();
        FooterPart part = WmlPackages.documentPart(pkg).addFooterPart();
        Paragraph p = part.footer().addParagraph(" page ", "Footer");

        p.setStyle("Heading 2");
        assertEquals("Heading2", p.styleId());
        assertEquals(" page ", p.text());

        p.setStyle(null);
        assertNull(p.styleId());
        assertNull(Wml.child(Wml.child(p.element(), "pPr"), "pStyle"));

        assertThrows(WrongStyleTypeException.class, () -> p.setStyle("Strong"));
        assertThrows(StyleNotFoundException.class, () -> p.setStyle("Nope"));
    }

    @Test
    void headerViewWrapsTheHeaderPart() {
        DocumentPart doc = WmlPackages.documentPart(WmlPackages.create());
        Header header = doc.addHeaderPart().header();
        header.addParagraph("Draft", "Header");

        assertEquals("\nDraft", header.text());
        assertEquals(1, doc.headerParts().size());
    }
}
