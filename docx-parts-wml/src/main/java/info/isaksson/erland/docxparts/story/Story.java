package info.isaksson.erland.docxparts.story;

import info.isaksson.erland.docxparts.parts.StoryPart;
import info.isaksson.erland.docxparts.styles.StyleType;
import info.isaksson.erland.docxparts.wml.Wml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Block content of a story: the document body, a header or a footer. Style names used here are
 * resolved through the owning part.
 */
public class Story {

    private final Element element;
    private final StoryPart part;

    public Story(Element element, StoryPart part) {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        if (part == null) throw new IllegalArgumentException("part must not be null");
        this.element = element;
        this.part = part;
    }

    public Element element() {
        return element;
    }

    public StoryPart part() {
        return part;
    }

    public List<Paragraph> paragraphs() {
        List<Paragraph> out = new ArrayList<>();
        for (Element p : Wml.children(element, "p")) out.add(new Paragraph(p, part));
        return out;
    }

    /**
     * Append a paragraph. In a document body it is placed before the final section properties.
     *
     * @param styleName UI name of a paragraph style, or {@code null} for the default style
     */
    public Paragraph addParagraph(String text, String styleName) {
        String styleId = styleName == null ? null : part.getStyleId(styleName, StyleType.PARAGRAPH);

        Element p = Wml.create(element, "p");
        Element sectPr = Wml.child(element, "sectPr");
        if (sectPr != null) {
            element.insertBefore(p, sectPr);
        } else {
            element.appendChild(p);
        }

        Paragraph paragraph = new Paragraph(p, part);
        if (styleId != null) paragraph.setStyleId(styleId);
        if (text != null && !text.isEmpty()) paragraph.addRun(text);
        return paragraph;
    }

    /** Text of all paragraphs joined with newlines. */
    public String text() {
        List<String> lines = new ArrayList<>();
        for (Paragraph p : paragraphs()) lines.add(p.text());
        return String.join("\n", lines);
    }
}
