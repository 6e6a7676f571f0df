package info.isaksson.erland.docxparts.story;

import info.isaksson.erland.docxparts.parts.StoryPart;
import info.isaksson.erland.docxparts.styles.Style;
import info.isaksson.erland.docxparts.styles.StyleType;
import info.isaksson.erland.docxparts.wml.Wml;
import info.isaksson.erland.docxparts.wml.WmlNamespaces;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/** View over one {@code w:p} element. */
public class Paragraph {

    private final Element element;
    private final StoryPart part;

    public Paragraph(Element element, StoryPart part) {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        this.element = element;
        this.part = part;
    }

    public Element element() {
        return element;
    }

    /** Concatenated {@code w:t} text; tabs and breaks become {@code \t} and {@code \n}. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Element r : Wml.children(element, "r")) {
            for (Node n = r.getFirstChild(); n != null; n = n.getNextSibling()) {
                if (!(n instanceof Element el) || !WmlNamespaces.W.equals(el.getNamespaceURI())) {
                    continue;
                }
                switch (el.getLocalName()) {
                    case "t" -> sb.append(el.getTextContent());
                    case "tab" -> sb.append('\t');
                    case "br", "cr" -> sb.append('\n');
                    default -> { }
                }
            }
        }
        return sb.toString();
    }

    /** {@code w:pStyle} value, or {@code null} when the paragraph uses the default style. */
    public String styleId() {
        Element pPr = Wml.child(element, "pPr");
        return pPr == null ? null : Wml.childVal(pPr, "pStyle");
    }

    /** Effective paragraph style; the default paragraph style when none or an unknown one is set. */
    public Style style() {
        return part.getStyle(styleId(), StyleType.PARAGRAPH);
    }

    /**
     * Apply the paragraph style named {@code styleName}; {@code null} resets to the default.
     *
     * @throws info.isaksson.erland.docxparts.styles.StyleLookupException unknown name or not a paragraph style
     */
    public void setStyle(String styleName) {
        setStyleId(part.getStyleId(styleName, StyleType.PARAGRAPH));
    }

    void setStyleId(String styleId) {
        Element pPr = Wml.child(element, "pPr");
        if (styleId == null) {
            if (pPr != null) {
                Element pStyle = Wml.child(pPr, "pStyle");
                if (pStyle != null) pPr.removeChild(pStyle);
            }
            return;
        }
        if (pPr == null) pPr = Wml.getOrAddFirst(element, "pPr");
        Element pStyle = Wml.getOrAddFirst(pPr, "pStyle");
        Wml.setAttr(pStyle, "val", styleId);
    }

    void addRun(String text) {
        Element r = Wml.create(element, "r");
        Element t = Wml.create(element, "t");
        t.setTextContent(text);
        if (!text.equals(text.strip())) {
            t.setAttributeNS("http://www.w3.org/XML/1998/namespace", "xml:space", "preserve");
        }
        r.appendChild(t);
        element.appendChild(r);
    }

    @Override
    public String toString() {
        return "Paragraph[" + text() + "]";
    }
}
