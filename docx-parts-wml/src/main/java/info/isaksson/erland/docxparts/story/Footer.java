package info.isaksson.erland.docxparts.story;

import info.isaksson.erland.docxparts.parts.FooterPart;
import org.w3c.dom.Element;

/** Content of a footer part ({@code w:ftr}). */
public class Footer extends Story {

    public Footer(Element element, FooterPart part) {
        super(element, part);
    }
}
