package info.isaksson.erland.docxparts.story;

import info.isaksson.erland.docxparts.parts.HeaderPart;
import org.w3c.dom.Element;

/** Content of a header part ({@code w:hdr}). */
public class Header extends Story {

    public Header(Element element, HeaderPart part) {
        super(element, part);
    }
}
