package info.isaksson.erland.docxparts.styles;

import info.isaksson.erland.docxparts.wml.Wml;
import org.w3c.dom.Element;

/**
 * View over one {@code w:style} element. Two views are equal when they wrap the same element.
 */
public final class Style {

    private final Element element;

    public Style(Element element) {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        this.element = element;
    }

    public Element element() {
        return element;
    }

    /** {@code w:styleId}, or {@code null} when absent. */
    public String styleId() {
        String id = Wml.attr(element, "styleId");
        return id == null || id.isEmpty() ? null : id;
    }

    /** UI name of the style ("Heading 1"), or {@code null} when the style has no name. */
    public String name() {
        return BabelFish.internal2ui(Wml.childVal(element, "name"));
    }

    public StyleType type() {
        return StyleType.fromXml(Wml.attr(element, "type"));
    }

    public boolean isDefault() {
        return Wml.isOn(Wml.attr(element, "default"));
    }

    /** Built-in styles are the ones Word defines; user-defined styles carry {@code w:customStyle}. */
    public boolean isBuiltin() {
        return !Wml.isOn(Wml.attr(element, "customStyle"));
    }

    /** {@code w:basedOn} style id, or {@code null}. */
    public String basedOnId() {
        return Wml.childVal(element, "basedOn");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Style s && s.element == element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return "Style[" + styleId() + ", " + type().xmlValue() + "]";
    }
}
