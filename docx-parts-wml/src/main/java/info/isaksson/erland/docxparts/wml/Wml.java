package info.isaksson.erland.docxparts.wml;

import info.isaksson.erland.docxparts.opc.OxmlSupport;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/** Small DOM helpers for elements in the {@code w:} namespace. */
public final class Wml {

    private Wml() {}

    /** First direct {@code w:localName} child, or {@code null}. */
    public static Element child(Element parent, String localName) {
        return OxmlSupport.firstChild(parent, WmlNamespaces.W, localName);
    }

    /** All direct {@code w:localName} children in document order. */
    public static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element el && WmlNamespaces.W.equals(el.getNamespaceURI()) && localName.equals(el.getLocalName())) {
                out.add(el);
            }
        }
        return out;
    }

    /** Value of attribute {@code w:localName}, or {@code null} when absent. */
    public static String attr(Element el, String localName) {
        if (el == null || !el.hasAttributeNS(WmlNamespaces.W, localName)) return null;
        return el.getAttributeNS(WmlNamespaces.W, localName);
    }

    public static void setAttr(Element el, String localName, String value) {
        el.setAttributeNS(WmlNamespaces.W, "w:" + localName, value);
    }

    /** {@code w:val} of the {@code w:localName} child, or {@code null}. */
    public static String childVal(Element parent, String localName) {
        return attr(child(parent, localName), "val");
    }

    /** New {@code w:localName} element owned by {@code context}'s document (not yet attached). */
    public static Element create(Element context, String localName) {
        return context.getOwnerDocument().createElementNS(WmlNamespaces.W, "w:" + localName);
    }

    /** Existing {@code w:localName} child of {@code parent}, or a new one inserted as first child. */
    public static Element getOrAddFirst(Element parent, String localName) {
        Element el = child(parent, localName);
        if (el == null) {
            el = create(parent, localName);
            parent.insertBefore(el, parent.getFirstChild());
        }
        return el;
    }

    /** OOXML on/off semantics: absent {@code w:val} means on. */
    public static boolean isOn(Element el) {
        if (el == null) return false;
        String v = attr(el, "val");
        return v == null || isOn(v);
    }

    /** On/off attribute value: anything but {@code 0}, {@code false} or {@code off} is on. */
    public static boolean isOn(String value) {
        if (value == null) return false;
        return switch (value.trim().toLowerCase()) {
            case "0", "false", "off" -> false;
            default -> true;
        };
    }
}
