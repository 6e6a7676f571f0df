package info.isaksson.erland.docxparts.parts;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * Next free value for the unqualified {@code id} attribute of a part's XML.
 *
 * <p>Stateless: every call scans the whole document. The result is one more than the largest
 * numeric {@code id} present on any element; gaps are not filled and non-numeric values are
 * ignored.</p>
 */
public final class IdAllocator {

    private IdAllocator() {}

    /**
     * @throws IllegalStateException when the document already uses {@code Integer.MAX_VALUE}
     */
    public static int nextId(Document document) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        long max = 0;
        Node n = document.getDocumentElement();
        while (n != null) {
            if (n instanceof Element el) {
                max = Math.max(max, idOf(el));
            }
            n = nextInDocumentOrder(n);
        }
        if (max >= Integer.MAX_VALUE) {
            throw new IllegalStateException("id space exhausted: " + max + " already in use");
        }
        return (int) max + 1;
    }

    /** Numeric {@code id} of {@code el}, or 0 when absent, non-numeric or outside the int range. */
    private static long idOf(Element el) {
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (a.getNamespaceURI() != null) continue;
            String local = a.getLocalName() != null ? a.getLocalName() : a.getName();
            if ("id".equals(local)) {
                return parseId(a.getValue());
            }
        }
        return 0;
    }

    static long parseId(String v) {
        if (v == null || v.isEmpty()) return 0;
        int start = 0;
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c < '0' || c > '9') return 0;
            if (c == '0' && start == i) start++;
        }
        String digits = v.substring(start);
        if (digits.isEmpty()) return 0;
        if (digits.length() > 10) return 0;
        long value = Long.parseLong(digits);
        return value > Integer.MAX_VALUE ? 0 : value;
    }

    private static Node nextInDocumentOrder(Node n) {
        if (n.getFirstChild() != null) return n.getFirstChild();
        while (n != null) {
            if (n.getNextSibling() != null) return n.getNextSibling();
            n = n.getParentNode();
            if (n instanceof Document) return null;
        }
        return null;
    }
}
