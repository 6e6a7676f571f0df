package info.isaksson.erland.docxparts.numbering;

import info.isaksson.erland.docxparts.wml.Wml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** The numbering instances ({@code w:num}) of a numbering part. */
public final class NumberingDefinitions {

    private final Element root;

    public NumberingDefinitions(Element root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        this.root = root;
    }

    public int size() {
        return Wml.children(root, "num").size();
    }

    /** {@code w:numId} values in document order; non-numeric values are skipped. */
    public List<Integer> numIds() {
        List<Integer> out = new ArrayList<>();
        for (Element num : Wml.children(root, "num")) {
            String v = Wml.attr(num, "numId");
            if (v != null && !v.isEmpty() && v.length() < 10 && v.chars().allMatch(Character::isDigit)) {
                out.add(Integer.parseInt(v));
            }
        }
        return out;
    }

    /** {@code w:abstractNumId} referenced by numbering instance {@code numId}, or -1 when absent or malformed. */
    public int abstractNumId(int numId) {
        for (Element num : Wml.children(root, "num")) {
            if (Integer.toString(numId).equals(Wml.attr(num, "numId"))) {
                String v = Wml.childVal(num, "abstractNumId");
                if (v == null) return -1;
                v = v.trim();
                boolean numeric = !v.isEmpty() && v.length() < 10 && v.chars().allMatch(c -> c >= '0' && c <= '9');
                return numeric ? Integer.parseInt(v) : -1;
            }
        }
        return -1;
    }

    /**
     * Add a numbering instance referencing {@code abstractNumId}.
     *
     * <p>Unlike part-level ids, numbering ids fill gaps: the new instance takes the lowest
     * positive {@code w:numId} not yet used.</p>
     *
     * @return the new {@code w:numId}
     */
    public int addNum(int abstractNumId) {
        if (abstractNumId < 0) throw new IllegalArgumentException("abstractNumId must not be negative: " + abstractNumId);
        int numId = nextNumId();

        Element num = Wml.create(root, "num");
        Wml.setAttr(num, "numId", Integer.toString(numId));
        Element abs = Wml.create(root, "abstractNumId");
        Wml.setAttr(abs, "val", Integer.toString(abstractNumId));
        num.appendChild(abs);
        // w:num follows every w:abstractNum; w:numIdMacAtCleanup, when present, stays last.
        root.insertBefore(num, Wml.child(root, "numIdMacAtCleanup"));
        return numId;
    }

    private int nextNumId() {
        Set<Integer> used = new HashSet<>(numIds());
        int n = 1;
        while (used.contains(n)) n++;
        return n;
    }
}
