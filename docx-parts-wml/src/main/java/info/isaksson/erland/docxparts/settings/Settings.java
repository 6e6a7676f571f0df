package info.isaksson.erland.docxparts.settings;

import info.isaksson.erland.docxparts.wml.Wml;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Set;

/** Document-level settings ({@code w:settings}). */
public final class Settings {

    // Elements that must follow w:evenAndOddHeaders in w:settings.
    private static final Set<String> AFTER_EVEN_AND_ODD_HEADERS = Set.of(
            "bookFoldRevPrinting", "bookFoldPrinting", "bookFoldPrintingSheets",
            "drawingGridHorizontalSpacing", "drawingGridVerticalSpacing",
            "displayHorizontalDrawingGridEvery", "displayVerticalDrawingGridEvery",
            "doNotUseMarginsForDrawingGridOrigin", "drawingGridHorizontalOrigin",
            "drawingGridVerticalOrigin", "doNotShadeFormData", "noPunctuationKerning",
            "characterSpacingControl", "printTwoOnOne", "strictFirstAndLastChars",
            "noLineBreaksAfter", "noLineBreaksBefore", "savePreviewPicture",
            "doNotValidateAgainstSchema", "saveInvalidXml", "ignoreMixedContent",
            "alwaysShowPlaceholderText", "doNotDemarcateInvalidXml", "saveXmlDataOnly",
            "useXSLTWhenSaving", "saveThroughXslt", "showXMLTags", "alwaysMergeEmptyNamespace",
            "updateFields", "hdrShapeDefaults", "footnotePr", "endnotePr", "compat", "docVars",
            "rsids", "mathPr", "attachedSchema", "themeFontLang", "clrSchemeMapping",
            "doNotIncludeSubdocsInStats", "doNotAutoCompressPictures", "forceUpgrade", "captions",
            "readModeInkLockDown", "smartTagType", "schemaLibrary", "shapeDefaults",
            "doNotEmbedSmartTags", "decimalSymbol", "listSeparator");

    private final Element root;

    public Settings(Element root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        this.root = root;
    }

    /** True when odd and even pages get different headers and footers. */
    public boolean isOddAndEvenPagesHeaderFooter() {
        return Wml.isOn(Wml.child(root, "evenAndOddHeaders"));
    }

    public void setOddAndEvenPagesHeaderFooter(boolean value) {
        Element existing = Wml.child(root, "evenAndOddHeaders");
        if (existing != null) {
            root.removeChild(existing);
        }
        if (!value) return;

        Element el = Wml.create(root, "evenAndOddHeaders");
        root.insertBefore(el, firstSuccessor());
    }

    private Node firstSuccessor() {
        for (Node n = root.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element el && AFTER_EVEN_AND_ODD_HEADERS.contains(el.getLocalName())) {
                return el;
            }
        }
        return null;
    }

    /** {@code w:defaultTabStop} in twips, or -1 when not set. */
    public int defaultTabStop() {
        String v = Wml.childVal(root, "defaultTabStop");
        if (v == null || v.isBlank() || v.trim().length() > 9 || !v.trim().chars().allMatch(Character::isDigit)) return -1;
        return Integer.parseInt(v.trim());
    }
}
