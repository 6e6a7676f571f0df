package info.isaksson.erland.docxparts.styles;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates between the style names shown in the Word UI and the names stored in
 * {@code styles.xml}. Built-in heading, caption, header and footer styles are stored in lower
 * case ("heading 1") but displayed capitalized ("Heading 1").
 */
public final class BabelFish {

    private static final Map<String, String> UI_TO_INTERNAL = new HashMap<>();
    private static final Map<String, String> INTERNAL_TO_UI = new HashMap<>();

    static {
        alias("Caption", "caption");
        alias("Footer", "footer");
        alias("Header", "header");
        for (int i = 1; i <= 9; i++) {
            alias("Heading " + i, "heading " + i);
        }
    }

    private BabelFish() {}

    private static void alias(String ui, String internal) {
        UI_TO_INTERNAL.put(ui, internal);
        INTERNAL_TO_UI.put(internal, ui);
    }

    public static String ui2internal(String uiName) {
        if (uiName == null) return null;
        return UI_TO_INTERNAL.getOrDefault(uiName, uiName);
    }

    public static String internal2ui(String internalName) {
        if (internalName == null) return null;
        return INTERNAL_TO_UI.getOrDefault(internalName, internalName);
    }
}
