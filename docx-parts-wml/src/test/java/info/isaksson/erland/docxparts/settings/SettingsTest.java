package info.isaksson.erland.docxparts.settings;

import info.isaksson.erland.docxparts.wml.Templates;
import info.isaksson.erland.docxparts.wml.Wml;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SettingsTest {

    private static List<String> childNames(Element root) {
        List<String> out = new ArrayList<>();
        for (Node n = root.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element el) out.add(el.getLocalName());
        }
        return out;
    }

    @Test
    void evenAndOddHeadersIsInsertedInSchemaOrder() {
        Element root = Templates.load("default-settings.xml").getDocumentElement();
        Settings settings = new Settings(root);
        assertFalse(settings.isOddAndEvenPagesHeaderFooter());

        settings.setOddAndEvenPagesHeaderFooter(true);

        assertTrue(settings.isOddAndEvenPagesHeaderFooter());
        List<String> names = childNames(root);
        assertEquals(names.indexOf("defaultTabStop") + 1, names.indexOf("evenAndOddHeaders"));
        assertTrue(names.indexOf("evenAndOddHeaders") < names.indexOf("characterSpacingControl"));
    }

    @Test
    void settingTwiceKeepsASingleElementAndFalseRemovesIt() {
        Element root = Templates.load("default-settings.xml").getDocumentElement();
        Settings settings = new Settings(root);

        settings.setOddAndEvenPagesHeaderFooter(true);
        settings.setOddAndEvenPagesHeaderFooter(true);
        assertEquals(1, Wml.children(root, "evenAndOddHeaders").size());

        settings.setOddAndEvenPagesHeaderFooter(false);
        assertFalse(settings.isOddAndEvenPagesHeaderFooter());
        assertNull(Wml.child(root, "evenAndOddHeaders"));
    }

    @Test
    void explicitOffValueIsHonoured() {
        Element root = Templates.load("default-settings.xml").getDocumentElement();
        Element el = Wml.create(root, "evenAndOddHeaders");
        Wml.setAttr(el, "val", "false");
        root.appendChild(el);

        assertFalse(new Settings(root).isOddAndEvenPagesHeaderFooter());
        assertEquals(720, new Settings(root).defaultTabStop());
    }
}
