package info.isaksson.erland.docxparts.styles;

import info.isaksson.erland.docxparts.wml.Wml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The style definitions of a document ({@code w:styles}).
 *
 * <p>Lookups by name take the UI name ("Heading 1"); lookups by id take {@code w:styleId}
 * ("Heading1").</p>
 */
public final class Styles implements Iterable<Style> {

    private static final Logger log = LoggerFactory.getLogger(Styles.class);

    private static final Map<String, String> BUILTIN_STYLE_IDS = Map.ofEntries(
            Map.entry("caption", "Caption"),
            Map.entry("heading 1", "Heading1"),
            Map.entry("heading 2", "Heading2"),
            Map.entry("heading 3", "Heading3"),
            Map.entry("heading 4", "Heading4"),
            Map.entry("heading 5", "Heading5"),
            Map.entry("heading 6", "Heading6"),
            Map.entry("heading 7", "Heading7"),
            Map.entry("heading 8", "Heading8"),
            Map.entry("heading 9", "Heading9")
    );

    private final Element root;

    public Styles(Element root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        this.root = root;
    }

    public int size() {
        return Wml.children(root, "style").size();
    }

    @Override
    public Iterator<Style> iterator() {
        List<Style> out = new ArrayList<>();
        for (Element el : Wml.children(root, "style")) out.add(new Style(el));
        return out.iterator();
    }

    /** True when a style with UI name {@code name} is defined. */
    public boolean contains(String name) {
        return findByName(name) != null;
    }

    /**
     * The style with UI name {@code name}. Falls back to a lookup by style id, which is
     * deprecated and logged.
     *
     * @throws StyleNotFoundException when neither lookup matches
     */
    public Style get(String name) {
        Style byName = findByName(name);
        if (byName != null) return byName;

        Style byId = findById(name);
        if (byId != null) {
            log.warn("Style lookup by style id is deprecated, use the style name instead: '{}'", name);
            return byId;
        }
        throw new StyleNotFoundException(name);
    }

    /**
     * The style matching {@code styleId} and {@code type}. A {@code null} id, an unknown id, or an
     * id naming a style of another type yields the default style for {@code type}.
     */
    public Style getById(String styleId, StyleType type) {
        if (styleId == null) return defaultFor(type);
        Style style = findById(styleId);
        if (style == null || style.type() != type) {
            return defaultFor(type);
        }
        return style;
    }

    /**
     * Style id for the style with UI name {@code styleName}.
     *
     * @return the id, or {@code null} when {@code styleName} is {@code null} or names the default
     *         style for {@code type}
     * @throws StyleNotFoundException when no style has that name
     * @throws WrongStyleTypeException when the style is not of {@code type}
     */
    public String getStyleId(String styleName, StyleType type) {
        if (styleName == null) return null;
        return styleIdOf(get(styleName), type);
    }

    /** Same as {@link #getStyleId(String, StyleType)} for a style object. */
    public String getStyleId(Style style, StyleType type) {
        if (style == null) return null;
        return styleIdOf(style, type);
    }

    private String styleIdOf(Style style, StyleType type) {
        if (style.type() != type) {
            throw new WrongStyleTypeException(style.name(), style.type(), type);
        }
        if (style.equals(defaultFor(type))) return null;
        return style.styleId();
    }

    /**
     * Default style for {@code type}: the last style of that type flagged {@code w:default}, or
     * {@code null} when the document designates none.
     */
    public Style defaultFor(StyleType type) {
        Style last = null;
        for (Style s : this) {
            if (s.type() == type && s.isDefault()) last = s;
        }
        return last;
    }

    /**
     * Add a new style. The style id is derived from the name: spaces removed, built-in heading
     * and caption names mapped to Word's ids.
     *
     * @throws IllegalArgumentException when a style with this name already exists
     */
    public Style addStyle(String name, StyleType type, boolean builtin) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (contains(name)) {
            throw new IllegalArgumentException("document already contains style '" + name + "'");
        }
        String internal = BabelFish.ui2internal(name);

        Element style = Wml.create(root, "style");
        Wml.setAttr(style, "type", type.xmlValue());
        if (!builtin) Wml.setAttr(style, "customStyle", "1");
        Wml.setAttr(style, "styleId", BUILTIN_STYLE_IDS.getOrDefault(internal, internal.replace(" ", "")));
        Element nameEl = Wml.create(root, "name");
        Wml.setAttr(nameEl, "val", internal);
        style.appendChild(nameEl);
        root.appendChild(style);
        return new Style(style);
    }

    private Style findByName(String name) {
        if (name == null) return null;
        String internal = BabelFish.ui2internal(name);
        for (Element el : Wml.children(root, "style")) {
            if (internal.equals(Wml.childVal(el, "name"))) return new Style(el);
        }
        return null;
    }

    private Style findById(String styleId) {
        if (styleId == null) return null;
        for (Element el : Wml.children(root, "style")) {
            if (styleId.equals(Wml.attr(el, "styleId"))) return new Style(el);
        }
        return null;
    }
}
