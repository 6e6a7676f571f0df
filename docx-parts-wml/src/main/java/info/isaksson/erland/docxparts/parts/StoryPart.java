package info.isaksson.erland.docxparts.parts;

import info.isaksson.erland.docxparts.numbering.NumberingDefinitions;
import info.isaksson.erland.docxparts.opc.CoreProperties;
import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.PartName;
import info.isaksson.erland.docxparts.opc.XmlPart;
import info.isaksson.erland.docxparts.settings.Settings;
import info.isaksson.erland.docxparts.styles.Style;
import info.isaksson.erland.docxparts.styles.StyleType;
import info.isaksson.erland.docxparts.styles.Styles;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Base for parts that carry document content (main document, headers, footers).
 *
 * <p>The styles, settings and numbering parts this part depends on are resolved on first use:
 * an existing relationship is followed, otherwise a default part is created and related. The
 * result is cached on this instance. Not thread-safe.</p>
 */
public abstract class StoryPart extends XmlPart {

    private final RelatedPartResolver resolver = new RelatedPartResolver(this);

    private StylesPart stylesPart;
    private SettingsPart settingsPart;
    private NumberingPart numberingPart;

    protected StoryPart(PartName partName, String contentType, Document document, OpcPackage pkg) {
        super(partName, contentType, document, pkg);
    }

    public CoreProperties coreProperties() {
        return opcPackage().coreProperties();
    }

    /**
     * Style of {@code type} with id {@code styleId}. Falls back to the default style of
     * {@code type} when the id is {@code null}, unknown or names a style of another type.
     */
    public Style getStyle(String styleId, StyleType type) {
        return styles().getById(styleId, type);
    }

    /**
     * Style id of the style named {@code styleName}; {@code null} for the default style of
     * {@code type} or a {@code null} name.
     *
     * @throws info.isaksson.erland.docxparts.styles.StyleNotFoundException no style has that name
     * @throws info.isaksson.erland.docxparts.styles.WrongStyleTypeException the style is not of {@code type}
     */
    public String getStyleId(String styleName, StyleType type) {
        return styles().getStyleId(styleName, type);
    }

    public String getStyleId(Style style, StyleType type) {
        return styles().getStyleId(style, type);
    }

    /** Next unused value for an {@code id} attribute within this part. */
    public int nextId() {
        return IdAllocator.nextId(document());
    }

    public Styles styles() {
        return stylesPart().styles();
    }

    public Settings settings() {
        return settingsPart().settings();
    }

    public NumberingDefinitions numberingDefinitions() {
        return numberingPart().numberingDefinitions();
    }

    public StylesPart stylesPart() {
        if (stylesPart == null) {
            stylesPart = resolver.resolve(DependentPartKind.STYLES);
        }
        return stylesPart;
    }

    public SettingsPart settingsPart() {
        if (settingsPart == null) {
            settingsPart = resolver.resolve(DependentPartKind.SETTINGS);
        }
        return settingsPart;
    }

    public NumberingPart numberingPart() {
        if (numberingPart == null) {
            numberingPart = resolver.resolve(DependentPartKind.NUMBERING);
        }
        return numberingPart;
    }

    /** The part related by {@code kind}, or {@code null}. Never creates a part. */
    public <P extends XmlPart> P existingPart(DependentPartKind<P> kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        return resolver.find(kind);
    }

    /** Resolve {@code kind} the same way the typed accessors do. */
    public XmlPart dependentPart(DependentPartKind<?> kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (kind == DependentPartKind.STYLES) return stylesPart();
        if (kind == DependentPartKind.SETTINGS) return settingsPart();
        if (kind == DependentPartKind.NUMBERING) return numberingPart();
        throw new IllegalStateException("unsupported dependent part kind: " + kind);
    }

    public void save(Path path) throws IOException {
        opcPackage().save(path);
    }

    public void save(OutputStream out) throws IOException {
        opcPackage().save(out);
    }
}
