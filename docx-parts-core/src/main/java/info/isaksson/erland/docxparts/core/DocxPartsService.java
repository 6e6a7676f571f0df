package info.isaksson.erland.docxparts.core;

import info.isaksson.erland.docxparts.opc.OpcPackage;
import info.isaksson.erland.docxparts.opc.XmlPart;
import info.isaksson.erland.docxparts.parts.DependentPartKind;
import info.isaksson.erland.docxparts.parts.DocumentPart;
import info.isaksson.erland.docxparts.parts.FooterPart;
import info.isaksson.erland.docxparts.parts.HeaderPart;
import info.isaksson.erland.docxparts.parts.StoryPart;
import info.isaksson.erland.docxparts.story.Story;
import info.isaksson.erland.docxparts.wml.WmlPackages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Package-level API over the story part facades.
 *
 * <p>CLI and other wrappers should use this class instead of walking parts themselves.</p>
 */
public final class DocxPartsService {

    private static final Logger log = LoggerFactory.getLogger(DocxPartsService.class);

    /** Report on the package at {@code input} without changing or creating anything. */
    public PackageReport inspect(Path input, DocxPartsOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (options == null) options = new DocxPartsOptions();

        OpcPackage pkg = WmlPackages.open(input);
        List<StoryPartReport> stories = new ArrayList<>();
        for (StoryPart part : storyParts(pkg, options)) {
            stories.add(report(part, List.of()));
        }
        return new PackageReport(title(pkg), pkg.parts().size(), stories);
    }

    /**
     * Resolve the selected dependent parts for every visited story part of the package at
     * {@code input}, creating defaults where missing, and save the result to {@code output}.
     */
    public PackageReport materialize(Path input, Path output, DocxPartsOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (output == null) throw new IllegalArgumentException("output must not be null");
        if (options == null) options = new DocxPartsOptions();

        OpcPackage pkg = WmlPackages.open(input);
        List<StoryPartReport> stories = new ArrayList<>();
        for (StoryPart part : storyParts(pkg, options)) {
            List<String> created = new ArrayList<>();
            for (DependentPartKind<?> kind : options.selectedKinds()) {
                boolean existed = part.existingPart(kind) != null;
                part.dependentPart(kind);
                if (!existed) created.add(kind.toString());
            }
            stories.add(report(part, created));
        }
        pkg.save(output);

        PackageReport report = new PackageReport(title(pkg), pkg.parts().size(), stories);
        log.info("Materialized {} dependent part(s) across {} story part(s) into {}",
                report.createdCount(), stories.size(), output);
        return report;
    }

    private static List<StoryPart> storyParts(OpcPackage pkg, DocxPartsOptions options) {
        DocumentPart doc = WmlPackages.documentPart(pkg);
        List<StoryPart> out = new ArrayList<>();
        out.add(doc);
        if (options.headers) out.addAll(doc.headerParts());
        if (options.footers) out.addAll(doc.footerParts());
        return out;
    }

    private static StoryPartReport report(StoryPart part, List<String> created) {
        Map<String, String> related = new LinkedHashMap<>();
        for (DependentPartKind<?> kind : DependentPartKind.values()) {
            XmlPart target = part.existingPart(kind);
            if (target != null) related.put(kind.toString(), target.partName().uri());
        }
        return new StoryPartReport(
                part.partName().uri(),
                kindOf(part),
                story(part).paragraphs().size(),
                part.nextId(),
                related,
                created
        );
    }

    private static StoryPartReport.Kind kindOf(StoryPart part) {
        if (part instanceof HeaderPart) return StoryPartReport.Kind.HEADER;
        if (part instanceof FooterPart) return StoryPartReport.Kind.FOOTER;
        return StoryPartReport.Kind.DOCUMENT;
    }

    private static Story story(StoryPart part) {
        if (part instanceof HeaderPart h) return h.header();
        if (part instanceof FooterPart f) return f.footer();
        return ((DocumentPart) part).body();
    }

    private static String title(OpcPackage pkg) {
        String title = pkg.coreProperties().getTitle();
        return title.isEmpty() ? null : title;
    }
}
