package info.isaksson.erland.docxparts.core;

import info.isaksson.erland.docxparts.parts.DependentPartKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for {@link DocxPartsService}.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class DocxPartsOptions {

    /** Dependent parts to materialize for every visited story part. */
    public boolean styles = true;
    public boolean settings = true;
    public boolean numbering = false;

    /** Story parts to visit. The main document part is always visited. */
    public boolean headers = true;
    public boolean footers = true;

    List<DependentPartKind<?>> selectedKinds() {
        List<DependentPartKind<?>> out = new ArrayList<>();
        if (styles) out.add(DependentPartKind.STYLES);
        if (numbering) out.add(DependentPartKind.NUMBERING);
        if (settings) out.add(DependentPartKind.SETTINGS);
        return out;
    }
}
