package info.isaksson.erland.docxparts.opc;

import org.apache.poi.openxml4j.opc.PackageProperties;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;

/**
 * Read/write view of the Dublin Core metadata of a package.
 *
 * <p>Absent string properties read as the empty string; absent dates as {@code null}; an
 * absent or non-numeric revision as 0. Date text is parsed by the package layer when the
 * package is opened.</p>
 */
public final class CoreProperties {

    private static final int MAX_LENGTH = 255;

    private final PackageProperties props;

    CoreProperties(PackageProperties props) {
        this.props = props;
    }

    public String getTitle() { return props.getTitleProperty().orElse(""); }
    public void setTitle(String v) { props.setTitleProperty(checked("title", v)); }

    public String getSubject() { return props.getSubjectProperty().orElse(""); }
    public void setSubject(String v) { props.setSubjectProperty(checked("subject", v)); }

    public String getAuthor() { return props.getCreatorProperty().orElse(""); }
    public void setAuthor(String v) { props.setCreatorProperty(checked("creator", v)); }

    public String getComments() { return props.getDescriptionProperty().orElse(""); }
    public void setComments(String v) { props.setDescriptionProperty(checked("description", v)); }

    public String getKeywords() { return props.getKeywordsProperty().orElse(""); }
    public void setKeywords(String v) { props.setKeywordsProperty(checked("keywords", v)); }

    public String getCategory() { return props.getCategoryProperty().orElse(""); }
    public void setCategory(String v) { props.setCategoryProperty(checked("category", v)); }

    public String getLastModifiedBy() { return props.getLastModifiedByProperty().orElse(""); }
    public void setLastModifiedBy(String v) { props.setLastModifiedByProperty(checked("lastModifiedBy", v)); }

    public int getRevision() {
        String s = props.getRevisionProperty().orElse("").trim();
        if (s.isEmpty() || s.length() > 9 || !s.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return 0;
        }
        return Integer.parseInt(s);
    }

    public void setRevision(int revision) {
        if (revision < 1) throw new IllegalArgumentException("revision must be a positive integer: " + revision);
        props.setRevisionProperty(Integer.toString(revision));
    }

    public Instant getCreated() { return instant(props.getCreatedProperty()); }
    public void setCreated(Instant v) { props.setCreatedProperty(date("created", v)); }

    public Instant getModified() { return instant(props.getModifiedProperty()); }
    public void setModified(Instant v) { props.setModifiedProperty(date("modified", v)); }

    private static Optional<String> checked(String name, String value) {
        if (value != null && value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(name + " exceeds " + MAX_LENGTH + " characters");
        }
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Instant instant(Optional<Date> date) {
        return date.map(d -> d.toInstant().truncatedTo(ChronoUnit.SECONDS)).orElse(null);
    }

    private static Optional<Date> date(String name, Instant value) {
        if (value == null) throw new IllegalArgumentException(name + " must not be null");
        return Optional.of(Date.from(value.truncatedTo(ChronoUnit.SECONDS)));
    }
}
