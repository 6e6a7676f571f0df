package info.isaksson.erland.docxparts.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** What the service saw (and possibly created) for one story part. */
@JsonPropertyOrder({"partName", "kind", "paragraphCount", "nextId", "related", "created"})
public final class StoryPartReport {

    public enum Kind { DOCUMENT, HEADER, FOOTER }

    public final String partName;
    public final Kind kind;
    public final int paragraphCount;
    public final int nextId;

    /** Dependent kind name to related part name, for relationships present after processing. */
    public final Map<String, String> related;

    /** Dependent kinds whose default part was created by this run. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> created;

    @JsonCreator
    public StoryPartReport(
            @JsonProperty("partName") String partName,
            @JsonProperty("kind") Kind kind,
            @JsonProperty("paragraphCount") int paragraphCount,
            @JsonProperty("nextId") int nextId,
            @JsonProperty("related") Map<String, String> related,
            @JsonProperty("created") List<String> created
    ) {
        this.partName = partName;
        this.kind = kind == null ? Kind.DOCUMENT : kind;
        this.paragraphCount = paragraphCount;
        this.nextId = nextId;
        this.related = related == null ? Map.of() : new TreeMap<>(related);
        this.created = created == null ? List.of() : List.copyOf(created);
    }
}
