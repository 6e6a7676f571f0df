package info.isaksson.erland.docxparts.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Result of inspecting or materializing one package. */
@JsonPropertyOrder({"title", "partCount", "storyParts"})
public final class PackageReport {

    /** Core properties title; absent when it is empty. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String title;

    public final int partCount;
    public final List<StoryPartReport> storyParts;

    @JsonCreator
    public PackageReport(
            @JsonProperty("title") String title,
            @JsonProperty("partCount") int partCount,
            @JsonProperty("storyParts") List<StoryPartReport> storyParts
    ) {
        this.title = title;
        this.partCount = partCount;
        this.storyParts = storyParts == null ? List.of() : List.copyOf(storyParts);
    }

    /** Number of dependent parts created across all story parts. */
    public int createdCount() {
        int n = 0;
        for (StoryPartReport s : storyParts) n += s.created.size();
        return n;
    }
}
