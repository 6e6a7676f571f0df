package info.isaksson.erland.docxparts.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PackageReportJsonTest {

    private static PackageReport sample() {
        Map<String, String> related = Map.of("SETTINGS", "/word/settings.xml", "STYLES", "/word/styles.xml");
        return new PackageReport("Minutes", 5, List.of(
                new StoryPartReport("/word/document.xml", StoryPartReport.Kind.DOCUMENT, 2, 1, related, List.of()),
                new StoryPartReport("/word/footer1.xml", StoryPartReport.Kind.FOOTER, 1, 4, Map.of(), List.of("STYLES"))
        ));
    }

    @Test
    void outputIsStableAndSorted() throws IOException {
        String json = PackageReportJson.toJsonString(sample());

        assertTrue(json.endsWith("}\n"));
        assertTrue(json.indexOf("\"SETTINGS\"") < json.indexOf("\"STYLES\""));
        assertTrue(json.indexOf("\"title\"") < json.indexOf("\"storyParts\""));
        assertFalse(json.contains("\"created\" : [ ]"), json);
        assertEquals(json, PackageReportJson.toJsonString(sample()));
    }

    @Test
    void writtenFileReadsBack() throws IOException {
        Path file = Files.createTempDirectory("docx-parts-json").resolve("nested/report.json");
        PackageReportJson.write(sample(), file);

        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertEquals(PackageReportJson.toJsonString(sample()), written);

        PackageReport back = PackageReportJson.readFromString(written);
        assertEquals("Minutes", back.title);
        assertEquals(List.of("STYLES"), back.storyParts.get(1).created);
        assertEquals(StoryPartReport.Kind.FOOTER, back.storyParts.get(1).kind);

        JsonNode node = new ObjectMapper().readTree(written);
        assertEquals(4, node.get("storyParts").get(1).get("nextId").asInt());
    }

    @Test
    void untitledReportOmitsTheTitle() throws IOException {
        PackageReport report = PackageReportJson.readFromString("{\"partCount\":1,\"storyParts\":[]}");
        assertNull(report.title);
        assertFalse(PackageReportJson.toJsonString(report).contains("title"));
    }
}
