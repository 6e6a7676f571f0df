package info.isaksson.erland.docxparts.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of {@link PackageReport}.
 *
 * <p>Output is deterministic: map keys are sorted and the pretty printer is fixed.</p>
 */
public final class PackageReportJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private PackageReportJson() {}

    public static PackageReport readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        return MAPPER.readValue(json, PackageReport.class);
    }

    public static void write(PackageReport report, Path path) throws IOException {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, report);
            out.write('\n');
        }
    }

    public static String toJsonString(PackageReport report) throws IOException {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        return MAPPER.writer(PRETTY).writeValueAsString(report) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // The caller owns the stream.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
