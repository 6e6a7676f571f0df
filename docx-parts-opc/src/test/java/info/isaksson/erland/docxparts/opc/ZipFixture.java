package info.isaksson.erland.docxparts.opc;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds package ZIPs member by member for tests that need exact package content. */
final class ZipFixture {

    static final String CONTENT_TYPES_NS = "http://schemas.openxmlformats.org/package/2006/content-types";
    static final String RELATIONSHIPS_NS = "http://schemas.openxmlformats.org/package/2006/relationships";
    static final String MAIN_CT = "application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml";

    private final Map<String, byte[]> members = new LinkedHashMap<>();

    ZipFixture put(String name, String content) {
        return put(name, content.getBytes(StandardCharsets.UTF_8));
    }

    ZipFixture put(String name, byte[] content) {
        members.put(name, content);
        return this;
    }

    /** Content types with xml, rels, png and jpeg defaults plus the given overrides (part name, type). */
    ZipFixture contentTypes(String... overrides) {
        StringBuilder sb = new StringBuilder("<Types xmlns=\"" + CONTENT_TYPES_NS + "\">")
                .append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>")
                .append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>")
                .append("<Default Extension=\"png\" ContentType=\"image/png\"/>")
                .append("<Default Extension=\"jpeg\" ContentType=\"image/jpeg\"/>");
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            sb.append("<Override PartName=\"").append(overrides[i])
                    .append("\" ContentType=\"").append(overrides[i + 1]).append("\"/>");
        }
        return put("[Content_Types].xml", sb.append("</Types>").toString());
    }

    /** A relationships member from (id, type, target) triples; a target starting with {@code http} is external. */
    ZipFixture rels(String member, String... triples) {
        StringBuilder sb = new StringBuilder("<Relationships xmlns=\"" + RELATIONSHIPS_NS + "\">");
        for (int i = 0; i + 2 < triples.length; i += 3) {
            sb.append("<Relationship Id=\"").append(triples[i])
                    .append("\" Type=\"").append(triples[i + 1])
                    .append("\" Target=\"").append(triples[i + 2]).append('"');
            if (triples[i + 2].startsWith("http")) sb.append(" TargetMode=\"External\"");
            sb.append("/>");
        }
        return put(member, sb.append("</Relationships>").toString());
    }

    byte[] bytes() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(baos)) {
            for (Map.Entry<String, byte[]> e : members.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return baos.toByteArray();
    }

    InputStream stream() throws IOException {
        return new ByteArrayInputStream(bytes());
    }
}
