package info.isaksson.erland.docxparts.cli;

import info.isaksson.erland.docxparts.core.DocxPartsOptions;
import info.isaksson.erland.docxparts.core.DocxPartsService;
import info.isaksson.erland.docxparts.core.PackageReport;
import info.isaksson.erland.docxparts.core.PackageReportJson;
import info.isaksson.erland.docxparts.core.StoryPartReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: inspects a .docx package, or materializes the styles, settings and numbering
 * parts its story parts depend on into a new package.
 */
public final class Main {

    private static final DocxPartsService SERVICE = new DocxPartsService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(inputPath)) {
            System.err.println("Error: --input must point to an existing .docx file: " + inputPath);
            return 1;
        }
        final Path outputPath = parsed.output == null ? null : Paths.get(parsed.output).toAbsolutePath().normalize();
        if (inputPath.equals(outputPath)) {
            System.err.println("Error: --output must differ from --input: " + outputPath);
            return 1;
        }

        final PackageReport report;
        try {
            DocxPartsOptions opts = toCoreOptions(parsed);
            report = outputPath == null
                    ? SERVICE.inspect(inputPath, opts)
                    : SERVICE.materialize(inputPath, outputPath, opts);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: processing failed: " + inputPath);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.report != null) {
            final Path reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                PackageReportJson.write(report, reportOut);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(summary(inputPath, outputPath, report));
        return 0;
    }

    private static DocxPartsOptions toCoreOptions(CliArgs parsed) {
        DocxPartsOptions o = new DocxPartsOptions();
        o.styles = parsed.styles;
        o.settings = parsed.settings;
        o.numbering = parsed.numbering;
        o.headers = parsed.headers;
        o.footers = parsed.footers;
        return o;
    }

    private static String summary(Path input, Path output, PackageReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(output == null ? "docx-parts (inspect)\n" : "docx-parts (materialize)\n");
        sb.append("- Input: ").append(input).append("\n");
        if (output != null) sb.append("- Output: ").append(output).append("\n");
        if (report.title != null) sb.append("- Title: ").append(report.title).append("\n");
        sb.append("- Parts: ").append(report.partCount).append("\n");
        for (StoryPartReport s : report.storyParts) {
            sb.append("- ").append(s.partName)
                    .append(" (").append(s.kind.name().toLowerCase()).append("): ")
                    .append(s.paragraphCount).append(" paragraph(s), next id ").append(s.nextId);
            if (!s.related.isEmpty()) sb.append(", related ").append(String.join(", ", s.related.keySet()));
            if (!s.created.isEmpty()) sb.append(", created ").append(String.join(", ", s.created));
            sb.append("\n");
        }
        if (output != null) sb.append("- Created parts: ").append(report.createdCount());
        return sb.toString().stripTrailing();
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output;
        String report;

        boolean styles = true;
        boolean settings = true;
        boolean numbering = false;

        boolean headers = true;
        boolean footers = true;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--styles":
                        out.styles = parseBoolean(requireValue(args, ++i, "--styles"), "--styles");
                        break;
                    case "--settings":
                        out.settings = parseBoolean(requireValue(args, ++i, "--settings"), "--settings");
                        break;
                    case "--numbering":
                        out.numbering = parseBoolean(requireValue(args, ++i, "--numbering"), "--numbering");
                        break;
                    case "--headers":
                        out.headers = parseBoolean(requireValue(args, ++i, "--headers"), "--headers");
                        break;
                    case "--footers":
                        out.footers = parseBoolean(requireValue(args, ++i, "--footers"), "--footers");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "docx-parts\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar docx-parts-cli.jar --input <file.docx> [--output <file.docx>] [options]\n" +
                    "\n" +
                    "Without --output the package is only inspected; nothing is created or written.\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>         Package to read (required; a bare path is accepted too)\n" +
                    "  --output <path>        Write a copy with missing dependent parts created\n" +
                    "  --report <file.json>   Also write the report as JSON\n" +
                    "  --styles <bool>        Materialize the styles part (default: true)\n" +
                    "  --settings <bool>      Materialize the settings part (default: true)\n" +
                    "  --numbering <bool>     Materialize the numbering part (default: false)\n" +
                    "  --headers <bool>       Visit header parts (default: true)\n" +
                    "  --footers <bool>       Visit footer parts (default: true)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar docx-parts-cli.jar letter.docx\n" +
                    "  java -jar docx-parts-cli.jar --input letter.docx --output out/letter.docx --numbering true\n"
            );
        }
    }
}
