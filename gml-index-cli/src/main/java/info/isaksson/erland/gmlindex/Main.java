package info.isaksson.erland.gmlindex;

import info.isaksson.erland.gmlindex.cache.CacheLoadResult;
import info.isaksson.erland.gmlindex.cache.CacheSaveResult;
import info.isaksson.erland.gmlindex.core.EnsureReadyResult;
import info.isaksson.erland.gmlindex.core.ProjectIndexOptions;
import info.isaksson.erland.gmlindex.core.ProjectIndexService;
import info.isaksson.erland.gmlindex.model.IdentifierCategory;
import info.isaksson.erland.gmlindex.model.IdentifierCollections;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import info.isaksson.erland.gmlindex.model.ProjectIndexJson;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * CLI entrypoint: index a GameMaker project and print a summary, optionally writing the index as
 * JSON.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 build or I/O failure.</p>
 */
public final class Main {

    private static final ProjectIndexService SERVICE = new ProjectIndexService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.out, System.err);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp(out);
            return 0;
        }

        if (parsed.project == null && parsed.file == null) {
            err.println("Error: --project or --file is required.");
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }
        if (parsed.project != null && parsed.file != null) {
            err.println("Error: use either --project or --file, not both.");
            return 1;
        }

        final Path projectRoot;
        if (parsed.project != null) {
            projectRoot = Paths.get(parsed.project).toAbsolutePath().normalize();
            if (!Files.isDirectory(projectRoot)) {
                err.println("Error: --project must be an existing directory: " + projectRoot);
                return 1;
            }
        } else {
            Path file = Paths.get(parsed.file).toAbsolutePath().normalize();
            if (!Files.exists(file)) {
                err.println("Error: --file does not exist: " + file);
                return 1;
            }
            Optional<Path> found;
            try {
                found = SERVICE.findProjectRoot(file);
            } catch (IOException e) {
                err.println("Error: could not search for the project root of " + file);
                err.println(e.getMessage());
                return 2;
            }
            if (found.isEmpty()) {
                err.println("Error: no GameMaker project (.yyp) found above " + file);
                return 1;
            }
            projectRoot = found.get();
        }

        final ProjectIndexOptions options;
        try {
            options = toCoreOptions(parsed);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return 1;
        }

        final EnsureReadyResult result;
        try {
            result = SERVICE.index(projectRoot, options);
        } catch (IOException | RuntimeException e) {
            err.println("Error: indexing failed for " + projectRoot);
            err.println(e.getMessage() != null ? e.getMessage() : e.toString());
            return 2;
        }

        Path jsonOut = null;
        if (parsed.output != null) {
            jsonOut = Paths.get(parsed.output).toAbsolutePath().normalize();
            try {
                ProjectIndexJson.write(result.projectIndex, jsonOut);
            } catch (IOException e) {
                err.println("Error: could not write index to: " + jsonOut);
                err.println(e.getMessage());
                return 2;
            }
        }

        out.println(summary(result, jsonOut));
        return 0;
    }

    static ProjectIndexOptions toCoreOptions(CliArgs parsed) {
        ProjectIndexOptions o = new ProjectIndexOptions();
        Integer concurrency = ProjectIndexOptions.normalizeConcurrency(parsed.concurrency, "--concurrency");
        if (concurrency != null) o.concurrency = concurrency;
        Long maxBytes = ProjectIndexOptions.normalizeCacheMaxSizeBytes(parsed.cacheMaxBytes, "--cache-max-bytes");
        if (maxBytes != null) o.cacheMaxSizeBytes = maxBytes;
        if (parsed.cache != null) o.cacheFilePath = Paths.get(parsed.cache).toAbsolutePath().normalize();
        if (parsed.builtins != null) o.builtInIdentifiersPath = Paths.get(parsed.builtins).toAbsolutePath().normalize();
        o.formatterVersion = parsed.formatterVersion;
        o.pluginVersion = parsed.pluginVersion;
        o.useCache = !parsed.noCache;
        o.logMetrics = parsed.logMetrics;
        return o;
    }

    static String summary(EnsureReadyResult result, Path jsonOut) {
        ProjectIndex index = result.projectIndex;
        IdentifierCollections ids = index.identifiers;
        long resolved = index.relationships.scriptCalls.stream().filter(c -> c.resolved).count();

        StringBuilder sb = new StringBuilder();
        sb.append("gml-project-index\n");
        sb.append("- Project: ").append(result.projectRoot).append("\n");
        sb.append("- Source: ").append(result.source).append("\n");
        sb.append("- Resources: ").append(index.resources.size()).append("\n");
        sb.append("- Scopes: ").append(index.scopes.size()).append("\n");
        sb.append("- Files: ").append(index.files.size()).append("\n");
        sb.append("- Identifiers:");
        for (IdentifierCategory c : IdentifierCategory.values()) {
            sb.append(' ').append(c.prefix).append('=').append(ids.size(c));
        }
        sb.append("\n");
        sb.append("- Call edges: ").append(index.relationships.scriptCalls.size())
                .append(" (resolved ").append(resolved).append(")\n");
        sb.append("- Cache: ").append(cacheStatus(result.loadResult, result.saveResult));
        if (jsonOut != null) {
            sb.append("\n- Index JSON: ").append(jsonOut);
        }
        return sb.toString();
    }

    private static String cacheStatus(CacheLoadResult load, CacheSaveResult save) {
        if (load == null) return "disabled";
        if (load.isHit()) return "hit (" + load.cacheFilePath + ")";
        String s = "miss (" + load.missReason + ")";
        if (save != null) s += ", " + save;
        return s;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String project;
        String file;
        String output;
        String cache;
        boolean noCache = false;
        String concurrency;
        String cacheMaxBytes;
        String builtins;
        String formatterVersion;
        String pluginVersion;
        boolean logMetrics = false;

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
                    case "--project":
                        out.project = requireValue(args, ++i, "--project");
                        break;
                    case "--file":
                        out.file = requireValue(args, ++i, "--file");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--cache":
                        out.cache = requireValue(args, ++i, "--cache");
                        break;
                    case "--no-cache":
                        out.noCache = true;
                        break;
                    case "--concurrency":
                        out.concurrency = requireValue(args, ++i, "--concurrency");
                        break;
                    case "--cache-max-bytes":
                        out.cacheMaxBytes = requireValue(args, ++i, "--cache-max-bytes");
                        break;
                    case "--builtins":
                        out.builtins = requireValue(args, ++i, "--builtins");
                        break;
                    case "--formatter-version":
                        out.formatterVersion = requireValue(args, ++i, "--formatter-version");
                        break;
                    case "--plugin-version":
                        out.pluginVersion = requireValue(args, ++i, "--plugin-version");
                        break;
                    case "--log-metrics":
                        out.logMetrics = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --project
                        if (out.project == null) {
                            out.project = a;
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

        static void printHelp(PrintStream out) {
            out.println(
                    "gml-project-index\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar gml-index-cli.jar --project <dir> [options]\n" +
                    "  java -jar gml-index-cli.jar --file <path/to/script.gml> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --project <dir>          GameMaker project root (the folder holding the .yyp)\n" +
                    "  --file <path>            Index the project that owns this file\n" +
                    "  --output <file.json>     Write the project index as JSON\n" +
                    "  --cache <file>           Cache file (default: <project>/.tool-cache/project-index-cache.json)\n" +
                    "  --no-cache               Do not read or write the cache\n" +
                    "  --concurrency <n>        Source files analysed in parallel, 1-16 (default: 4)\n" +
                    "  --cache-max-bytes <n>    Skip writing caches larger than this (default: 8388608, 0 = no limit)\n" +
                    "  --builtins <file>        Built-in identifier data file (default: bundled list)\n" +
                    "  --formatter-version <v>  Version recorded in the cache; a different value forces a rebuild\n" +
                    "  --plugin-version <v>     Version recorded in the cache; a different value forces a rebuild\n" +
                    "  --log-metrics            Log build metrics at info level\n" +
                    "  -h, --help               Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar gml-index-cli.jar samples/mini-game\n" +
                    "  java -jar gml-index-cli.jar --project . --output out/index.json --log-metrics\n"
            );
        }
    }
}
