package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.FsUtils;
import info.isaksson.erland.gmlindex.io.ProjectScan;
import info.isaksson.erland.gmlindex.io.ProjectTreeScanner;
import info.isaksson.erland.gmlindex.io.ScannedFile;
import info.isaksson.erland.gmlindex.model.FileRecord;
import info.isaksson.erland.gmlindex.model.IdentifierCollections;
import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.MetricsSummary;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import info.isaksson.erland.gmlindex.model.ProjectIndexNormalizer;
import info.isaksson.erland.gmlindex.model.Relationships;
import info.isaksson.erland.gmlindex.model.ScopeRecord;
import info.isaksson.erland.gmlindex.model.ScriptCall;
import info.isaksson.erland.gmlindex.syntax.GmlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Builds a {@link ProjectIndex} from a project directory.
 *
 * <p>This class is intentionally kept as a small orchestrator that delegates to the helpers in
 * this package:</p>
 * <ol>
 *   <li>{@link BuiltInIdentifierRegistry}: names to ignore</li>
 *   <li>{@link ProjectTreeScanner}: manifests and sources, sorted</li>
 *   <li>{@link ResourceManifestAnalyzer}: resources, scopes, asset references</li>
 *   <li>{@link SourceFileAnalyzer}: one {@link FileAnalysis} per source file, in a {@link BoundedWorkerPool}</li>
 *   <li>single-threaded merge in file order, then {@link IdentifierCollectionBuilder}</li>
 *   <li>{@link ProjectIndexNormalizer}: canonical ordering</li>
 * </ol>
 */
public final class ProjectIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndexBuilder.class);

    private final FsFacade fs;
    private final GmlParser parser;
    private final BuiltInIdentifierRegistry builtIns;

    public ProjectIndexBuilder(FsFacade fs, GmlParser parser, BuiltInIdentifierRegistry builtIns) {
        this.fs = Objects.requireNonNull(fs, "fs");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.builtIns = Objects.requireNonNull(builtIns, "builtIns");
    }

    /** Mutable scope record while files are merged. */
    private static final class ScopeDraft {
        final ScopeDescriptor descriptor;
        final Set<String> filePaths = new LinkedHashSet<>();
        final List<IdentifierOccurrence> declarations = new ArrayList<>();
        final List<IdentifierOccurrence> references = new ArrayList<>();
        final List<IdentifierOccurrence> ignored = new ArrayList<>();
        final List<ScriptCall> calls = new ArrayList<>();

        ScopeDraft(ScopeDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        ScopeRecord toRecord() {
            return new ScopeRecord(descriptor.id, descriptor.kind, descriptor.name, descriptor.displayName,
                    descriptor.resourcePath, descriptor.event, new ArrayList<>(filePaths),
                    declarations, references, ignored, calls);
        }
    }

    public ProjectIndex build(Path projectRoot, BuildOptions options) throws IOException {
        if (projectRoot == null) throw new IllegalArgumentException("projectRoot must not be null");
        BuildOptions opts = options == null ? BuildOptions.defaults() : options;
        Path root = projectRoot.toAbsolutePath().normalize();
        IndexMetrics metrics = new IndexMetrics();
        IndexMetrics.Timer total = metrics.startTimer("total");

        Set<String> builtInNames = metrics.time("loadBuiltIns", () -> builtIns.load(metrics));
        checkCancelled(opts);

        ProjectScan scan = metrics.time("scanProjectTree", () -> new ProjectTreeScanner(fs).scan(root));
        metrics.incrementCounter("io.directoriesScanned", scan.directoriesScanned);
        metrics.incrementCounter("io.skippedMissingEntries", scan.skippedMissingEntries);
        metrics.incrementCounter("files.yyDiscovered", scan.manifestFiles.size());
        metrics.incrementCounter("files.gmlDiscovered", scan.sourceFiles.size());
        metrics.setMetadata("yyFileCount", scan.manifestFiles.size());
        metrics.setMetadata("gmlFileCount", scan.sourceFiles.size());
        checkCancelled(opts);

        ResourceAnalysis resources = metrics.time("analyseResourceFiles",
                () -> new ResourceManifestAnalyzer(fs).analyze(root, scan.manifestFiles));
        metrics.incrementCounter("resources.total", resources.resources.size());
        checkCancelled(opts);

        BoundedWorkerPool pool = new BoundedWorkerPool(opts.concurrency);
        metrics.setMetadata("gmlParseConcurrency", pool.concurrency());
        SourceFileAnalyzer analyzer = new SourceFileAnalyzer(parser, builtInNames, resources, metrics);

        List<ScannedFile> sources = scan.sourceFiles;
        FileAnalysis[] results = new FileAnalysis[sources.size()];
        pool.forEach(sources, (index, file) -> {
            checkCancelled(opts);
            metrics.incrementCounter("files.gmlProcessed");
            String text = metrics.time("fs.readGml", () -> FsUtils.readOrNull(fs, file.absolutePath));
            if (text == null) {
                metrics.incrementCounter("files.missingDuringRead");
                log.debug("Source vanished before it could be read: {}", file.relativePath);
                return;
            }
            metrics.incrementCounter("io.gmlBytes", text.getBytes(StandardCharsets.UTF_8).length);
            FileAnalysis analysis = new FileAnalysis(file.relativePath, resources.descriptorFor(file.relativePath));
            analyzer.analyze(text, analysis);
            results[index] = analysis;
        });
        checkCancelled(opts);

        ProjectIndex index = assemble(root, resources, results, metrics);
        total.close();

        MetricsSummary summary = metrics.summary();
        if (opts.logMetrics) logSummary(root, summary);
        log.debug("Indexed {} in {} ms: {} scopes, {} files, {} call edges",
                root, Math.round(summary.totalTimeMs), index.scopes.size(), index.files.size(),
                index.relationships.scriptCalls.size());
        return index.withMetrics(summary);
    }

    private static ProjectIndex assemble(Path root, ResourceAnalysis resources, FileAnalysis[] results, IndexMetrics metrics) {
        Map<String, ScopeDraft> scopes = new LinkedHashMap<>();
        Map<String, FileRecord> files = new LinkedHashMap<>();
        List<ScriptCall> calls = new ArrayList<>();
        IdentifierCollectionBuilder collections = new IdentifierCollectionBuilder();

        for (FileAnalysis fa : results) {
            if (fa == null) continue;
            ScopeDraft scope = scopes.computeIfAbsent(fa.scope.id, id -> new ScopeDraft(fa.scope));
            scope.filePaths.add(fa.filePath);
            scope.declarations.addAll(fa.declarations());
            scope.references.addAll(fa.references());
            scope.ignored.addAll(fa.ignoredIdentifiers());
            scope.calls.addAll(fa.scriptCalls());

            files.put(fa.filePath, new FileRecord(fa.filePath, fa.scope.id, fa.declarations(), fa.references(),
                    fa.ignoredIdentifiers(), fa.scriptCalls()));
            calls.addAll(fa.scriptCalls());
            collections.addAll(fa.contributions());
        }

        for (ScriptCall call : calls) {
            metrics.incrementCounter("scriptCalls.total");
            metrics.incrementCounter(call.resolved ? "scriptCalls.resolved" : "scriptCalls.unresolved");
            collections.addScriptCall(call);
        }

        Map<String, ScopeRecord> scopeRecords = new LinkedHashMap<>();
        for (ScopeDraft d : scopes.values()) scopeRecords.put(d.descriptor.id, d.toRecord());

        IdentifierCollections identifiers = collections.build();

        ProjectIndex raw = new ProjectIndex(
                root.toString(),
                resources.resources,
                scopeRecords,
                files,
                new Relationships(calls, resources.assetReferences),
                identifiers,
                null
        );
        return ProjectIndexNormalizer.normalize(raw);
    }

    private static void checkCancelled(BuildOptions opts) {
        if (opts.cancelled != null && opts.cancelled.getAsBoolean()) {
            throw new CancellationException("Project index build was cancelled");
        }
    }

    private static void logSummary(Path root, MetricsSummary m) {
        log.info("Project index metrics for {}: total={} ms, timings={}, counters={}, caches={}, metadata={}",
                root, Math.round(m.totalTimeMs), m.timings, m.counters, m.caches, m.metadata);
    }
}
