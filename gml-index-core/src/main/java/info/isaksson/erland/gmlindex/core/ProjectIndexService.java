package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.cache.CacheKeyDeriver;
import info.isaksson.erland.gmlindex.extract.BuiltInIdentifierRegistry;
import info.isaksson.erland.gmlindex.extract.ProjectIndexBuilder;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import info.isaksson.erland.gmlindex.io.ProjectRootLocator;
import info.isaksson.erland.gmlindex.syntax.LightweightGmlParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Core (server-friendly) API for indexing GameMaker projects.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.
 * Long-running hosts keep one {@link #newCoordinator(BuiltInIdentifierRegistry, ProjectIndexOptions)}
 * so repeated requests share in-flight work.</p>
 */
public final class ProjectIndexService {

    private final FsFacade fs;

    public ProjectIndexService() {
        this(NioFsFacade.INSTANCE);
    }

    public ProjectIndexService(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    /** Index a project root, using the cache unless {@code options.useCache} is false. */
    public EnsureReadyResult index(Path projectRoot, ProjectIndexOptions options) throws IOException {
        if (projectRoot == null) throw new IllegalArgumentException("projectRoot must not be null");
        if (options == null) options = new ProjectIndexOptions();

        BuiltInIdentifierRegistry builtIns = newBuiltInRegistry(options);
        ProjectIndexCoordinator coordinator = newCoordinator(builtIns, options);
        try {
            return coordinator.ensureReadyAndWait(EnsureReadyRequest.from(projectRoot, options));
        } finally {
            coordinator.dispose();
            builtIns.dispose();
        }
    }

    /** Index the project that owns {@code file}. */
    public EnsureReadyResult indexFile(Path file, ProjectIndexOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        Path root = findProjectRoot(file).orElseThrow(() ->
                new IllegalArgumentException("No GameMaker project (.yyp) found above " + file));
        return index(root, options);
    }

    public Optional<Path> findProjectRoot(Path file) throws IOException {
        return new ProjectRootLocator(fs).findProjectRoot(file);
    }

    /** Key for artefacts derived from one file of a project; see {@link CacheKeyDeriver}. */
    public String deriveCacheKey(Path file, Path projectRoot, ProjectIndexOptions options) throws IOException {
        String formatterVersion = options == null ? null : options.formatterVersion;
        return new CacheKeyDeriver(fs).deriveCacheKey(file, projectRoot, formatterVersion);
    }

    public BuiltInIdentifierRegistry newBuiltInRegistry(ProjectIndexOptions options) {
        Path dataFile = options == null ? null : options.builtInIdentifiersPath;
        return new BuiltInIdentifierRegistry(fs, dataFile == null ? null : dataFile.toAbsolutePath().normalize());
    }

    /** Coordinator over the default parser; the caller owns both it and {@code builtIns}. */
    public ProjectIndexCoordinator newCoordinator(BuiltInIdentifierRegistry builtIns, ProjectIndexOptions options) {
        if (builtIns == null) throw new IllegalArgumentException("builtIns must not be null");
        if (options == null) options = new ProjectIndexOptions();
        ProjectIndexBuilder builder = new ProjectIndexBuilder(fs, new LightweightGmlParser(), builtIns);
        return new ProjectIndexCoordinator(fs, builder::build, options.cacheMaxSizeBytes);
    }
}
