package info.isaksson.erland.gmlindex.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.FsUtils;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Names the engine defines (functions, built-in variables, constants). Occurrences of these are
 * recorded as ignored and never classified.
 *
 * <p>Backed by a data file of the form {@code {"identifiers": {"name": {...}, ...}}} or, when no
 * file is configured, by the bundled {@value #BUNDLED_RESOURCE} classpath resource. Each
 * {@link #load} re-checks the file's modification time and reloads only when it changed.</p>
 */
public final class BuiltInIdentifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(BuiltInIdentifierRegistry.class);

    public static final String CACHE_NAME = "builtInIdentifiers";
    public static final String BUNDLED_RESOURCE = "gml-identifiers.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FsFacade fs;
    private final Path dataFile;

    private Set<String> names;
    private Double loadedMtime;
    private boolean disposed;

    /** Registry over the bundled identifier list. */
    public BuiltInIdentifierRegistry() {
        this(NioFsFacade.INSTANCE, null);
    }

    /**
     * @param dataFile identifier data file, or null for the bundled resource
     */
    public BuiltInIdentifierRegistry(FsFacade fs, Path dataFile) {
        this.fs = Objects.requireNonNull(fs, "fs");
        this.dataFile = dataFile;
    }

    public Path dataFile() {
        return dataFile;
    }

    /**
     * Current set of built-in names. Never null; an unreadable or malformed source yields an
     * empty set.
     *
     * @param metrics receives a hit, stale or miss under {@value #CACHE_NAME}; may be null
     * @throws IllegalStateException after {@link #dispose()}
     */
    public synchronized Set<String> load(IndexMetrics metrics) {
        if (disposed) throw new IllegalStateException("BuiltInIdentifierRegistry has been disposed");

        Double currentMtime = currentMtime();
        if (names != null) {
            if (Objects.equals(loadedMtime, currentMtime)) {
                if (metrics != null) metrics.recordCacheHit(CACHE_NAME);
                return names;
            }
            if (metrics != null) metrics.recordCacheStale(CACHE_NAME);
        } else if (metrics != null) {
            metrics.recordCacheMiss(CACHE_NAME);
        }

        names = readNames();
        loadedMtime = currentMtime;
        return names;
    }

    /** Drops the cached set. Further {@link #load} calls fail. */
    public synchronized void dispose() {
        disposed = true;
        names = null;
        loadedMtime = null;
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    private Double currentMtime() {
        if (dataFile == null) return null;
        try {
            return FsUtils.mtimeOrNull(fs, dataFile);
        } catch (IOException e) {
            log.warn("Cannot stat built-in identifier file {}: {}", dataFile, e.toString());
            return null;
        }
    }

    private Set<String> readNames() {
        String source = dataFile == null ? "classpath:" + BUNDLED_RESOURCE : dataFile.toString();
        try {
            String json = dataFile == null ? readBundled() : fs.readFile(dataFile);
            Set<String> parsed = parseNames(json);
            log.debug("Loaded {} built-in identifiers from {}", parsed.size(), source);
            return parsed;
        } catch (IOException | RuntimeException e) {
            log.warn("Built-in identifier data unavailable ({}); continuing with an empty set: {}", source, e.toString());
            return Collections.emptySet();
        }
    }

    private static String readBundled() throws IOException {
        try (InputStream in = BuiltInIdentifierRegistry.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) throw new IOException("Missing classpath resource " + BUNDLED_RESOURCE);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static Set<String> parseNames(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        JsonNode identifiers = root == null ? null : root.get("identifiers");
        if (identifiers == null || !identifiers.isObject()) return Collections.emptySet();
        Set<String> out = new TreeSet<>();
        Iterator<String> it = identifiers.fieldNames();
        while (it.hasNext()) out.add(it.next());
        return Collections.unmodifiableSet(out);
    }
}
