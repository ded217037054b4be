package info.isaksson.erland.gmlindex.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.gmlindex.io.FsErrors;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import info.isaksson.erland.gmlindex.model.ProjectIndexJson;
import info.isaksson.erland.gmlindex.model.ProjectIndexNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Persists a built {@link ProjectIndex} together with the fingerprints it was built from.
 *
 * <p>{@link #load(CacheDescriptor)} never throws for a stale or unreadable cache file; such files
 * are reported as a {@link CacheLoadResult} miss. Only unexpected I/O failures propagate.</p>
 *
 * <p>{@link #save(CacheDescriptor, ProjectIndex)} writes a uniquely named temp file next to the
 * cache file and renames it into place, so readers never observe a partially written cache.</p>
 */
public final class ProjectIndexCache {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndexCache.class);

    public static final String CACHE_DIRECTORY = ".tool-cache";
    public static final String CACHE_FILENAME = "project-index-cache.json";
    public static final long DEFAULT_MAX_SIZE_BYTES = 8L * 1024 * 1024;

    private static final double MTIME_EPSILON = Math.ulp(1.0);

    private final FsFacade fs;
    private final ObjectMapper mapper = ProjectIndexJson.newMapper();

    public ProjectIndexCache() {
        this(NioFsFacade.INSTANCE);
    }

    public ProjectIndexCache(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public static Path defaultCacheFile(Path projectRoot) {
        return requireAbsoluteRoot(projectRoot).resolve(CACHE_DIRECTORY).resolve(CACHE_FILENAME);
    }

    /** The file a descriptor refers to: its explicit path, or the default under the project root. */
    public static Path resolveCacheFile(CacheDescriptor descriptor) {
        if (descriptor == null) throw new IllegalArgumentException("descriptor must not be null");
        if (descriptor.cacheFilePath != null) return descriptor.cacheFilePath.toAbsolutePath().normalize();
        return defaultCacheFile(descriptor.projectRoot);
    }

    public CacheLoadResult load(CacheDescriptor descriptor) throws IOException {
        if (descriptor == null) throw new IllegalArgumentException("descriptor must not be null");
        Path root = requireAbsoluteRoot(descriptor.projectRoot);
        Path cacheFile = resolveCacheFile(descriptor);

        String raw;
        try {
            raw = fs.readFile(cacheFile);
        } catch (IOException e) {
            if (FsErrors.isNotFound(e)) return miss(cacheFile, CacheMissReason.NOT_FOUND, null);
            throw e;
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return miss(cacheFile, CacheMissReason.INVALID_JSON, e);
        }
        if (tree == null || !hasValidShape(tree)) {
            return miss(cacheFile, CacheMissReason.INVALID_SCHEMA, null);
        }
        if (tree.get("schemaVersion").intValue() != CachePayload.SCHEMA_VERSION) {
            return miss(cacheFile, CacheMissReason.SCHEMA_VERSION_MISMATCH, null);
        }

        CachePayload payload;
        try {
            payload = mapper.treeToValue(tree, CachePayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return miss(cacheFile, CacheMissReason.INVALID_SCHEMA, e);
        }

        if (!sameRoot(payload.projectRoot, root)) {
            return miss(cacheFile, CacheMissReason.PROJECT_ROOT_MISMATCH, null);
        }
        if (descriptor.formatterVersion != null && !descriptor.formatterVersion.equals(payload.formatterVersion)) {
            return miss(cacheFile, CacheMissReason.FORMATTER_VERSION_MISMATCH, null);
        }
        if (descriptor.pluginVersion != null && !descriptor.pluginVersion.equals(payload.pluginVersion)) {
            return miss(cacheFile, CacheMissReason.PLUGIN_VERSION_MISMATCH, null);
        }
        if (descriptor.manifestMtimes != null && !mtimeMapsEqual(descriptor.manifestMtimes, payload.manifestMtimes)) {
            return miss(cacheFile, CacheMissReason.MANIFEST_MTIME_MISMATCH, null);
        }
        if (descriptor.sourceMtimes != null && !mtimeMapsEqual(descriptor.sourceMtimes, payload.sourceMtimes)) {
            return miss(cacheFile, CacheMissReason.SOURCE_MTIME_MISMATCH, null);
        }

        log.debug("Project index cache hit: {}", cacheFile);
        return CacheLoadResult.hit(cacheFile, payload);
    }

    /**
     * Writes {@code index} to the descriptor's cache file.
     *
     * @return {@code written}, or {@code skipped} when the payload exceeds the descriptor's size cap
     * @throws IOException when the write or rename fails; the temp file is removed first
     */
    public CacheSaveResult save(CacheDescriptor descriptor, ProjectIndex index) throws IOException {
        if (descriptor == null) throw new IllegalArgumentException("descriptor must not be null");
        if (index == null) throw new IllegalArgumentException("index must not be null");
        Path root = requireAbsoluteRoot(descriptor.projectRoot);
        Path cacheFile = resolveCacheFile(descriptor);

        CachePayload payload = new CachePayload(
                CachePayload.SCHEMA_VERSION,
                root.toString(),
                descriptor.formatterVersion,
                descriptor.pluginVersion,
                finiteOnly(descriptor.manifestMtimes),
                finiteOnly(descriptor.sourceMtimes),
                index.metrics,
                ProjectIndexNormalizer.normalize(index.withoutMetrics())
        );

        String serialized = mapper.writeValueAsString(payload);
        long size = serialized.getBytes(StandardCharsets.UTF_8).length;

        Long cap = descriptor.maxSizeBytes;
        if (cap != null && cap > 0 && size > cap) {
            log.debug("Skipping project index cache write: {} bytes exceeds limit of {}", size, cap);
            return CacheSaveResult.skipped(cacheFile, CacheSaveResult.PAYLOAD_TOO_LARGE, size);
        }

        Path dir = cacheFile.getParent();
        if (dir != null) fs.mkdirs(dir);

        Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            fs.writeFile(temp, serialized);
            fs.rename(temp, cacheFile);
        } catch (IOException | RuntimeException e) {
            try {
                fs.unlink(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.debug("Wrote project index cache {} ({} bytes)", cacheFile, size);
        return CacheSaveResult.written(cacheFile, size);
    }

    /**
     * Unordered comparison of two mtime maps. Values are compared with a tolerance relative to
     * their magnitude; a key that is added, removed or changed makes the maps unequal.
     */
    public static boolean mtimeMapsEqual(Map<String, Double> expected, Map<String, Double> actual) {
        if (expected == actual) return true;
        if (expected == null || actual == null) return false;
        if (expected.size() != actual.size()) return false;
        for (Map.Entry<String, Double> e : expected.entrySet()) {
            if (!actual.containsKey(e.getKey())) return false;
            if (!approximatelyEqual(e.getValue(), actual.get(e.getKey()))) return false;
        }
        return true;
    }

    static boolean approximatelyEqual(Double a, Double b) {
        if (Objects.equals(a, b)) return true;
        if (a == null || b == null) return false;
        if (!Double.isFinite(a) || !Double.isFinite(b)) return false;
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= MTIME_EPSILON * scale * 4;
    }

    private static boolean hasValidShape(JsonNode tree) {
        if (!tree.isObject()) return false;
        JsonNode version = tree.get("schemaVersion");
        if (version == null || !version.isIntegralNumber()) return false;
        JsonNode root = tree.get("projectRoot");
        if (root == null || !root.isTextual() || root.asText().isEmpty()) return false;
        if (!isText(tree.get("formatterVersion")) || !isText(tree.get("pluginVersion"))) return false;
        if (!isObject(tree.get("manifestMtimes")) || !isObject(tree.get("sourceMtimes"))) return false;
        JsonNode metrics = tree.get("metricsSummary");
        if (metrics != null && !metrics.isNull() && !metrics.isObject()) return false;
        return isObject(tree.get("projectIndex"));
    }

    private static boolean isText(JsonNode n) {
        return n != null && n.isTextual();
    }

    private static boolean isObject(JsonNode n) {
        return n != null && n.isObject();
    }

    private static boolean sameRoot(String cachedRoot, Path root) {
        try {
            return Paths.get(cachedRoot).toAbsolutePath().normalize().equals(root);
        } catch (InvalidPathException e) {
            log.debug("Cached project root is not a valid path: {}", cachedRoot);
            return false;
        }
    }

    private static Map<String, Double> finiteOnly(Map<String, Double> in) {
        Map<String, Double> out = new TreeMap<>();
        if (in == null) return out;
        for (Map.Entry<String, Double> e : in.entrySet()) {
            Double v = e.getValue();
            if (v != null && Double.isFinite(v)) out.put(e.getKey(), v);
        }
        return out;
    }

    private static Path requireAbsoluteRoot(Path projectRoot) {
        if (projectRoot == null) throw new IllegalArgumentException("projectRoot must not be null");
        if (!projectRoot.isAbsolute()) {
            throw new IllegalArgumentException("projectRoot must be absolute: " + projectRoot);
        }
        return projectRoot.normalize();
    }

    private static CacheLoadResult miss(Path cacheFile, CacheMissReason reason, Exception error) {
        log.debug("Project index cache miss ({}): {}", reason, cacheFile);
        return CacheLoadResult.miss(cacheFile, reason, error);
    }
}
