package info.isaksson.erland.gmlindex.cache;

import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.FsUtils;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import info.isaksson.erland.gmlindex.io.ProjectFileTypes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Derives a stable key for artefacts computed from a single file of a project.
 *
 * <p>The key is the SHA-256 (hex) of the formatter version, the project root, every root-level
 * {@code .yyp} manifest with its mtime, and the file's path relative to the root with its mtime.
 * Touching the project manifest or the file changes the key.</p>
 */
public final class CacheKeyDeriver {

    public static final String DEFAULT_FORMATTER_VERSION = "dev";

    private final FsFacade fs;

    public CacheKeyDeriver() {
        this(NioFsFacade.INSTANCE);
    }

    public CacheKeyDeriver(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public String deriveCacheKey(Path file, Path projectRoot, String formatterVersion) throws IOException {
        MessageDigest digest = sha256();
        update(digest, formatterVersion == null ? DEFAULT_FORMATTER_VERSION : formatterVersion);

        Path root = projectRoot == null ? null : projectRoot.toAbsolutePath().normalize();
        update(digest, root == null ? "" : root.toString());

        if (root != null) {
            List<String> manifests = new ArrayList<>();
            for (String name : FsUtils.listDirectory(fs, root)) {
                if (ProjectFileTypes.isProjectManifest(name)) manifests.add(name);
            }
            manifests.sort(null);
            for (String name : manifests) {
                Double mtime = FsUtils.mtimeOrNull(fs, root.resolve(name));
                if (mtime == null) continue;
                update(digest, name);
                update(digest, formatMtime(mtime));
            }
        }

        if (file != null) {
            Path resolved = file.toAbsolutePath().normalize();
            Double mtime = FsUtils.mtimeOrNull(fs, resolved);
            if (mtime != null) {
                Path base = root != null ? root : resolved.getRoot();
                update(digest, FsUtils.relativePosix(base, resolved));
                update(digest, formatMtime(mtime));
            }
        }

        return HexFormat.of().formatHex(digest.digest());
    }

    // Whole milliseconds print without a fraction so keys match across platforms.
    private static String formatMtime(double mtime) {
        if (mtime == Math.rint(mtime) && Math.abs(mtime) < 1e15) return Long.toString((long) mtime);
        return Double.toString(mtime);
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
