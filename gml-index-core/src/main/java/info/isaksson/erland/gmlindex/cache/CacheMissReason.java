package info.isaksson.erland.gmlindex.cache;

/**
 * Why a cache load did not produce a usable index.
 *
 * <p>Declared in the order the checks run: the first failing check decides the reason.</p>
 */
public enum CacheMissReason {
    NOT_FOUND("not-found"),
    INVALID_JSON("invalid-json"),
    INVALID_SCHEMA("invalid-schema"),
    SCHEMA_VERSION_MISMATCH("schema-version-mismatch"),
    PROJECT_ROOT_MISMATCH("project-root-mismatch"),
    FORMATTER_VERSION_MISMATCH("formatter-version-mismatch"),
    PLUGIN_VERSION_MISMATCH("plugin-version-mismatch"),
    MANIFEST_MTIME_MISMATCH("manifest-mtime-mismatch"),
    SOURCE_MTIME_MISMATCH("source-mtime-mismatch");

    private final String wireName;

    CacheMissReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
