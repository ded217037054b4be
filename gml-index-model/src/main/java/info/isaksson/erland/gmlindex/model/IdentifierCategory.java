package info.isaksson.erland.gmlindex.model;

/**
 * The six identifier collections. The prefix is the first half of every identifier id
 * ({@code <prefix>:<value>}).
 */
public enum IdentifierCategory {
    SCRIPT("script"),
    MACRO("macro"),
    ENUM("enum"),
    ENUM_MEMBER("enum-member"),
    GLOBAL("global"),
    INSTANCE("instance");

    public final String prefix;

    IdentifierCategory(String prefix) {
        this.prefix = prefix;
    }

    /** Builds {@code <prefix>:<value>}; null when {@code value} is null or empty. */
    public String identifierId(String value) {
        if (value == null || value.isEmpty()) return null;
        return prefix + ":" + value;
    }

    /** Category whose prefix starts {@code identifierId}, or null. */
    public static IdentifierCategory fromIdentifierId(String identifierId) {
        if (identifierId == null) return null;
        int colon = identifierId.indexOf(':');
        if (colon <= 0) return null;
        String prefix = identifierId.substring(0, colon);
        for (IdentifierCategory c : values()) {
            if (c.prefix.equals(prefix)) return c;
        }
        return null;
    }
}
