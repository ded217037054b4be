package info.isaksson.erland.gmlindex.model;

import java.util.Objects;

/**
 * Identity of a declaration site: project-relative file path plus character offset.
 *
 * <p>Enum and enum-member names are not unique across a project, so their collection entries
 * are keyed by where they are declared. The string form ({@code path@offset}) is what appears
 * in identifier ids and JSON map keys.</p>
 */
public final class LocationKey implements Comparable<LocationKey> {
    public final String filePath;
    public final int offset;

    public LocationKey(String filePath, int offset) {
        if (filePath == null || filePath.isBlank()) throw new IllegalArgumentException("filePath must not be blank");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
        this.filePath = filePath;
        this.offset = offset;
    }

    /** Key for {@code location} in {@code filePath}, or null when either is missing. */
    public static LocationKey of(String filePath, SourceLocation location) {
        if (filePath == null || filePath.isBlank() || location == null || location.index < 0) return null;
        return new LocationKey(filePath, location.index);
    }

    public String asString() {
        return filePath + "@" + offset;
    }

    @Override public int compareTo(LocationKey o) {
        int c = filePath.compareTo(o.filePath);
        return c != 0 ? c : Integer.compare(offset, o.offset);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocationKey)) return false;
        LocationKey that = (LocationKey) o;
        return offset == that.offset && filePath.equals(that.filePath);
    }

    @Override public int hashCode() {
        return Objects.hash(filePath, offset);
    }

    @Override public String toString() {
        return asString();
    }
}
