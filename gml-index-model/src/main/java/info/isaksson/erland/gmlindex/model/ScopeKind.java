package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Kinds of lexical scope tracked by the index. */
public enum ScopeKind {
    @JsonProperty("script") SCRIPT("script"),
    @JsonProperty("objectEvent") OBJECT_EVENT("object"),
    @JsonProperty("file") FILE("file");

    /** Segment used when deriving scope ids ({@code scope:<segment>:...}). */
    public final String idSegment;

    ScopeKind(String idSegment) {
        this.idSegment = idSegment;
    }

    /** {@code scope:<segment>:<parts joined by "::">}. */
    public String scopeId(String... parts) {
        return "scope:" + idSegment + ":" + String.join("::", parts);
    }
}
