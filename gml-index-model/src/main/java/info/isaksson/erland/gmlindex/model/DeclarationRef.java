package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Back-reference from a reference occurrence to the site that declared it. */
@JsonPropertyOrder({"start","end","scopeId"})
public final class DeclarationRef {
    public final SourceLocation start;
    public final SourceLocation end;
    public final String scopeId;

    @JsonCreator
    public DeclarationRef(
            @JsonProperty("start") SourceLocation start,
            @JsonProperty("end") SourceLocation end,
            @JsonProperty("scopeId") String scopeId
    ) {
        this.start = start;
        this.end = end;
        this.scopeId = scopeId;
    }

    public DeclarationRef withScopeId(String newScopeId) {
        return new DeclarationRef(start, end, newScopeId);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeclarationRef)) return false;
        DeclarationRef that = (DeclarationRef) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end) && Objects.equals(scopeId, that.scopeId);
    }

    @Override public int hashCode() {
        return Objects.hash(start, end, scopeId);
    }
}
