package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Start/end pair; {@code end} is exclusive. Either side may be null for synthetic entries. */
@JsonPropertyOrder({"start","end"})
public final class SourceSpan {
    public final SourceLocation start;
    public final SourceLocation end;

    @JsonCreator
    public SourceSpan(
            @JsonProperty("start") SourceLocation start,
            @JsonProperty("end") SourceLocation end
    ) {
        this.start = start;
        this.end = end;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
