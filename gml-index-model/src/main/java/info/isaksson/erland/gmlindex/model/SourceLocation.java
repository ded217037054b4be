package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A position in a source file: 1-based line, 0-based column and 0-based character index.
 */
@JsonPropertyOrder({"line","column","index"})
public final class SourceLocation {
    public final int line;
    public final int column;
    public final int index;

    @JsonCreator
    public SourceLocation(
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("index") int index
    ) {
        this.line = line;
        this.column = column;
        this.index = index;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && index == that.index;
    }

    @Override public int hashCode() {
        return Objects.hash(line, column, index);
    }

    @Override public String toString() {
        return line + ":" + column + "@" + index;
    }
}
