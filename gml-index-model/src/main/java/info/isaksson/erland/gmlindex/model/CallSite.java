package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Where a script call was made from. */
@JsonPropertyOrder({"filePath","scopeId"})
public final class CallSite {
    public final String filePath;
    public final String scopeId;

    @JsonCreator
    public CallSite(
            @JsonProperty("filePath") String filePath,
            @JsonProperty("scopeId") String scopeId
    ) {
        this.filePath = filePath;
        this.scopeId = scopeId;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSite)) return false;
        CallSite that = (CallSite) o;
        return Objects.equals(filePath, that.filePath) && Objects.equals(scopeId, that.scopeId);
    }

    @Override public int hashCode() {
        return Objects.hash(filePath, scopeId);
    }
}
