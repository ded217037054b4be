package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Per-file view of the occurrences that also roll up into the owning {@link ScopeRecord}. */
@JsonPropertyOrder({"filePath","scopeId","declarations","references","ignoredIdentifiers","scriptCalls"})
public final class FileRecord {
    public final String filePath;
    public final String scopeId;
    public final List<IdentifierOccurrence> declarations;
    public final List<IdentifierOccurrence> references;
    public final List<IdentifierOccurrence> ignoredIdentifiers;
    public final List<ScriptCall> scriptCalls;

    @JsonCreator
    public FileRecord(
            @JsonProperty("filePath") String filePath,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<IdentifierOccurrence> references,
            @JsonProperty("ignoredIdentifiers") List<IdentifierOccurrence> ignoredIdentifiers,
            @JsonProperty("scriptCalls") List<ScriptCall> scriptCalls
    ) {
        this.filePath = filePath;
        this.scopeId = scopeId;
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
        this.ignoredIdentifiers = ignoredIdentifiers == null ? List.of() : List.copyOf(ignoredIdentifiers);
        this.scriptCalls = scriptCalls == null ? List.of() : List.copyOf(scriptCalls);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileRecord)) return false;
        FileRecord that = (FileRecord) o;
        return Objects.equals(filePath, that.filePath)
                && Objects.equals(scopeId, that.scopeId)
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references)
                && Objects.equals(ignoredIdentifiers, that.ignoredIdentifiers)
                && Objects.equals(scriptCalls, that.scriptCalls);
    }

    @Override public int hashCode() {
        return Objects.hash(filePath, scopeId, declarations, references, ignoredIdentifiers, scriptCalls);
    }

    @Override public String toString() {
        return "FileRecord{" + filePath + " -> " + scopeId + "}";
    }
}
