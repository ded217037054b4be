package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.LocationKey;
import info.isaksson.erland.gmlindex.model.ScriptCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-file output buffer of {@link SourceFileAnalyzer}. Each buffer is written by exactly one
 * worker and read only after the worker pool has drained.
 */
public final class FileAnalysis {
    public final String filePath;
    public final ScopeDescriptor scope;

    private final List<IdentifierOccurrence> declarations = new ArrayList<>();
    private final Set<LocationKey> declarationKeys = new HashSet<>();
    private final List<IdentifierOccurrence> references = new ArrayList<>();
    private final List<IdentifierOccurrence> ignoredIdentifiers = new ArrayList<>();
    private final List<ScriptCall> scriptCalls = new ArrayList<>();
    private final List<IdentifierContribution> contributions = new ArrayList<>();

    public FileAnalysis(String filePath, ScopeDescriptor scope) {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /** Appends unless a declaration at the same location is already recorded. */
    void addDeclaration(IdentifierOccurrence occurrence) {
        LocationKey key = occurrence.locationKey();
        if (key != null && !declarationKeys.add(key)) return;
        declarations.add(occurrence);
    }

    /** Drops synthetic declarations of {@code name}; a real declaration is about to replace them. */
    void removeSyntheticDeclarations(String name) {
        declarations.removeIf(d -> d.synthetic && (name == null || d.name == null || d.name.equals(name)));
    }

    void addReference(IdentifierOccurrence occurrence) {
        references.add(occurrence);
    }

    void addIgnored(IdentifierOccurrence occurrence) {
        ignoredIdentifiers.add(occurrence);
    }

    void addScriptCall(ScriptCall call) {
        scriptCalls.add(call);
    }

    void contribute(IdentifierContribution contribution) {
        contributions.add(contribution);
    }

    public List<IdentifierOccurrence> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public List<IdentifierOccurrence> references() {
        return Collections.unmodifiableList(references);
    }

    public List<IdentifierOccurrence> ignoredIdentifiers() {
        return Collections.unmodifiableList(ignoredIdentifiers);
    }

    public List<ScriptCall> scriptCalls() {
        return Collections.unmodifiableList(scriptCalls);
    }

    public List<IdentifierContribution> contributions() {
        return Collections.unmodifiableList(contributions);
    }
}
