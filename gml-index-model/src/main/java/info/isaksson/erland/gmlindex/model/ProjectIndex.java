package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Root of the project index.
 *
 * <p>Instances are immutable; every map is sorted by key. {@link #metrics} describes how the
 * index was produced and is not part of {@link #equals(Object)}: two builds of the same
 * project compare equal even though their timings differ.</p>
 */
@JsonPropertyOrder({"projectRoot","resources","scopes","files","relationships","identifiers","metrics"})
public final class ProjectIndex {
    public final String projectRoot;
    public final SortedMap<String, ResourceRecord> resources;
    public final SortedMap<String, ScopeRecord> scopes;
    public final SortedMap<String, FileRecord> files;
    public final Relationships relationships;
    public final IdentifierCollections identifiers;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final MetricsSummary metrics;

    @JsonCreator
    public ProjectIndex(
            @JsonProperty("projectRoot") String projectRoot,
            @JsonProperty("resources") Map<String, ResourceRecord> resources,
            @JsonProperty("scopes") Map<String, ScopeRecord> scopes,
            @JsonProperty("files") Map<String, FileRecord> files,
            @JsonProperty("relationships") Relationships relationships,
            @JsonProperty("identifiers") IdentifierCollections identifiers,
            @JsonProperty("metrics") MetricsSummary metrics
    ) {
        this.projectRoot = projectRoot;
        this.resources = sorted(resources);
        this.scopes = sorted(scopes);
        this.files = sorted(files);
        this.relationships = relationships == null ? Relationships.empty() : relationships;
        this.identifiers = identifiers == null ? IdentifierCollections.empty() : identifiers;
        this.metrics = metrics;
    }

    private static <V> SortedMap<String, V> sorted(Map<String, V> in) {
        return Collections.unmodifiableSortedMap(in == null ? new TreeMap<>() : new TreeMap<>(in));
    }

    public Optional<ScopeRecord> scope(String scopeId) {
        return Optional.ofNullable(scopeId == null ? null : scopes.get(scopeId));
    }

    public Optional<FileRecord> file(String relativePath) {
        return Optional.ofNullable(relativePath == null ? null : files.get(relativePath));
    }

    public Optional<ResourceRecord> resource(String resourcePath) {
        return Optional.ofNullable(resourcePath == null ? null : resources.get(resourcePath));
    }

    public Optional<IdentifierEntry> identifier(String identifierId) {
        return identifiers.findByIdentifierId(identifierId);
    }

    public List<IdentifierEntry> identifiersNamed(String name) {
        return identifiers.findByName(name);
    }

    public ProjectIndex withMetrics(MetricsSummary newMetrics) {
        return new ProjectIndex(projectRoot, resources, scopes, files, relationships, identifiers, newMetrics);
    }

    public ProjectIndex withoutMetrics() {
        return metrics == null ? this : withMetrics(null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectIndex)) return false;
        ProjectIndex that = (ProjectIndex) o;
        return Objects.equals(projectRoot, that.projectRoot)
                && resources.equals(that.resources)
                && scopes.equals(that.scopes)
                && files.equals(that.files)
                && relationships.equals(that.relationships)
                && identifiers.equals(that.identifiers);
    }

    @Override public int hashCode() {
        return Objects.hash(projectRoot, resources, scopes, files, relationships, identifiers);
    }

    @Override public String toString() {
        return "ProjectIndex{" + projectRoot + ", resources=" + resources.size() + ", scopes=" + scopes.size()
                + ", files=" + files.size() + "}";
    }
}
