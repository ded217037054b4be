package info.isaksson.erland.gmlindex.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.gmlindex.model.MetricsSummary;
import info.isaksson.erland.gmlindex.model.ProjectIndex;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * On-disk cache document. The index is stored without its metrics; the summary of the build
 * that produced it lives in {@link #metricsSummary}.
 */
@JsonPropertyOrder({"schemaVersion","projectRoot","formatterVersion","pluginVersion",
        "manifestMtimes","sourceMtimes","metricsSummary","projectIndex"})
public final class CachePayload {
    public static final int SCHEMA_VERSION = 1;

    public final int schemaVersion;
    public final String projectRoot;
    public final String formatterVersion;
    public final String pluginVersion;
    public final SortedMap<String, Double> manifestMtimes;
    public final SortedMap<String, Double> sourceMtimes;
    public final MetricsSummary metricsSummary;
    public final ProjectIndex projectIndex;

    @JsonCreator
    public CachePayload(
            @JsonProperty("schemaVersion") int schemaVersion,
            @JsonProperty("projectRoot") String projectRoot,
            @JsonProperty("formatterVersion") String formatterVersion,
            @JsonProperty("pluginVersion") String pluginVersion,
            @JsonProperty("manifestMtimes") Map<String, Double> manifestMtimes,
            @JsonProperty("sourceMtimes") Map<String, Double> sourceMtimes,
            @JsonProperty("metricsSummary") MetricsSummary metricsSummary,
            @JsonProperty("projectIndex") ProjectIndex projectIndex
    ) {
        this.schemaVersion = schemaVersion;
        this.projectRoot = projectRoot;
        this.formatterVersion = formatterVersion == null ? "" : formatterVersion;
        this.pluginVersion = pluginVersion == null ? "" : pluginVersion;
        this.manifestMtimes = sorted(manifestMtimes);
        this.sourceMtimes = sorted(sourceMtimes);
        this.metricsSummary = metricsSummary;
        this.projectIndex = projectIndex;
    }

    private static SortedMap<String, Double> sorted(Map<String, Double> in) {
        return Collections.unmodifiableSortedMap(in == null ? new TreeMap<>() : new TreeMap<>(in));
    }

    /** The cached index with the stored metrics re-attached. */
    public ProjectIndex indexWithMetrics() {
        if (projectIndex == null || metricsSummary == null) return projectIndex;
        return projectIndex.withMetrics(metricsSummary);
    }
}
