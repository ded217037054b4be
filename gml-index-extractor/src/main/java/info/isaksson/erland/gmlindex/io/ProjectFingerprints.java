package info.isaksson.erland.gmlindex.io;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Modification times (ms) of every manifest and source file, keyed by relative path. */
public final class ProjectFingerprints {
    public final Map<String, Double> manifestMtimes;
    public final Map<String, Double> sourceMtimes;

    public ProjectFingerprints(Map<String, Double> manifestMtimes, Map<String, Double> sourceMtimes) {
        this.manifestMtimes = Collections.unmodifiableMap(new TreeMap<>(manifestMtimes));
        this.sourceMtimes = Collections.unmodifiableMap(new TreeMap<>(sourceMtimes));
    }
}
