package info.isaksson.erland.gmlindex.model;

import java.util.List;

/** Common read view over the six identifier-entry types. */
public interface IdentifierEntry {

    IdentifierCategory category();

    /** Stable id, {@code <category>:<key>}. */
    String identifierId();

    String name();

    List<IdentifierOccurrence> declarations();
}
