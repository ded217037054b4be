package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The six typed identifier collections. Each map is sorted by key and unmodifiable.
 *
 * <p>Keys: scripts by scope id, macros and globals by name, enums and enum members by
 * declaration location key, instance variables by {@code <scopeId>:<name>}.</p>
 */
@JsonPropertyOrder({"scripts","macros","enums","enumMembers","globalVariables","instanceVariables"})
public final class IdentifierCollections {
    public final SortedMap<String, ScriptEntry> scripts;
    public final SortedMap<String, MacroEntry> macros;
    public final SortedMap<String, EnumEntry> enums;
    public final SortedMap<String, EnumMemberEntry> enumMembers;
    public final SortedMap<String, GlobalVariableEntry> globalVariables;
    public final SortedMap<String, InstanceVariableEntry> instanceVariables;

    @JsonCreator
    public IdentifierCollections(
            @JsonProperty("scripts") Map<String, ScriptEntry> scripts,
            @JsonProperty("macros") Map<String, MacroEntry> macros,
            @JsonProperty("enums") Map<String, EnumEntry> enums,
            @JsonProperty("enumMembers") Map<String, EnumMemberEntry> enumMembers,
            @JsonProperty("globalVariables") Map<String, GlobalVariableEntry> globalVariables,
            @JsonProperty("instanceVariables") Map<String, InstanceVariableEntry> instanceVariables
    ) {
        this.scripts = sorted(scripts);
        this.macros = sorted(macros);
        this.enums = sorted(enums);
        this.enumMembers = sorted(enumMembers);
        this.globalVariables = sorted(globalVariables);
        this.instanceVariables = sorted(instanceVariables);
    }

    public static IdentifierCollections empty() {
        return new IdentifierCollections(null, null, null, null, null, null);
    }

    private static <V> SortedMap<String, V> sorted(Map<String, V> in) {
        if (in == null || in.isEmpty()) return Collections.unmodifiableSortedMap(new TreeMap<>());
        return Collections.unmodifiableSortedMap(new TreeMap<>(in));
    }

    /** The collection for {@code category}, viewed through the common entry interface. */
    public Map<String, ? extends IdentifierEntry> collection(IdentifierCategory category) {
        switch (category) {
            case SCRIPT: return scripts;
            case MACRO: return macros;
            case ENUM: return enums;
            case ENUM_MEMBER: return enumMembers;
            case GLOBAL: return globalVariables;
            case INSTANCE: return instanceVariables;
            default: throw new IllegalArgumentException("Unknown category: " + category);
        }
    }

    public Optional<IdentifierEntry> findByIdentifierId(String identifierId) {
        IdentifierCategory category = IdentifierCategory.fromIdentifierId(identifierId);
        if (category == null) return Optional.empty();
        String key = identifierId.substring(category.prefix.length() + 1);
        IdentifierEntry direct = collection(category).get(key);
        if (direct != null && identifierId.equals(direct.identifierId())) return Optional.of(direct);
        for (IdentifierEntry e : collection(category).values()) {
            if (identifierId.equals(e.identifierId())) return Optional.of(e);
        }
        return Optional.empty();
    }

    /** Every entry named {@code name}, across all collections, in category order. */
    public List<IdentifierEntry> findByName(String name) {
        List<IdentifierEntry> out = new ArrayList<>();
        if (name == null) return out;
        for (IdentifierCategory category : IdentifierCategory.values()) {
            for (IdentifierEntry e : collection(category).values()) {
                if (name.equals(e.name())) out.add(e);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public int size(IdentifierCategory category) {
        return collection(category).size();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierCollections)) return false;
        IdentifierCollections that = (IdentifierCollections) o;
        return scripts.equals(that.scripts)
                && macros.equals(that.macros)
                && enums.equals(that.enums)
                && enumMembers.equals(that.enumMembers)
                && globalVariables.equals(that.globalVariables)
                && instanceVariables.equals(that.instanceVariables);
    }

    @Override public int hashCode() {
        return Objects.hash(scripts, macros, enums, enumMembers, globalVariables, instanceVariables);
    }
}
