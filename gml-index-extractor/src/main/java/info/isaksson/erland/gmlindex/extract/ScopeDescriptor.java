package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.EventInfo;
import info.isaksson.erland.gmlindex.model.ScopeKind;

import java.util.Objects;

/** Which scope a source file belongs to, derived from the manifests before any source is read. */
public final class ScopeDescriptor {
    public final String id;
    public final ScopeKind kind;
    public final String name;
    public final String displayName;
    /** Owning resource manifest; null for file scopes. */
    public final String resourcePath;
    public final String sourcePath;
    /** Only for object events. */
    public final EventInfo event;

    public ScopeDescriptor(String id, ScopeKind kind, String name, String displayName,
                           String resourcePath, String sourcePath, EventInfo event) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.displayName = displayName;
        this.resourcePath = resourcePath;
        this.sourcePath = sourcePath;
        this.event = event;
    }

    public static ScopeDescriptor script(String scriptName, String resourcePath, String sourcePath) {
        return new ScopeDescriptor(
                ScopeKind.SCRIPT.scopeId(scriptName),
                ScopeKind.SCRIPT,
                scriptName,
                "script." + scriptName,
                resourcePath,
                sourcePath,
                null
        );
    }

    public static ScopeDescriptor objectEvent(String objectName, EventInfo event, String resourcePath, String sourcePath) {
        return new ScopeDescriptor(
                ScopeKind.OBJECT_EVENT.scopeId(objectName, event.name),
                ScopeKind.OBJECT_EVENT,
                objectName + "." + event.name,
                "object." + objectName + "." + event.name,
                resourcePath,
                sourcePath,
                event
        );
    }

    /** Synthetic scope for a source file that no manifest claims. */
    public static ScopeDescriptor file(String relativePath) {
        String base = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        String stem = dot > 0 ? base.substring(0, dot) : base;
        return new ScopeDescriptor(
                ScopeKind.FILE.scopeId(relativePath),
                ScopeKind.FILE,
                stem,
                "file." + relativePath,
                null,
                relativePath,
                null
        );
    }

    public boolean isScript() {
        return kind == ScopeKind.SCRIPT;
    }

    public boolean isObjectEvent() {
        return kind == ScopeKind.OBJECT_EVENT;
    }

    @Override public String toString() {
        return "ScopeDescriptor{" + id + " <- " + sourcePath + "}";
    }
}
