package info.isaksson.erland.gmlindex.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds every object in a manifest that carries a string {@code path} field.
 *
 * <p>Over-collects on purpose: any {@code {"name": ..., "path": ...}} pair is reported, whether
 * it points at a sprite, a parent object, a folder or the resource's own event files.</p>
 */
final class ManifestAssetCollector implements ManifestValue.Visitor<Void> {

    /** One raw hit; {@code targetPath} is exactly as written in the manifest. */
    static final class Hit {
        final String propertyPath;
        final String targetPath;
        final String targetName;

        Hit(String propertyPath, String targetPath, String targetName) {
            this.propertyPath = propertyPath;
            this.targetPath = targetPath;
            this.targetName = targetName;
        }
    }

    private final List<Hit> hits = new ArrayList<>();
    private String currentPath = "";

    static List<Hit> collect(ManifestValue root) {
        ManifestAssetCollector collector = new ManifestAssetCollector();
        root.accept(collector);
        return collector.hits;
    }

    @Override
    public Void visitObject(ManifestValue.ObjectValue value) {
        String path = value.string("path");
        if (path != null) {
            hits.add(new Hit(currentPath, path, value.string("name")));
        }
        for (Map.Entry<String, ManifestValue> e : value.fields.entrySet()) {
            descend(e.getKey(), e.getValue());
        }
        return null;
    }

    @Override
    public Void visitArray(ManifestValue.ArrayValue value) {
        for (int i = 0; i < value.items.size(); i++) {
            descend(Integer.toString(i), value.items.get(i));
        }
        return null;
    }

    private void descend(String segment, ManifestValue child) {
        if (child.asObject() == null && child.asArray() == null) return;
        String saved = currentPath;
        currentPath = saved.isEmpty() ? segment : saved + "." + segment;
        try {
            child.accept(this);
        } finally {
            currentPath = saved;
        }
    }

    @Override public Void visitString(ManifestValue.StringValue value) { return null; }
    @Override public Void visitNumber(ManifestValue.NumberValue value) { return null; }
    @Override public Void visitBoolean(ManifestValue.BooleanValue value) { return null; }
    @Override public Void visitNull(ManifestValue.NullValue value) { return null; }
}
