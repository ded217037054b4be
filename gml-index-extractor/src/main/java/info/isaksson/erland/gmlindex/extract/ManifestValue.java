package info.isaksson.erland.gmlindex.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural view of a parsed resource manifest: object, array, string, number, boolean or null.
 *
 * <p>The set of variants is closed (private constructor); callers branch with {@link Visitor}
 * or the {@code as*} accessors instead of inspecting raw JSON nodes.</p>
 */
public abstract class ManifestValue {

    /** GameMaker writes trailing commas in {@code .yy} files. */
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    public interface Visitor<R> {
        R visitObject(ObjectValue value);
        R visitArray(ArrayValue value);
        R visitString(StringValue value);
        R visitNumber(NumberValue value);
        R visitBoolean(BooleanValue value);
        R visitNull(NullValue value);
    }

    private ManifestValue() {}

    public abstract <R> R accept(Visitor<R> visitor);

    public ObjectValue asObject() {
        return null;
    }

    public ArrayValue asArray() {
        return null;
    }

    /** The string content, or null when this is not a string. */
    public String asString() {
        return null;
    }

    /** The integral value, or null when this is not an integral number. */
    public Integer asInteger() {
        return null;
    }

    public static ManifestValue parse(String json) throws JsonProcessingException {
        return fromJson(MAPPER.readTree(json));
    }

    public static ManifestValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullValue.INSTANCE;
        if (node.isObject()) {
            Map<String, ManifestValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), fromJson(e.getValue()));
            }
            return new ObjectValue(fields);
        }
        if (node.isArray()) {
            List<ManifestValue> items = new ArrayList<>(node.size());
            for (JsonNode child : node) items.add(fromJson(child));
            return new ArrayValue(items);
        }
        if (node.isTextual()) return new StringValue(node.textValue());
        if (node.isNumber()) return new NumberValue(node.doubleValue(), node.isIntegralNumber() || node.doubleValue() == Math.rint(node.doubleValue()));
        if (node.isBoolean()) return new BooleanValue(node.booleanValue());
        return new StringValue(node.asText());
    }

    public static final class ObjectValue extends ManifestValue {
        public final Map<String, ManifestValue> fields;

        ObjectValue(Map<String, ManifestValue> fields) {
            this.fields = Collections.unmodifiableMap(fields);
        }

        public ManifestValue get(String name) {
            ManifestValue v = fields.get(name);
            return v == null ? NullValue.INSTANCE : v;
        }

        /** String field, or null when absent or not a string. */
        public String string(String name) {
            return get(name).asString();
        }

        public Integer integer(String name) {
            return get(name).asInteger();
        }

        @Override public ObjectValue asObject() {
            return this;
        }

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    public static final class ArrayValue extends ManifestValue {
        public final List<ManifestValue> items;

        ArrayValue(List<ManifestValue> items) {
            this.items = Collections.unmodifiableList(items);
        }

        @Override public ArrayValue asArray() {
            return this;
        }

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    public static final class StringValue extends ManifestValue {
        public final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override public String asString() {
            return value;
        }

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    public static final class NumberValue extends ManifestValue {
        public final double value;
        public final boolean integral;

        NumberValue(double value, boolean integral) {
            this.value = value;
            this.integral = integral;
        }

        @Override public Integer asInteger() {
            return integral ? (int) value : null;
        }

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    public static final class BooleanValue extends ManifestValue {
        public final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    public static final class NullValue extends ManifestValue {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }
}
