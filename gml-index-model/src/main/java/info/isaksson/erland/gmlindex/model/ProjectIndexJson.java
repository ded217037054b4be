package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for {@link ProjectIndex}.
 *
 * <p>Writing is deterministic: the index is normalized first and map entries are written in key
 * order, so an unchanged project always produces byte-identical output.</p>
 */
public final class ProjectIndexJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ProjectIndexJson() {}

    public static ProjectIndex read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ProjectIndex.class);
        }
    }

    public static ProjectIndex readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, ProjectIndex.class);
    }

    public static void write(ProjectIndex index, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        ProjectIndex normalized = ProjectIndexNormalizer.normalize(index);
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, normalized);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(ProjectIndex index) throws IOException {
        ProjectIndex normalized = ProjectIndexNormalizer.normalize(index);
        return MAPPER.writer(PRETTY).writeValueAsString(normalized) + "\n";
    }

    /** A mapper configured like the one used for index files, for documents that embed an index. */
    public static ObjectMapper newMapper() {
        return createMapper();
    }

    /** Pretty writer with the same indentation as index files. */
    public static ObjectWriter prettyWriter(ObjectMapper mapper) {
        return mapper.writer(createPrettyPrinter());
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
