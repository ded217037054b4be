package info.isaksson.erland.gmlindex.syntax;

/**
 * Turns GML source text into a syntax tree whose identifier nodes carry role tags, locations,
 * parser-local scope ids and declaration back-references.
 *
 * <p>Implementations must be safe to call from several threads at once.</p>
 */
public interface GmlParser {

    /**
     * @throws GmlParseException when the text cannot be parsed
     */
    SyntaxTree parse(String sourceText, ParseOptions options);
}
