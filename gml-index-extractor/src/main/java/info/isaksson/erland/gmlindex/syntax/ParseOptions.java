package info.isaksson.erland.gmlindex.syntax;

/** What the caller needs from a parse. The indexer always asks for both. */
public final class ParseOptions {
    public final String filePath;
    public final boolean requestLocations;
    public final boolean requestIdentifierRoles;

    public ParseOptions(String filePath, boolean requestLocations, boolean requestIdentifierRoles) {
        this.filePath = filePath;
        this.requestLocations = requestLocations;
        this.requestIdentifierRoles = requestIdentifierRoles;
    }

    public static ParseOptions forIndexing(String filePath) {
        return new ParseOptions(filePath, true, true);
    }
}
