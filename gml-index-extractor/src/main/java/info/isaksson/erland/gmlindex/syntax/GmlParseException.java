package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

/** Raised by a {@link GmlParser} for text it cannot parse. */
public class GmlParseException extends RuntimeException {
    private final String filePath;
    private final SourceLocation location;

    public GmlParseException(String message, String filePath, SourceLocation location) {
        super(format(message, filePath, location));
        this.filePath = filePath;
        this.location = location;
    }

    public String getFilePath() {
        return filePath;
    }

    public SourceLocation getLocation() {
        return location;
    }

    private static String format(String message, String filePath, SourceLocation location) {
        StringBuilder sb = new StringBuilder();
        if (filePath != null) sb.append(filePath);
        if (location != null) sb.append(sb.length() > 0 ? ":" : "").append(location.line).append(':').append(location.column);
        if (sb.length() > 0) sb.append(": ");
        return sb.append(message).toString();
    }
}
