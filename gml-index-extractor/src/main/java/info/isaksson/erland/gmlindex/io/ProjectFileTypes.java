package info.isaksson.erland.gmlindex.io;

import java.util.Locale;

/** File-extension classification for GameMaker project trees. */
public final class ProjectFileTypes {
    public static final String RESOURCE_EXTENSION = ".yy";
    public static final String PROJECT_MANIFEST_EXTENSION = ".yyp";
    public static final String SOURCE_EXTENSION = ".gml";

    private ProjectFileTypes() {}

    public static boolean isManifest(String name) {
        String lower = lower(name);
        return lower.endsWith(RESOURCE_EXTENSION) || lower.endsWith(PROJECT_MANIFEST_EXTENSION);
    }

    public static boolean isProjectManifest(String name) {
        return lower(name).endsWith(PROJECT_MANIFEST_EXTENSION);
    }

    public static boolean isSource(String name) {
        return lower(name).endsWith(SOURCE_EXTENSION);
    }

    /** File name without a {@code .yy}/{@code .yyp} suffix. */
    public static String manifestStem(String fileName) {
        String lower = lower(fileName);
        if (lower.endsWith(PROJECT_MANIFEST_EXTENSION)) return fileName.substring(0, fileName.length() - PROJECT_MANIFEST_EXTENSION.length());
        if (lower.endsWith(RESOURCE_EXTENSION)) return fileName.substring(0, fileName.length() - RESOURCE_EXTENSION.length());
        return fileName;
    }

    private static String lower(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
