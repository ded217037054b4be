package info.isaksson.erland.gmlindex.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class NioFsFacadeTest {

    @Test
    void mtimeKeepsSubMillisecondPrecision() {
        FileTime a = FileTime.from(Instant.ofEpochSecond(1_700_000_000L, 123_000_000));
        FileTime b = FileTime.from(Instant.ofEpochSecond(1_700_000_000L, 123_500_000));

        assertEquals(1_700_000_000_123.0, NioFsFacade.toEpochMillis(a));
        assertEquals(1_700_000_000_123.5, NioFsFacade.toEpochMillis(b), 1e-3);
        assertNotEquals(NioFsFacade.toEpochMillis(a), NioFsFacade.toEpochMillis(b),
                "two writes within the same millisecond must not share an mtime");
    }

    @Test
    void statReportsTheFileTimeAsFractionalMillis() throws Exception {
        Path file = Files.createTempFile("gmlidx-stat-", ".gml");
        FileStat stat = NioFsFacade.INSTANCE.stat(file);

        assertEquals(NioFsFacade.toEpochMillis(Files.getLastModifiedTime(file)), stat.mtimeMs);
        assertTrue(stat.file);
        assertFalse(stat.directory);
    }

    @Test
    void missingPathIsNotFound() {
        Path missing = Path.of(System.getProperty("java.io.tmpdir"), "gmlidx-missing-" + System.nanoTime());
        NoSuchFileException e = assertThrows(NoSuchFileException.class, () -> NioFsFacade.INSTANCE.stat(missing));
        assertTrue(FsErrors.isNotFound(e));
    }
}
