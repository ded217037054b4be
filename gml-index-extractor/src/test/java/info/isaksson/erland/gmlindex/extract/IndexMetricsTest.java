package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.MetricsSummary;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class IndexMetricsTest {

    @Test
    void countersTimingsAndMetadataAccumulate() throws Exception {
        IndexMetrics m = new IndexMetrics();
        m.incrementCounter("files.gmlProcessed");
        m.incrementCounter("files.gmlProcessed");
        m.incrementCounter("io.gmlBytes", 120);
        m.addTiming("gml.parse", 1.5);
        m.addTiming("gml.parse", 2.5);
        m.setMetadata("gmlFileCount", 2);
        String value = m.time("fs.readGml", () -> "text");

        MetricsSummary s = m.summary();
        assertEquals("text", value);
        assertEquals(IndexMetrics.CATEGORY, s.category);
        assertEquals(2, s.counter("files.gmlProcessed"));
        assertEquals(120, s.counter("io.gmlBytes"));
        assertEquals(0, s.counter("never.touched"));
        assertEquals(4.0, s.timings.get("gml.parse"), 1e-9);
        assertTrue(s.timings.containsKey("fs.readGml"));
        assertEquals(2, s.metadata.get("gmlFileCount"));
        assertTrue(s.totalTimeMs >= 0);
    }

    @Test
    void timedWorkRecordsEvenWhenItFails() {
        IndexMetrics m = new IndexMetrics();
        assertThrows(IOException.class, () -> m.time("fs.readGml", () -> {
            throw new IOException("gone");
        }));
        assertTrue(m.summary().timings.containsKey("fs.readGml"));
    }

    @Test
    void cacheOutcomesAreTrackedPerCache() {
        IndexMetrics m = new IndexMetrics();
        m.recordCacheMiss("builtInIdentifiers");
        m.recordCacheHit("builtInIdentifiers");
        m.recordCacheHit("builtInIdentifiers");
        m.recordCacheStale("other");

        MetricsSummary s = m.summary();
        assertEquals(2, s.caches.get("builtInIdentifiers").hits);
        assertEquals(1, s.caches.get("builtInIdentifiers").misses);
        assertEquals(1, s.caches.get("other").stale);
    }
}
