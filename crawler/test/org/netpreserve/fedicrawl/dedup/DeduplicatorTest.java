package org.netpreserve.fedicrawl.dedup;

import org.jdbi.v3.core.ConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.fedicrawl.Database;
import org.netpreserve.fedicrawl.InMemoryDatabaseTestExtension;
import org.netpreserve.fedicrawl.MutableClock;
import org.netpreserve.fedicrawl.config.DedupConfig;

import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class DeduplicatorTest {
    private static final DedupConfig SMALL = new DedupConfig(1000, 5000, 0.01, Duration.ofDays(7));
    private final Database database;
    private final MutableClock clock = new MutableClock();

    DeduplicatorTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        database.useHandle(handle -> {
            handle.execute("DELETE FROM dedup_records");
            handle.execute("DELETE FROM dedup_filters");
        });
    }

    private Deduplicator newDeduplicator(DedupConfig config) {
        return new Deduplicator(database.dedup(), config, clock);
    }

    @Test
    void markedKeyIsDuplicateImmediately() {
        var dedup = newDeduplicator(new DedupConfig(1_000_000, 1000, 0.01, Duration.ofDays(7)));
        assertEquals(9_585_059, dedup.parameters(Namespace.NODE).size());
        assertFalse(dedup.isDuplicate("did:plc:alice", Namespace.NODE));
        dedup.markProcessed("did:plc:alice", Namespace.NODE, Map.of("strategy", "relationships"));
        assertTrue(dedup.isDuplicate("did:plc:alice", Namespace.NODE));
    }

    @Test
    void namespacesAreSeparate() {
        var dedup = newDeduplicator(SMALL);
        dedup.markProcessed("did:plc:alice", Namespace.NODE, Map.of());
        assertFalse(dedup.isDuplicate("did:plc:alice", Namespace.EDGE));
    }

    @Test
    void expiredRecordIsNoLongerDuplicate() {
        var dedup = newDeduplicator(SMALL);
        dedup.markProcessed("k", Namespace.EDGE, Map.of());
        clock.advance(Duration.ofDays(7).minusSeconds(1));
        assertTrue(dedup.isDuplicate("k", Namespace.EDGE));
        clock.advance(Duration.ofSeconds(1));
        assertFalse(dedup.isDuplicate("k", Namespace.EDGE), "filter hit must not outlive the record");

        dedup.markProcessed("k", Namespace.EDGE, Map.of());
        assertTrue(dedup.isDuplicate("k", Namespace.EDGE));
    }

    @Test
    void metadataIsStoredWithRecord() {
        var dedup = newDeduplicator(SMALL);
        dedup.markProcessed("did:plc:bob", Namespace.NODE, Map.of("depth", "2"));
        String keyHash = HexFormat.of().formatHex(Deduplicator.digest("did:plc:bob"));
        assertEquals("{\"depth\":\"2\"}", database.dedup().findMetadata(Namespace.NODE, keyHash));
    }

    @Test
    void newInstanceSeesUnsavedRecords() {
        var first = newDeduplicator(SMALL);
        first.markProcessed("a", Namespace.NODE, Map.of());
        var second = newDeduplicator(SMALL);
        assertTrue(second.isDuplicate("a", Namespace.NODE));
    }

    @Test
    void savedFiltersMergeAcrossInstances() {
        var first = newDeduplicator(SMALL);
        var second = newDeduplicator(SMALL);
        first.markProcessed("a", Namespace.NODE, Map.of());
        second.markProcessed("b", Namespace.NODE, Map.of());

        first.saveFilters();
        assertTrue(database.dedup().pendingKeys(Namespace.NODE).isEmpty());
        assertTrue(first.isDuplicate("b", Namespace.NODE), "save should pick up other writers' records");

        second.saveFilters();
        var stored = database.dedup().findFilter(Namespace.NODE);
        var storedFilter = BloomFilter.fromBytes(stored.parameters(), stored.bits());
        assertTrue(storedFilter.mightContain(Deduplicator.digest("a")));
        assertTrue(storedFilter.mightContain(Deduplicator.digest("b")));

        var third = newDeduplicator(SMALL);
        assertTrue(third.isDuplicate("a", Namespace.NODE));
        assertTrue(third.isDuplicate("b", Namespace.NODE));
    }

    @Test
    void changedDimensionsRebuildFromRecords() {
        var first = newDeduplicator(SMALL);
        first.markProcessed("a", Namespace.NODE, Map.of());
        first.saveFilters();

        var resized = newDeduplicator(new DedupConfig(50_000, 5000, 0.001, Duration.ofDays(7)));
        assertTrue(resized.isDuplicate("a", Namespace.NODE));
        assertNull(database.dedup().findFilter(Namespace.NODE));
        resized.saveFilters();
        assertEquals(resized.parameters(Namespace.NODE), database.dedup().findFilter(Namespace.NODE).parameters());
    }

    @Test
    void resetForgetsOneNamespace() {
        var dedup = newDeduplicator(SMALL);
        dedup.markProcessed("a", Namespace.NODE, Map.of());
        dedup.markProcessed("a", Namespace.EDGE, Map.of());
        dedup.saveFilters();
        dedup.reset(Namespace.NODE);
        assertFalse(dedup.isDuplicate("a", Namespace.NODE));
        assertTrue(dedup.isDuplicate("a", Namespace.EDGE));
        assertFalse(newDeduplicator(SMALL).isDuplicate("a", Namespace.NODE));
    }

    @Test
    void purgeDeletesExpiredRecords() {
        var dedup = newDeduplicator(SMALL);
        dedup.markProcessed("old", Namespace.NODE, Map.of());
        clock.advance(Duration.ofDays(3));
        dedup.markProcessed("new", Namespace.NODE, Map.of());
        clock.advance(Duration.ofDays(5));
        assertEquals(1, dedup.purgeExpired());
        assertEquals(1, database.dedup().countLive(Namespace.NODE, clock.instant()));
    }

    @Test
    void statsCountChecksAndHits() {
        var dedup = newDeduplicator(SMALL);
        dedup.isDuplicate("a", Namespace.NODE);
        dedup.markProcessed("a", Namespace.NODE, Map.of());
        dedup.isDuplicate("a", Namespace.NODE);
        var stats = dedup.stats(Namespace.NODE);
        assertEquals(2, stats.checked());
        assertEquals(1, stats.duplicates());
        assertEquals(1, stats.added());
        assertTrue(stats.filterHits() >= 1);
        assertEquals(0, stats.storeErrors());
    }

    @Test
    void keepsWorkingInMemoryWhenStoreIsDown() {
        DedupDAO broken = (DedupDAO) Proxy.newProxyInstance(DedupDAO.class.getClassLoader(),
                new Class<?>[]{DedupDAO.class}, (proxy, method, args) -> {
                    throw new ConnectionException(new SQLException("store is down"));
                });
        var dedup = new Deduplicator(broken, SMALL, clock);
        assertFalse(dedup.isDuplicate("a", Namespace.NODE));
        dedup.markProcessed("a", Namespace.NODE, Map.of());
        assertTrue(dedup.isDuplicate("a", Namespace.NODE));
        dedup.saveFilters();
        assertTrue(dedup.stats(Namespace.NODE).storeErrors() > 0);

        clock.advance(Duration.ofDays(8));
        assertFalse(dedup.isDuplicate("a", Namespace.NODE));
    }
}
