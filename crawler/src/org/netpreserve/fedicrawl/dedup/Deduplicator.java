package org.netpreserve.fedicrawl.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.JdbiException;
import org.netpreserve.fedicrawl.config.DedupConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Answers "has this node or edge been processed already?".
 * <p>
 * An in-memory Bloom filter per namespace screens out keys that were never seen without touching the store. Keys
 * the filter can't rule out are confirmed against the authoritative records, which expire after the configured TTL;
 * once a record has expired its key counts as new again even though the filter still matches it.
 * <p>
 * If the store fails, records are kept in process memory for the rest of the run and a warning is logged.
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    private final DedupDAO dao;
    private final Duration ttl;
    private final Clock clock;
    private final Map<Namespace, FilterParameters> parameters = new EnumMap<>(Namespace.class);
    private final Map<Namespace, BloomFilter> filters = new EnumMap<>(Namespace.class);
    private final Map<Namespace, Map<String, Instant>> fallback = new EnumMap<>(Namespace.class);
    private final Map<Namespace, Counters> counters = new EnumMap<>(Namespace.class);

    public Deduplicator(DedupDAO dao, DedupConfig config) {
        this(dao, config, Clock.systemUTC());
    }

    public Deduplicator(DedupDAO dao, DedupConfig config, Clock clock) {
        this.dao = dao;
        this.ttl = config.ttl();
        this.clock = clock;
        parameters.put(Namespace.NODE, FilterParameters.derive(config.expectedNodes(), config.falsePositiveRate()));
        parameters.put(Namespace.EDGE, FilterParameters.derive(config.expectedEdges(), config.falsePositiveRate()));
        for (Namespace namespace : Namespace.values()) {
            filters.put(namespace, new BloomFilter(parameters.get(namespace)));
            fallback.put(namespace, new ConcurrentHashMap<>());
            counters.put(namespace, new Counters());
        }
        reconcile();
    }

    /**
     * Canonical key of a directed edge. The qualifier distinguishes listings that can report the same pair.
     */
    public static String edgeKey(String source, String target, String qualifier) {
        return source + ":" + target + ":" + qualifier;
    }

    public boolean isDuplicate(String key, Namespace namespace) {
        Counters counters = this.counters.get(namespace);
        counters.checked.incrementAndGet();
        byte[] digest = digest(key);
        if (!filters.get(namespace).mightContain(digest)) return false;
        counters.filterHits.incrementAndGet();

        String keyHash = HEX.formatHex(digest);
        Instant now = clock.instant();
        boolean live;
        try {
            live = dao.existsLive(namespace, keyHash, now);
        } catch (JdbiException e) {
            storeFailed(namespace, "lookup", e);
            live = false;
        }
        if (!live) {
            Instant expires = fallback.get(namespace).get(keyHash);
            live = expires != null && expires.isAfter(now);
        }
        if (live) counters.duplicates.incrementAndGet();
        return live;
    }

    /**
     * Records a key as processed. The filter bits are set before the record is written so the filter never
     * under-represents the store.
     */
    public void markProcessed(String key, Namespace namespace, Map<String, String> metadata) {
        byte[] digest = digest(key);
        filters.get(namespace).add(digest);
        counters.get(namespace).added.incrementAndGet();

        String keyHash = HEX.formatHex(digest);
        Instant now = clock.instant();
        Instant expires = now.plus(ttl);
        try {
            dao.upsertRecord(namespace, keyHash, toJson(metadata), now, expires);
        } catch (JdbiException e) {
            storeFailed(namespace, "write", e);
            fallback.get(namespace).put(keyHash, expires);
        }
    }

    /**
     * Persists the filters, merging with whatever other processes saved and folding in records they haven't yet.
     * The in-memory filters pick up the merged bits too.
     */
    public void saveFilters() {
        for (Namespace namespace : Namespace.values()) {
            BloomFilter filter = filters.get(namespace);
            try {
                BloomFilter merged = dao.inTransaction(tx -> {
                    BloomFilter copy = filter.copy();
                    mergeStored(namespace, tx, copy);
                    for (String keyHash : tx.pendingKeys(namespace)) {
                        copy.add(HEX.parseHex(keyHash));
                    }
                    tx.saveFilter(namespace, copy.parameters().size(), copy.parameters().hashCount(),
                            copy.toBytes(), clock.instant());
                    tx.clearPending(namespace);
                    return copy;
                });
                filter.merge(merged);
            } catch (JdbiException e) {
                storeFailed(namespace, "filter save", e);
            }
        }
    }

    /**
     * Brings the in-memory filters up to date with the stored filters and any records not yet folded into them.
     */
    public void reconcile() {
        for (Namespace namespace : Namespace.values()) {
            BloomFilter filter = filters.get(namespace);
            try {
                int pending = dao.inTransaction(tx -> {
                    mergeStored(namespace, tx, filter);
                    var keys = tx.pendingKeys(namespace);
                    for (String keyHash : keys) {
                        filter.add(HEX.parseHex(keyHash));
                    }
                    return keys.size();
                });
                log.atDebug().addKeyValue("namespace", namespace).addKeyValue("pending", pending)
                        .log("Reconciled dedup filter");
            } catch (JdbiException e) {
                storeFailed(namespace, "reconcile", e);
            }
        }
    }

    private void mergeStored(Namespace namespace, DedupDAO tx, BloomFilter into) {
        StoredFilter stored = tx.findFilter(namespace);
        if (stored == null) return;
        if (stored.parameters().equals(into.parameters())) {
            into.merge(BloomFilter.fromBytes(stored.parameters(), stored.bits()));
        } else {
            // the stored bits are unusable at other dimensions, so rebuild from every record instead
            log.warn("Stored {} filter has dimensions {} but {} is configured, rebuilding from records",
                    namespace, stored.parameters(), into.parameters());
            tx.deleteFilter(namespace);
            tx.markAllPending(namespace);
        }
    }

    /**
     * Forgets everything about a namespace, including its filter bits.
     */
    public void reset(Namespace namespace) {
        filters.put(namespace, new BloomFilter(parameters.get(namespace)));
        fallback.get(namespace).clear();
        try {
            dao.useTransaction(tx -> {
                tx.deleteFilter(namespace);
                tx.deleteRecords(namespace);
            });
        } catch (JdbiException e) {
            storeFailed(namespace, "reset", e);
        }
        log.info("Reset {} deduplication", namespace);
    }

    /**
     * Deletes expired records.
     *
     * @return the number of records deleted
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        fallback.values().forEach(map -> map.values().removeIf(expires -> !expires.isAfter(now)));
        try {
            int deleted = dao.deleteExpired(now);
            if (deleted > 0) log.info("Purged {} expired dedup records", deleted);
            return deleted;
        } catch (JdbiException e) {
            storeFailed(null, "purge", e);
            return 0;
        }
    }

    public DedupStats stats(Namespace namespace) {
        Counters c = counters.get(namespace);
        return new DedupStats(namespace, c.checked.get(), c.filterHits.get(), c.duplicates.get(), c.added.get(),
                c.storeErrors.get(), filters.get(namespace).estimatedFalsePositiveRate());
    }

    public FilterParameters parameters(Namespace namespace) {
        return parameters.get(namespace);
    }

    private void storeFailed(Namespace namespace, String operation, JdbiException e) {
        if (namespace != null) counters.get(namespace).storeErrors.incrementAndGet();
        log.atWarn().addKeyValue("namespace", namespace).addKeyValue("operation", operation)
                .log("Dedup store unavailable, continuing without persistence: {}", e.getMessage());
    }

    private static String toJson(Map<String, String> metadata) {
        try {
            return JSON.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable dedup metadata", e);
        }
    }

    static byte[] digest(String key) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static class Counters {
        final AtomicLong checked = new AtomicLong();
        final AtomicLong filterHits = new AtomicLong();
        final AtomicLong duplicates = new AtomicLong();
        final AtomicLong added = new AtomicLong();
        final AtomicLong storeErrors = new AtomicLong();
    }
}
