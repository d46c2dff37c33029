package org.netpreserve.fedicrawl.dedup;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.fedicrawl.util.MustUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Records start out {@code pending_filter = 1}; saving a filter folds them into the stored bits and clears the flag,
 * so the stored filter plus the pending records always cover every record.
 */
@RegisterConstructorMapper(StoredFilter.class)
public interface DedupDAO extends Transactional<DedupDAO> {
    @SqlQuery("SELECT * FROM dedup_filters WHERE namespace = ?")
    StoredFilter findFilter(Namespace namespace);

    @SqlUpdate("""
            INSERT INTO dedup_filters (namespace, size, hash_count, bits, saved)
            VALUES (:namespace, :size, :hashCount, :bits, :saved)
            ON CONFLICT (namespace) DO UPDATE SET size = excluded.size, hash_count = excluded.hash_count,
                                                  bits = excluded.bits, saved = excluded.saved""")
    @MustUpdate(1)
    void saveFilter(Namespace namespace, int size, int hashCount, byte[] bits, Instant saved);

    @SqlUpdate("DELETE FROM dedup_filters WHERE namespace = ?")
    void deleteFilter(Namespace namespace);

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM dedup_records WHERE namespace = :namespace AND key_hash = :keyHash AND expires > :now)")
    boolean existsLive(Namespace namespace, String keyHash, Instant now);

    @SqlUpdate("""
            INSERT INTO dedup_records (namespace, key_hash, metadata, created, expires, pending_filter)
            VALUES (:namespace, :keyHash, :metadata, :created, :expires, 1)
            ON CONFLICT (namespace, key_hash) DO UPDATE SET metadata = excluded.metadata, created = excluded.created,
                                                            expires = excluded.expires, pending_filter = 1""")
    void upsertRecord(Namespace namespace, String keyHash, String metadata, Instant created, Instant expires);

    @SqlQuery("SELECT metadata FROM dedup_records WHERE namespace = :namespace AND key_hash = :keyHash")
    String findMetadata(Namespace namespace, String keyHash);

    @SqlQuery("SELECT key_hash FROM dedup_records WHERE namespace = ? AND pending_filter = 1")
    List<String> pendingKeys(Namespace namespace);

    @SqlUpdate("UPDATE dedup_records SET pending_filter = 0 WHERE namespace = ? AND pending_filter = 1")
    int clearPending(Namespace namespace);

    @SqlUpdate("UPDATE dedup_records SET pending_filter = 1 WHERE namespace = ?")
    int markAllPending(Namespace namespace);

    @SqlQuery("SELECT COUNT(*) FROM dedup_records WHERE namespace = :namespace AND expires > :now")
    long countLive(Namespace namespace, Instant now);

    @SqlUpdate("DELETE FROM dedup_records WHERE expires <= ?")
    int deleteExpired(Instant now);

    @SqlUpdate("DELETE FROM dedup_records WHERE namespace = ?")
    int deleteRecords(Namespace namespace);
}
