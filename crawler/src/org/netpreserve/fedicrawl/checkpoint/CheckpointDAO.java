package org.netpreserve.fedicrawl.checkpoint;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.fedicrawl.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Checkpoint.class)
public interface CheckpointDAO {
    /**
     * Inserts a checkpoint one past the scraper type's highest sequence, in a single statement so concurrent
     * writers can't be handed the same number.
     *
     * @return the assigned sequence
     */
    @SqlQuery("""
            INSERT INTO checkpoints (id, scraper_type, session_id, sequence, timestamp, state, metadata)
            SELECT :id, :scraperType, :sessionId, COALESCE(MAX(sequence), 0) + 1, :timestamp, :state, :metadata
            FROM checkpoints WHERE scraper_type = :scraperType
            RETURNING sequence""")
    long insert(String id, String scraperType, String sessionId, Instant timestamp, byte[] state,
                CheckpointMetadata metadata);

    @SqlUpdate("""
            INSERT INTO checkpoints (id, scraper_type, session_id, sequence, timestamp, state, metadata)
            VALUES (:id, :scraperType, :sessionId, :sequence, :timestamp, :state, :metadata)
            ON CONFLICT (id) DO NOTHING""")
    boolean insertIfAbsent(@BindMethods Checkpoint checkpoint);

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM checkpoints WHERE scraper_type = ? AND sequence = ?)")
    boolean sequenceTaken(String scraperType, long sequence);

    @SqlQuery("SELECT * FROM checkpoints WHERE scraper_type = ? ORDER BY sequence DESC LIMIT 1")
    Checkpoint latest(String scraperType);

    @SqlQuery("SELECT * FROM checkpoints WHERE id = ?")
    Checkpoint find(String id);

    @SqlQuery("SELECT * FROM checkpoints WHERE scraper_type = ? ORDER BY sequence DESC")
    List<Checkpoint> list(String scraperType);

    @SqlQuery("SELECT * FROM checkpoints ORDER BY scraper_type, sequence DESC")
    List<Checkpoint> listAll();

    @SqlUpdate("DELETE FROM checkpoints WHERE id = ?")
    @MustUpdate(1)
    void delete(String id);

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM checkpoints WHERE id = ?)")
    boolean exists(String id);

    @SqlUpdate("""
            DELETE FROM checkpoints
            WHERE scraper_type = :scraperType
              AND sequence NOT IN (SELECT sequence FROM checkpoints WHERE scraper_type = :scraperType
                                   ORDER BY sequence DESC LIMIT :keep)""")
    int prune(String scraperType, int keep);
}
