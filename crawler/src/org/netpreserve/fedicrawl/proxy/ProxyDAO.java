package org.netpreserve.fedicrawl.proxy;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Each statement is a single-row atomic update so concurrent crawl processes can share the pool without locking.
 * Transitions use the pre-update column values, as SQLite evaluates every SET expression against the old row.
 */
@RegisterConstructorMapper(ProxyRecord.class)
public interface ProxyDAO {
    @SqlUpdate("INSERT INTO proxies (uri, added) VALUES (:uri, :added) ON CONFLICT (uri) DO NOTHING")
    boolean insert(ProxyUri uri, Instant added);

    @SqlQuery("SELECT * FROM proxies WHERE uri = ?")
    ProxyRecord find(ProxyUri uri);

    @SqlQuery("SELECT * FROM proxies ORDER BY added, uri")
    List<ProxyRecord> list();

    @SqlQuery("SELECT * FROM proxies WHERE status = ? ORDER BY added, uri")
    List<ProxyRecord> listByStatus(ProxyStatus status);

    @SqlUpdate("""
            UPDATE proxies SET status = 'HEALTHY', cooldown_until = NULL
            WHERE status = 'RATE_LIMITED' AND cooldown_until <= :now""")
    int promoteExpiredCooldowns(Instant now);

    @SqlUpdate("UPDATE proxies SET last_used = :now WHERE uri = :uri")
    void touch(ProxyUri uri, Instant now);

    @SqlUpdate("""
            UPDATE proxies
            SET status = 'HEALTHY',
                cooldown_until = NULL,
                consecutive_failures = 0,
                requests = requests + 1,
                successes = successes + 1,
                total_response_time = total_response_time + :responseMillis
            WHERE uri = :uri""")
    boolean recordSuccess(ProxyUri uri, long responseMillis);

    @SqlUpdate("""
            UPDATE proxies
            SET requests = requests + 1,
                failures = failures + 1,
                last_failure_reason = :reason,
                consecutive_failures = iif(status = 'RATE_LIMITED', consecutive_failures, consecutive_failures + 1),
                status = iif(status = 'HEALTHY' AND consecutive_failures + 1 >= :threshold, 'UNHEALTHY', status)
            WHERE uri = :uri""")
    boolean recordFailure(ProxyUri uri, String reason, int threshold);

    @SqlUpdate("""
            UPDATE proxies
            SET requests = requests + 1,
                cooldown_until = iif(status = 'UNHEALTHY', cooldown_until, :until),
                status = iif(status = 'UNHEALTHY', status, 'RATE_LIMITED')
            WHERE uri = :uri""")
    boolean recordRateLimited(ProxyUri uri, Instant until);

    @SqlUpdate("DELETE FROM proxies WHERE uri = ?")
    boolean delete(ProxyUri uri);

    @SqlUpdate("""
            UPDATE proxies
            SET status = 'HEALTHY', consecutive_failures = 0, requests = 0, successes = 0, failures = 0,
                total_response_time = 0, last_failure_reason = NULL, cooldown_until = NULL""")
    int resetAll();
}
