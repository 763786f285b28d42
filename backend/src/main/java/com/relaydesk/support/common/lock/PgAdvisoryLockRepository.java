package com.relaydesk.support.common.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.SQLException;

@Repository
public class PgAdvisoryLockRepository {

    private static final Logger log = LoggerFactory.getLogger(PgAdvisoryLockRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public PgAdvisoryLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs {@code action} while holding a session-level advisory lock on {@code key}.
     * The lock is taken and released on the same pooled connection, which stays checked out for the duration.
     * On databases without advisory locks (H2) the action runs unlocked.
     *
     * @return false when another session holds the lock and the action was skipped
     */
    public boolean runWithLock(String key, Runnable action) {
        Boolean ran = jdbcTemplate.execute((ConnectionCallback<Boolean>) con -> {
            boolean locked;
            try {
                locked = tryLock(con, key);
            } catch (SQLException e) {
                // Non-Postgres (e.g. H2) or function not available: run without distributed lock.
                log.debug("advisory_lock_unavailable key={} cause={}", key, e.toString());
                action.run();
                return true;
            }
            if (!locked) {
                return false;
            }
            try {
                action.run();
                return true;
            } finally {
                unlock(con, key);
            }
        });
        return ran != null && ran;
    }

    private static boolean tryLock(Connection con, String key) throws SQLException {
        try (var ps = con.prepareStatement("select pg_try_advisory_lock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void unlock(Connection con, String key) {
        try (var ps = con.prepareStatement("select pg_advisory_unlock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            ps.executeQuery().close();
        } catch (SQLException e) {
            log.warn("advisory_unlock_failed key={}", key, e);
        }
    }
}
