package org.waabox.primus.lock.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.primus.lock.LockSession;
import org.waabox.primus.lock.LockStore;
import org.waabox.primus.lock.LockStoreException;

/**
 * A {@link LockStore} backed by database session advisory locks, by default
 * PostgreSQL's {@code pg_try_advisory_lock} and {@code pg_advisory_unlock}.
 *
 * <p>Advisory locks belong to the database session that took them. When
 * the {@link javax.sql.DataSource} is a connection pool, running each lock
 * statement on whatever connection the pool hands out would scatter acquire
 * and release over different sessions. Each {@link LockSession} returned by
 * this store therefore borrows one connection and keeps it until it is
 * closed; closing the session closes the connection, which makes the
 * database drop every lock the session held.
 *
 * <p>Thread safety: the store is thread-safe; the sessions it opens are
 * not.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcAdvisoryLockStore implements LockStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcAdvisoryLockStore.class);

  /** The configuration for this store, never null. */
  private final JdbcLockStoreConfig config;

  /**
   * Creates a new JDBC advisory lock store.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcAdvisoryLockStore(final JdbcLockStoreConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /**
   * Borrows a connection and pins it to a new lock session.
   *
   * <p>The connection is switched to auto-commit so lock statements never
   * sit in an open transaction.
   *
   * @return the new session, never null
   *
   * @throws LockStoreException if no connection can be obtained
   */
  @Override
  public LockSession openSession() {
    Connection connection = null;
    try {
      connection = config.dataSource().getConnection();
      connection.setAutoCommit(true);
      log.debug("Opened advisory lock session on {}", connection);
      return new JdbcLockSession(connection, config);
    } catch (final SQLException e) {
      if (connection != null) {
        try {
          connection.close();
        } catch (final SQLException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      throw new LockStoreException("Failed to open advisory lock session", e);
    }
  }
}
