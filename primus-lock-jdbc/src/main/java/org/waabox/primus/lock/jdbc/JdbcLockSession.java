package org.waabox.primus.lock.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.primus.lock.LockIdentifier;
import org.waabox.primus.lock.LockSession;
import org.waabox.primus.lock.LockSessionLostException;
import org.waabox.primus.lock.LockStoreException;

/**
 * A lock session pinned to one JDBC connection.
 *
 * <p>Advisory locks are re-entrant in PostgreSQL: every successful acquire
 * must be matched by its own release. The session remembers which keys it
 * holds and, for those, only checks that the connection is still alive
 * instead of stacking another acquire, so a single release is always
 * enough.
 *
 * <p>Failures that leave the connection unusable are reported as
 * {@link LockSessionLostException}: the database session, and with it
 * every advisory lock, is gone.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JdbcLockSession implements LockSession {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcLockSession.class);

  /** The pinned connection, never null. */
  private final Connection connection;

  /** The store configuration, never null. */
  private final JdbcLockStoreConfig config;

  /** The keys this session holds. */
  private final Set<Long> heldKeys = new HashSet<>();

  /** Whether this session was closed. */
  private boolean closed = false;

  /** Creates a session.
   *
   * @param theConnection the connection to pin, never null
   * @param theConfig the store configuration, never null
   */
  JdbcLockSession(final Connection theConnection,
      final JdbcLockStoreConfig theConfig) {
    connection = Objects.requireNonNull(theConnection,
        "connection cannot be null");
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public boolean tryAcquire(final LockIdentifier identifier,
      final Duration timeout) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    Objects.requireNonNull(timeout, "timeout cannot be null");
    checkOpen();

    if (heldKeys.contains(identifier.key())) {
      return checkStillHeld(identifier, timeout);
    }

    final boolean granted = execute(config.acquireSql(), identifier, timeout);
    if (granted) {
      heldKeys.add(identifier.key());
    }
    log.debug("Advisory lock {} acquire: granted={}", identifier, granted);
    return granted;
  }

  /** {@inheritDoc} */
  @Override
  public boolean release(final LockIdentifier identifier,
      final Duration timeout) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    Objects.requireNonNull(timeout, "timeout cannot be null");
    checkOpen();

    final boolean released = execute(config.releaseSql(), identifier,
        timeout);
    heldKeys.remove(identifier.key());
    log.debug("Advisory lock {} release: released={}", identifier, released);
    return released;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    heldKeys.clear();
    try {
      connection.close();
    } catch (final SQLException e) {
      throw new LockStoreException("Failed to close advisory lock session",
          e);
    }
  }

  /**
   * Confirms a held lock is still ours by validating the connection: a
   * session lock lives exactly as long as its database session.
   *
   * @param identifier the held lock
   * @param timeout the validation timeout
   *
   * @return always true when the connection is alive
   *
   * @throws LockSessionLostException if the connection is gone
   */
  private boolean checkStillHeld(final LockIdentifier identifier,
      final Duration timeout) {
    try {
      if (connection.isValid(toSeconds(timeout))) {
        return true;
      }
    } catch (final SQLException e) {
      throw new LockStoreException("Failed to validate session holding "
          + identifier, e);
    }
    heldKeys.remove(identifier.key());
    throw new LockSessionLostException("Session holding " + identifier
        + " is no longer valid");
  }

  /**
   * Runs a single-parameter lock statement.
   *
   * @param sql the statement
   * @param identifier the lock
   * @param timeout the query timeout
   *
   * @return the boolean the statement returned, false on SQL NULL
   *
   * @throws LockSessionLostException if the statement fails and the
   *                                  connection no longer validates
   * @throws LockStoreException if the statement fails
   */
  private boolean execute(final String sql, final LockIdentifier identifier,
      final Duration timeout) {
    try (final PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setQueryTimeout(toSeconds(timeout));
      ps.setLong(1, identifier.key());

      try (final ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new LockStoreException("Lock statement returned no row for "
              + identifier);
        }
        return rs.getBoolean(1);
      }
    } catch (final SQLException e) {
      final String message = "Lock statement failed for " + identifier;
      if (connectionLost(timeout)) {
        throw new LockSessionLostException(message, e);
      }
      throw new LockStoreException(message, e);
    }
  }

  /**
   * Checks whether the pinned connection is unusable after a failure.
   *
   * @param timeout the validation timeout
   *
   * @return true if the connection does not validate
   */
  private boolean connectionLost(final Duration timeout) {
    try {
      return !connection.isValid(toSeconds(timeout));
    } catch (final SQLException e) {
      log.debug("Connection validation failed", e);
      return true;
    }
  }

  /** Fails if this session was closed. */
  private void checkOpen() {
    if (closed) {
      throw new LockSessionLostException("Advisory lock session is closed");
    }
  }

  /**
   * Converts a timeout to whole JDBC seconds, rounding up, at least one.
   *
   * @param timeout the timeout
   *
   * @return the timeout in seconds
   */
  private static int toSeconds(final Duration timeout) {
    final long millis = timeout.toMillis();
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE,
        (millis + 999L) / 1000L));
  }
}
