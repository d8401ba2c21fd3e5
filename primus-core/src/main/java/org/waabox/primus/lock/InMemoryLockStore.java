package org.waabox.primus.lock;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link LockStore} that keeps its lock table in the memory of the
 * current process.
 *
 * <p>It offers the same guarantees as a database advisory lock facility,
 * but only among the electors of one JVM: ownership is scoped to the
 * session, a session re-acquiring a lock it holds is granted again, a
 * release from a session that does not hold the lock is a no-op, and
 * closing a session frees all its locks.
 *
 * <p>Thread safety: this class is thread-safe. The lock table is a
 * {@link ConcurrentHashMap} updated with atomic compare operations.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryLockStore implements LockStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(InMemoryLockStore.class);

  /** The owning session id per lock key. */
  private final Map<Long, Long> owners = new ConcurrentHashMap<>();

  /** The sequence of session ids. */
  private final AtomicLong sessionIds = new AtomicLong();

  /** {@inheritDoc} */
  @Override
  public LockSession openSession() {
    final long id = sessionIds.incrementAndGet();
    log.debug("Opened in-memory lock session {}", id);
    return new Session(id);
  }

  /**
   * Returns whether any session currently holds the given lock.
   *
   * @param identifier the lock, never null
   *
   * @return {@code true} if the lock is held
   */
  public boolean isHeld(final LockIdentifier identifier) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    return owners.containsKey(identifier.key());
  }

  /** A session on the in-memory lock table. */
  private final class Session implements LockSession {

    /** The id of this session. */
    private final long id;

    /** Whether this session was closed. */
    private volatile boolean closed = false;

    /** Creates a new session.
     *
     * @param theId the session id
     */
    private Session(final long theId) {
      id = theId;
    }

    @Override
    public boolean tryAcquire(final LockIdentifier identifier,
        final Duration timeout) {
      Objects.requireNonNull(identifier, "identifier cannot be null");
      checkOpen();
      final Long owner = owners.putIfAbsent(identifier.key(), id);
      return owner == null || owner == id;
    }

    @Override
    public boolean release(final LockIdentifier identifier,
        final Duration timeout) {
      Objects.requireNonNull(identifier, "identifier cannot be null");
      checkOpen();
      return owners.remove(identifier.key(), id);
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        owners.values().removeIf(owner -> owner == id);
        log.debug("Closed in-memory lock session {}", id);
      }
    }

    /** Fails if this session was closed. */
    private void checkOpen() {
      if (closed) {
        throw new LockSessionLostException("Lock session " + id
            + " is closed");
      }
    }
  }
}
