package org.waabox.primus.lock;

/**
 * A backing store exposing session-scoped, non-blocking advisory locks.
 *
 * <p>Lock ownership belongs to a {@link LockSession}, never to the lock
 * key alone. Callers that acquire and later release a lock must do both
 * through the same session.
 *
 * <p>Implementations can use different mechanisms (e.g. database advisory
 * locks, an in-process table).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LockStore {

  /**
   * Opens a new session against the store.
   *
   * <p>The session stays bound to the same underlying store connection
   * until it is closed.
   *
   * @return a new open session, never null
   *
   * @throws LockStoreException if the store cannot be reached
   */
  LockSession openSession();
}
