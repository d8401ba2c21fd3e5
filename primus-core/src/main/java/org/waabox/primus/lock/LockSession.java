package org.waabox.primus.lock;

import java.time.Duration;

/**
 * A session against a {@link LockStore}, owning the locks it acquires.
 *
 * <p>Sessions are not thread-safe; a session is meant to be driven by a
 * single owner at a time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LockSession extends AutoCloseable {

  /**
   * Attempts to acquire the given lock without waiting for it to be freed.
   *
   * @param identifier the lock to acquire, never null
   * @param timeout the maximum time the store may take to answer, never
   *                null
   *
   * @return {@code true} if this session holds the lock after the call,
   *         including when it already held it before
   *
   * @throws LockSessionLostException if the session is gone, together with
   *                                  every lock it held
   * @throws LockStoreException if the store fails to answer
   */
  boolean tryAcquire(LockIdentifier identifier, Duration timeout);

  /**
   * Releases the given lock if this session holds it.
   *
   * @param identifier the lock to release, never null
   * @param timeout the maximum time the store may take to answer, never
   *                null
   *
   * @return {@code true} if the lock was held by this session and is now
   *         released, {@code false} if this session did not hold it
   *
   * @throws LockStoreException if the store fails to answer
   */
  boolean release(LockIdentifier identifier, Duration timeout);

  /**
   * Closes the session, dropping every lock it still holds.
   *
   * <p>Closing an already closed session has no effect.
   */
  @Override
  void close();
}
