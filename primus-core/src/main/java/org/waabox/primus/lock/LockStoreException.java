package org.waabox.primus.lock;

import org.waabox.primus.PrimusException;

/**
 * Raised when the backing store fails to answer a lock operation.
 *
 * <p>A failed operation carries no information about lock ownership: the
 * caller cannot tell whether the lock was granted or not.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LockStoreException extends PrimusException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public LockStoreException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public LockStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
