package org.waabox.primus.lock;

/**
 * Raised when a {@link LockSession} is known to be gone: it was closed, or
 * the store connection behind it died.
 *
 * <p>Unlike a plain {@link LockStoreException}, this failure does carry
 * ownership information: every lock the session held is lost.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LockSessionLostException extends LockStoreException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public LockSessionLostException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public LockSessionLostException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
