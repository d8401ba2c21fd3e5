package org.waabox.primus.lock;

import java.util.Objects;

/**
 * Identifies a lock in the shared lock namespace of the backing store.
 *
 * <p>The key is what the store locks on; the name is only used for
 * logging. Two purposes must never share a key, which is why the host
 * application should take its identifiers from {@link LockPurpose}
 * instead of building them ad hoc.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LockIdentifier {

  /** The 64-bit key of the lock in the store. */
  private final long key;

  /** The human readable name, never null. */
  private final String name;

  /** Private constructor; use {@link #of(long, String)}.
   *
   * @param theKey the lock key
   * @param theName the lock name
   */
  private LockIdentifier(final long theKey, final String theName) {
    key = theKey;
    name = theName;
  }

  /**
   * Creates a new lock identifier.
   *
   * @param key the 64-bit key in the store lock namespace
   * @param name the human readable name, never null or blank
   *
   * @return a new identifier, never null
   *
   * @throws IllegalArgumentException if the name is blank
   */
  public static LockIdentifier of(final long key, final String name) {
    Objects.requireNonNull(name, "name cannot be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    return new LockIdentifier(key, name);
  }

  /**
   * Returns the key of the lock in the store namespace.
   *
   * @return the 64-bit lock key
   */
  public long key() {
    return key;
  }

  /**
   * Returns the human readable name of the lock.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LockIdentifier)) {
      return false;
    }
    final LockIdentifier that = (LockIdentifier) other;
    return key == that.key && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, name);
  }

  @Override
  public String toString() {
    return name + "(" + key + ")";
  }
}
