package org.waabox.primus.lock;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The catalog of singleton duties that elect a leader.
 *
 * <p>Each purpose owns a fixed key in the store lock namespace. Keys are
 * part of the fleet contract: changing one while older instances are still
 * running lets two instances lead the same duty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LockPurpose {

  /** The background jobs scheduler. */
  JOBS_SCHEDULER(0x5052494d00000001L, "jobs scheduler"),

  /** The edge functions cron scheduler. */
  FUNCTIONS_SCHEDULER(0x5052494d00000002L, "functions scheduler"),

  /** The RPC procedures cron scheduler. */
  RPC_SCHEDULER(0x5052494d00000003L, "rpc scheduler");

  static {
    final Map<Long, LockPurpose> byKey = new HashMap<>();
    for (final LockPurpose purpose : values()) {
      final LockPurpose clash = byKey.put(purpose.identifier.key(), purpose);
      if (clash != null) {
        throw new IllegalStateException("Lock key " + purpose.identifier.key()
            + " used by both " + clash + " and " + purpose);
      }
    }
  }

  /** The identifier of this purpose, never null. */
  private final LockIdentifier identifier;

  /** Creates a purpose.
   *
   * @param key the lock key
   * @param name the lock name
   */
  LockPurpose(final long key, final String name) {
    identifier = LockIdentifier.of(key, name);
  }

  /**
   * Returns the lock identifier of this purpose.
   *
   * @return the identifier, never null
   */
  public LockIdentifier identifier() {
    return identifier;
  }

  /**
   * Resolves a purpose by its enum name or its kebab-case form, for example
   * {@code JOBS_SCHEDULER} or {@code jobs-scheduler}.
   *
   * @param name the purpose name, never null
   *
   * @return the purpose, never null
   *
   * @throws IllegalArgumentException if no purpose has that name
   */
  public static LockPurpose fromName(final String name) {
    Objects.requireNonNull(name, "name cannot be null");
    final String normalized = name.trim().replace('-', '_')
        .toUpperCase(Locale.ROOT);
    for (final LockPurpose purpose : values()) {
      if (purpose.name().equals(normalized)) {
        return purpose;
      }
    }
    throw new IllegalArgumentException("Unknown lock purpose: " + name);
  }
}
