package org.waabox.primus.leader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.primus.lock.LockIdentifier;

/**
 * Keeps one election per lock purpose of the host application.
 *
 * <p>Each registered election is paired with the listener driving its
 * duty. Elections are keyed by {@link LockIdentifier#key()}: two
 * identifiers with the same key name the same lock. {@link #startAll()}
 * starts them in registration order and {@link #stopAll()} stops them in
 * reverse order.
 *
 * <p>Thread safety: registration is expected to happen during startup,
 * before {@link #startAll()}; queries are safe from any thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LeaderElectorRegistry {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LeaderElectorRegistry.class);

  /** The registered elections, keyed by lock key. */
  private final Map<Long, Registration> registrations =
      Collections.synchronizedMap(new LinkedHashMap<>());

  /**
   * Registers an election for the given lock.
   *
   * @param identifier the lock the election competes for, never null
   * @param election the election strategy, never null
   * @param listener the listener given to the election on start, never
   *                 null
   *
   * @throws IllegalArgumentException if an election is already registered
   *                                  for a lock with the same key
   */
  public void register(final LockIdentifier identifier,
      final LeaderElectionStrategy election,
      final LeadershipListener listener) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    Objects.requireNonNull(election, "election cannot be null");
    Objects.requireNonNull(listener, "listener cannot be null");

    synchronized (registrations) {
      final Registration existing = registrations.get(identifier.key());
      if (existing != null) {
        throw new IllegalArgumentException("Lock key " + identifier.key()
            + " is already registered for " + existing.identifier);
      }
      registrations.put(identifier.key(),
          new Registration(identifier, election, listener));
    }
  }

  /** Starts every registered election, in registration order. */
  public void startAll() {
    for (final Registration registration : snapshot()) {
      log.debug("Starting election for {}", registration.identifier);
      registration.election.start(registration.listener);
    }
    log.info("Started {} leader election(s)", registrations.size());
  }

  /**
   * Stops every registered election, in reverse registration order.
   *
   * <p>A failure to stop one election is logged and does not prevent the
   * others from being stopped.
   */
  public void stopAll() {
    final List<Registration> entries = snapshot();
    Collections.reverse(entries);
    for (final Registration registration : entries) {
      try {
        registration.election.stop();
      } catch (final RuntimeException e) {
        log.error("Error stopping election for {}", registration.identifier,
            e);
      }
    }
    log.info("Stopped {} leader election(s)", entries.size());
  }

  /**
   * Returns whether this node leads the given lock.
   *
   * @param identifier the lock, never null; matched by its key only
   *
   * @return {@code true} if an election is registered for the lock and
   *         this node is its leader
   */
  public boolean isLeader(final LockIdentifier identifier) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    final Registration registration = registrations.get(identifier.key());
    return registration != null && registration.election.isLeader();
  }

  /**
   * Returns the identifiers of all registered elections.
   *
   * @return the identifiers in registration order, never null
   */
  public List<LockIdentifier> identifiers() {
    final List<LockIdentifier> identifiers = new ArrayList<>();
    for (final Registration registration : snapshot()) {
      identifiers.add(registration.identifier);
    }
    return List.copyOf(identifiers);
  }

  /**
   * Copies the registrations.
   *
   * @return a mutable copy of the registrations, never null
   */
  private List<Registration> snapshot() {
    synchronized (registrations) {
      return new ArrayList<>(registrations.values());
    }
  }

  /** An election paired with its lock and listener. */
  private static final class Registration {

    /** The lock the election competes for. */
    private final LockIdentifier identifier;

    /** The election strategy. */
    private final LeaderElectionStrategy election;

    /** The listener driving the duty. */
    private final LeadershipListener listener;

    /**
     * Creates a registration.
     *
     * @param theIdentifier the lock
     * @param theElection the election
     * @param theListener the listener
     */
    private Registration(final LockIdentifier theIdentifier,
        final LeaderElectionStrategy theElection,
        final LeadershipListener theListener) {
      identifier = theIdentifier;
      election = theElection;
      listener = theListener;
    }
  }
}
