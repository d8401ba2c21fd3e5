package org.waabox.primus.leader;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A leader election strategy for single-node deployments.
 *
 * <p>This implementation always considers the current node as the leader
 * once started. It is the strategy used when distributed leader election
 * is not enabled, which is typical for development environments or
 * single-instance production deployments.
 *
 * <p>On {@link #start(LeadershipListener)}, the listener is notified with
 * {@link LeadershipListener#onBecomeLeader()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SingleNodeLeaderElection implements LeaderElectionStrategy {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SingleNodeLeaderElection.class);

  /** The name of the duty, used for logging. */
  private final String name;

  /** Whether start was called. */
  private boolean started = false;

  /** Whether this node leads, volatile for cross-thread visibility. */
  private volatile boolean leader = false;

  /**
   * Creates a single-node election.
   *
   * @param theName the name of the duty, never null
   */
  public SingleNodeLeaderElection(final String theName) {
    name = Objects.requireNonNull(theName, "name cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void start(final LeadershipListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    if (started) {
      throw new IllegalStateException(
          "Election for '" + name + "' was already started");
    }
    started = true;
    leader = true;
    log.info("Single node election for '{}': this node is the leader", name);
    try {
      listener.onBecomeLeader();
    } catch (final Exception e) {
      log.error("Error notifying leadership of '{}'", name, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean isLeader() {
    return leader;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void stop() {
    // Nothing to release in a single-node deployment.
    started = true;
    leader = false;
  }
}
