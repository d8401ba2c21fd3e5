package org.waabox.primus.leader;

/**
 * A strategy for electing a leader among a set of nodes.
 *
 * <p>The leader is the only node allowed to run a singleton duty, such as
 * a scheduler. Only one node in the cluster should be the leader at any
 * given time.
 *
 * <p>Implementations can use different mechanisms for leader election
 * (e.g. a database advisory lock, single-node always-leader).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LeaderElectionStrategy {

  /**
   * Starts the leader election process.
   *
   * <p>After this method returns, the node participates in leader
   * election and the listener is notified of leadership changes.
   *
   * @param listener the listener to notify, never null
   *
   * @throws IllegalStateException if the election was already started or
   *                               stopped
   */
  void start(LeadershipListener listener);

  /**
   * Returns whether this node is currently the leader.
   *
   * <p>The answer may be stale by up to one poll interval. Long running
   * leader-only work should check again while it runs.
   *
   * @return {@code true} if this node holds the leadership
   */
  boolean isLeader();

  /**
   * Stops the leader election process and releases all resources.
   *
   * <p>After this method returns, this node no longer participates in
   * leader election and {@link #isLeader()} returns {@code false}.
   */
  void stop();
}
