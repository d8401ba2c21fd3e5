package org.waabox.primus.leader;

import java.util.Objects;

/**
 * A listener that is notified when this node gains or loses leadership.
 *
 * <p>Notifications are edge-triggered: each method is called once per
 * transition, never once per observation. Both methods run on the
 * election thread, so they must return quickly; a slow callback delays
 * the next poll and with it the detection of a lost lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LeadershipListener {

  /** Called when this node has just become the leader. */
  void onBecomeLeader();

  /** Called when this node has just lost leadership. */
  void onLoseLeadership();

  /**
   * Creates a listener from two callbacks.
   *
   * @param onBecomeLeader run when this node becomes the leader, never null
   * @param onLoseLeadership run when this node loses leadership, never null
   *
   * @return a new listener, never null
   */
  static LeadershipListener of(final Runnable onBecomeLeader,
      final Runnable onLoseLeadership) {
    Objects.requireNonNull(onBecomeLeader, "onBecomeLeader cannot be null");
    Objects.requireNonNull(onLoseLeadership,
        "onLoseLeadership cannot be null");
    return new LeadershipListener() {
      @Override
      public void onBecomeLeader() {
        onBecomeLeader.run();
      }

      @Override
      public void onLoseLeadership() {
        onLoseLeadership.run();
      }
    };
  }
}
