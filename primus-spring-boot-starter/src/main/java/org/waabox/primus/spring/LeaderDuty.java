package org.waabox.primus.spring;

import java.util.Objects;

import org.waabox.primus.leader.LeadershipListener;
import org.waabox.primus.lock.LockIdentifier;

/**
 * A singleton duty that must run on exactly one instance of the fleet.
 *
 * <p>Declare implementations as Spring beans. Each duty gets its own
 * election on {@link #lockIdentifier()}; it is told through the
 * {@link LeadershipListener} callbacks when to start and stop its work.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * LeaderDuty jobsSchedulerDuty(JobsScheduler scheduler) {
 *     return LeaderDuty.of(LockPurpose.JOBS_SCHEDULER.identifier(),
 *         scheduler::start, scheduler::stop);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LeaderDuty extends LeadershipListener {

  /**
   * Returns the lock this duty elects its leader on.
   *
   * @return the lock identifier, never null
   */
  LockIdentifier lockIdentifier();

  /**
   * Creates a duty from its lock and two callbacks.
   *
   * @param identifier the lock, never null
   * @param onBecomeLeader run when this instance becomes the leader,
   *                       never null
   * @param onLoseLeadership run when this instance loses leadership,
   *                         never null
   *
   * @return a new duty, never null
   */
  static LeaderDuty of(final LockIdentifier identifier,
      final Runnable onBecomeLeader, final Runnable onLoseLeadership) {
    Objects.requireNonNull(identifier, "identifier cannot be null");
    final LeadershipListener listener =
        LeadershipListener.of(onBecomeLeader, onLoseLeadership);
    return new LeaderDuty() {
      @Override
      public LockIdentifier lockIdentifier() {
        return identifier;
      }

      @Override
      public void onBecomeLeader() {
        listener.onBecomeLeader();
      }

      @Override
      public void onLoseLeadership() {
        listener.onLoseLeadership();
      }
    };
  }
}
