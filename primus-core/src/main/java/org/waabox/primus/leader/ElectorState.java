package org.waabox.primus.leader;

/**
 * The lifecycle states of a {@link LeaderElector}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ElectorState {

  /** Constructed, not started. */
  IDLE,

  /** Election loop running, this node does not hold the lock. */
  POLLING,

  /** Election loop running, this node holds the lock. */
  LEADER,

  /** Loop cancelled and lock released; terminal. */
  STOPPED
}
