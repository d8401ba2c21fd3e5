package org.waabox.primus.spring;

/**
 * How this instance takes part in leader election.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ElectionMode {

  /** No election; this instance always runs every duty. */
  SINGLE_NODE,

  /** Distributed election through a shared lock store. */
  LOCK,

  /** This instance never runs any duty, e.g. worker-only instances. */
  DISABLED
}
