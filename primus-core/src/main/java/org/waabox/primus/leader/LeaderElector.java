package org.waabox.primus.leader;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.primus.lock.LockIdentifier;
import org.waabox.primus.lock.LockSession;
import org.waabox.primus.lock.LockSessionLostException;
import org.waabox.primus.lock.LockStore;

/**
 * Leader election strategy backed by a non-blocking lock of a shared
 * {@link LockStore}.
 *
 * <p>Every instance competing for the same {@link LockIdentifier} runs one
 * elector. Each elector polls the store on a fixed interval, asking for the
 * lock without waiting for it; the instance whose session holds the lock is
 * the leader. The first poll runs as soon as {@link #start} is called.
 *
 * <p>One store session is opened on the first poll and pinned for the
 * life of the elector, so acquire and release always travel on the same
 * store connection. The session is only replaced once the store reports it
 * lost; the locks it held are gone with it, so a leader steps down at that
 * point.
 *
 * <p>Error handling: a failed poll leaves the leadership flag and the
 * pinned session untouched, and the loop keeps running. A failed release
 * on {@link #stop()} is logged and the flag is cleared anyway.
 *
 * <p>Misuse is rejected with {@link IllegalStateException}: starting twice,
 * starting after stop, and calling {@link #tryAcquireOnce()} once the
 * elector left the {@link ElectorState#IDLE} state.
 *
 * <p>Usage:
 * <pre>{@code
 * LeaderElector elector = new LeaderElector(
 *     LockPurpose.JOBS_SCHEDULER.identifier(), lockStore);
 * elector.start(LeadershipListener.of(scheduler::start, scheduler::stop));
 * ...
 * elector.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LeaderElector implements LeaderElectionStrategy {

  /** The logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(LeaderElector.class);

  /** The outcome of one poll attempt. */
  private enum Transition {
    /** The lock was just acquired. */
    ACQUIRED,
    /** The lock was just lost. */
    LOST,
    /** Same outcome as the previous poll, or no outcome at all. */
    UNCHANGED
  }

  /** The lock this elector competes for. */
  private final LockIdentifier identifier;

  /** The store holding the lock. */
  private final LockStore store;

  /** The elector configuration. */
  private final LeaderElectorConfig config;

  /** Guards {@link #leader}. */
  private final ReentrantReadWriteLock flagLock =
      new ReentrantReadWriteLock();

  /** Whether this node holds the lock, guarded by {@link #flagLock}. */
  private boolean leader = false;

  /** Guards {@link #session}. */
  private final Object sessionMonitor = new Object();

  /** The pinned store session, null until the first poll. */
  private LockSession session;

  /** One of IDLE, POLLING or STOPPED; LEADER is derived from the flag. */
  private volatile ElectorState lifecycle = ElectorState.IDLE;

  /** Set once stop begins; no poll may write the flag afterwards. */
  private volatile boolean stopping = false;

  /** The listener given to start. */
  private volatile LeadershipListener listener;

  /** The scheduler running the election loop. */
  private ScheduledExecutorService scheduler;

  /**
   * Creates a new elector with the default configuration.
   *
   * @param theIdentifier the lock to compete for, never null
   * @param theStore the store holding the lock, never null
   */
  public LeaderElector(final LockIdentifier theIdentifier,
      final LockStore theStore) {
    this(theIdentifier, theStore, LeaderElectorConfig.create());
  }

  /**
   * Creates a new elector.
   *
   * @param theIdentifier the lock to compete for, never null
   * @param theStore the store holding the lock, never null
   * @param theConfig the elector configuration, never null
   */
  public LeaderElector(final LockIdentifier theIdentifier,
      final LockStore theStore, final LeaderElectorConfig theConfig) {
    identifier = Objects.requireNonNull(theIdentifier,
        "identifier cannot be null");
    store = Objects.requireNonNull(theStore, "store cannot be null");
    config = Objects.requireNonNull(theConfig, "config cannot be null");
  }

  /**
   * Starts the election loop.
   *
   * <p>The first poll runs immediately on the election thread, the
   * following ones every {@link LeaderElectorConfig#pollInterval()}.
   *
   * @param theListener the listener to notify on every leadership edge,
   *                    never null
   *
   * @throws IllegalStateException if the elector was already started or
   *                               was stopped
   */
  @Override
  public synchronized void start(final LeadershipListener theListener) {
    Objects.requireNonNull(theListener, "listener cannot be null");
    if (lifecycle != ElectorState.IDLE) {
      throw new IllegalStateException("Elector for " + identifier
          + " cannot start, it is " + lifecycle);
    }
    listener = theListener;
    lifecycle = ElectorState.POLLING;

    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "primus-election-"
          + identifier.name().replace(' ', '-'));
      thread.setDaemon(true);
      return thread;
    });

    final long intervalMillis = config.pollInterval().toMillis();
    scheduler.scheduleAtFixedRate(this::poll, 0, intervalMillis,
        TimeUnit.MILLISECONDS);

    log.info("Leader election for {} started, polling every {} ms",
        identifier, intervalMillis);
  }

  /** {@inheritDoc} */
  @Override
  public boolean isLeader() {
    flagLock.readLock().lock();
    try {
      return leader;
    } finally {
      flagLock.readLock().unlock();
    }
  }

  /**
   * Performs a single poll against the store, without a background loop.
   *
   * <p>The outcome updates the same leadership flag the loop would update,
   * but no listener is notified. A lock acquired here is held by the pinned
   * session until {@link #stop()} is called.
   *
   * @return whether this node is the leader after the attempt; on a store
   *         error, the value it had before; false once the store reports
   *         the session lost
   *
   * @throws IllegalStateException if the elector is not idle
   */
  public synchronized boolean tryAcquireOnce() {
    if (lifecycle != ElectorState.IDLE) {
      throw new IllegalStateException("Elector for " + identifier
          + " cannot run a one-shot attempt, it is " + lifecycle);
    }
    attempt();
    return isLeader();
  }

  /**
   * Stops the election.
   *
   * <p>Cancels the loop and waits for an in-flight poll to finish. If this
   * node was the leader, the lock is released on the pinned session. The
   * session is then closed. Calling stop more than once has no effect.
   *
   * <p>Must not be called from a {@link LeadershipListener} callback: the
   * wait for the loop would then last the whole shutdown timeout.
   */
  @Override
  public void stop() {
    final ScheduledExecutorService executor;
    synchronized (this) {
      if (lifecycle == ElectorState.STOPPED) {
        return;
      }
      lifecycle = ElectorState.STOPPED;
      stopping = true;
      executor = scheduler;
    }

    if (executor != null) {
      awaitLoopExit(executor);
    }

    final boolean wasLeader;
    flagLock.writeLock().lock();
    try {
      wasLeader = leader;
      leader = false;
    } finally {
      flagLock.writeLock().unlock();
    }

    synchronized (sessionMonitor) {
      if (session != null) {
        if (wasLeader) {
          release(session);
        }
        closeSession(session);
        session = null;
      }
    }
    log.info("Leader election for {} stopped", identifier);
  }

  /**
   * Returns the current state of this elector.
   *
   * @return the state, never null
   */
  public ElectorState state() {
    final ElectorState current = lifecycle;
    if (current == ElectorState.POLLING && isLeader()) {
      return ElectorState.LEADER;
    }
    return current;
  }

  /**
   * Returns the lock this elector competes for.
   *
   * @return the lock identifier, never null
   */
  public LockIdentifier lockIdentifier() {
    return identifier;
  }

  /**
   * One tick of the election loop.
   *
   * <p>Nothing may escape this method: an exception thrown out of a
   * periodic task silently cancels all its following runs.
   */
  private void poll() {
    try {
      final Transition transition = attempt();
      if (transition != Transition.UNCHANGED) {
        notifyListener(transition);
      }
    } catch (final Throwable e) {
      log.error("Unexpected failure in the election loop of {}", identifier,
          e);
    }
  }

  /**
   * Notifies the listener of a leadership edge, logging failures.
   *
   * @param transition the edge, either ACQUIRED or LOST
   */
  private void notifyListener(final Transition transition) {
    final LeadershipListener target = listener;
    try {
      if (transition == Transition.ACQUIRED) {
        target.onBecomeLeader();
      } else {
        target.onLoseLeadership();
      }
    } catch (final Exception e) {
      log.error("Error notifying leadership change of {}", identifier, e);
    }
  }

  /**
   * Asks the store for the lock and records the outcome.
   *
   * @return the transition caused by the outcome, never null
   */
  private Transition attempt() {
    final boolean granted;
    try {
      granted = acquireOnPinnedSession();
    } catch (final LockSessionLostException e) {
      log.warn("Store session for {} was lost", identifier, e);
      discardSession();
      return recordOwnership(false);
    } catch (final RuntimeException e) {
      log.warn("Lock poll for {} failed, keeping leader={}", identifier,
          isLeader(), e);
      return Transition.UNCHANGED;
    }

    log.debug("Lock poll for {}: granted={}", identifier, granted);
    return recordOwnership(granted);
  }

  /**
   * Records a definite ownership outcome in the leadership flag.
   *
   * @param granted whether this node holds the lock
   *
   * @return the transition caused by the outcome, never null
   */
  private Transition recordOwnership(final boolean granted) {
    final boolean previous;
    flagLock.writeLock().lock();
    try {
      if (stopping) {
        return Transition.UNCHANGED;
      }
      previous = leader;
      leader = granted;
    } finally {
      flagLock.writeLock().unlock();
    }

    if (granted && !previous) {
      log.info("This node is now the leader for {}", identifier);
      return Transition.ACQUIRED;
    }
    if (!granted && previous) {
      log.info("This node lost leadership for {}", identifier);
      return Transition.LOST;
    }
    return Transition.UNCHANGED;
  }

  /**
   * Runs a non-blocking acquire on the pinned session, opening the session
   * on first use.
   *
   * @return whether the session holds the lock
   */
  private boolean acquireOnPinnedSession() {
    synchronized (sessionMonitor) {
      if (session == null) {
        session = store.openSession();
        log.debug("Pinned a new store session for {}", identifier);
      }
      return session.tryAcquire(identifier, config.operationTimeout());
    }
  }

  /** Closes and forgets the pinned session once it is known to be lost. */
  private void discardSession() {
    synchronized (sessionMonitor) {
      if (session != null) {
        closeSession(session);
        session = null;
      }
    }
  }

  /**
   * Releases the lock on the given session, logging failures.
   *
   * @param target the session holding the lock, never null
   */
  private void release(final LockSession target) {
    try {
      if (!target.release(identifier, config.operationTimeout())) {
        log.warn("Lock {} was not held by this node on release",
            identifier);
      }
    } catch (final RuntimeException e) {
      log.warn("Failed to release lock {}", identifier, e);
    }
  }

  /**
   * Closes the given session, logging failures.
   *
   * @param target the session to close, never null
   */
  private void closeSession(final LockSession target) {
    try {
      target.close();
    } catch (final RuntimeException e) {
      log.warn("Failed to close store session for {}", identifier, e);
    }
  }

  /**
   * Shuts the loop down and waits for an in-flight poll to complete.
   *
   * @param executor the loop scheduler, never null
   */
  private void awaitLoopExit(final ScheduledExecutorService executor) {
    final Duration wait = config.operationTimeout().multipliedBy(2);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(wait.toMillis(),
          TimeUnit.MILLISECONDS)) {
        log.warn("Election loop for {} did not exit within {}",
            identifier, wait);
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
