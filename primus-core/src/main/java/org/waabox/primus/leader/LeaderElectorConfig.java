package org.waabox.primus.leader;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the lock-based {@link LeaderElector}.
 *
 * <p>Holds the interval between two lock polls and the maximum time a
 * single store operation may take.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create()} and {@link #create(Duration, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LeaderElectorConfig {

  /** Default poll interval (5 seconds). */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofSeconds(5);

  /** Default store operation timeout (5 seconds). */
  private static final Duration DEFAULT_OPERATION_TIMEOUT =
      Duration.ofSeconds(5);

  /** The polling interval, never null. */
  private final Duration pollInterval;

  /** The store operation timeout, never null. */
  private final Duration operationTimeout;

  /** Private constructor; use static factories.
   *
   * @param thePollInterval the poll interval
   * @param theOperationTimeout the store operation timeout
   */
  private LeaderElectorConfig(final Duration thePollInterval,
      final Duration theOperationTimeout) {
    pollInterval = thePollInterval;
    operationTimeout = theOperationTimeout;
  }

  /**
   * Creates a configuration with custom values.
   *
   * @param pollInterval the polling interval, never null, must be positive
   * @param operationTimeout the timeout of each store operation, never
   *                         null, must be positive
   *
   * @return a new configuration instance, never null
   */
  public static LeaderElectorConfig create(final Duration pollInterval,
      final Duration operationTimeout) {
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
    Objects.requireNonNull(operationTimeout,
        "operationTimeout cannot be null");

    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + pollInterval);
    }
    if (operationTimeout.isZero() || operationTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "operationTimeout must be positive, got: " + operationTimeout);
    }
    return new LeaderElectorConfig(pollInterval, operationTimeout);
  }

  /**
   * Creates a configuration with default values.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Poll interval: 5 seconds</li>
   *   <li>Operation timeout: 5 seconds</li>
   * </ul>
   *
   * @return a new configuration instance, never null
   */
  public static LeaderElectorConfig create() {
    return new LeaderElectorConfig(DEFAULT_POLL_INTERVAL,
        DEFAULT_OPERATION_TIMEOUT);
  }

  /**
   * Returns the polling interval.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns the timeout applied to each store operation.
   *
   * @return the operation timeout, never null
   */
  public Duration operationTimeout() {
    return operationTimeout;
  }
}
