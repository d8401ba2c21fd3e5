package org.waabox.primus.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Primus, mapped from the {@code primus.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Currently supports:
 * <ul>
 *   <li>{@code primus.mode} - {@code single-node} (default),
 *       {@code lock} or {@code disabled}.</li>
 *   <li>{@code primus.poll-interval} - how often the lock is polled in
 *       {@code lock} mode, 5 seconds by default.</li>
 *   <li>{@code primus.operation-timeout} - the timeout of each lock store
 *       call, 5 seconds by default.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "primus")
public class PrimusProperties {

  /** The election mode. */
  private ElectionMode mode = ElectionMode.SINGLE_NODE;

  /** The lock poll interval. */
  private Duration pollInterval = Duration.ofSeconds(5);

  /** The lock store operation timeout. */
  private Duration operationTimeout = Duration.ofSeconds(5);

  /**
   * Returns the election mode.
   *
   * @return the mode, never null
   */
  public ElectionMode getMode() {
    return mode;
  }

  /**
   * Sets the election mode.
   *
   * @param mode the mode, never null
   */
  public void setMode(final ElectionMode mode) {
    this.mode = mode;
  }

  /**
   * Returns the lock poll interval.
   *
   * @return the poll interval, never null
   */
  public Duration getPollInterval() {
    return pollInterval;
  }

  /**
   * Sets the lock poll interval.
   *
   * @param pollInterval the poll interval, never null
   */
  public void setPollInterval(final Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  /**
   * Returns the lock store operation timeout.
   *
   * @return the operation timeout, never null
   */
  public Duration getOperationTimeout() {
    return operationTimeout;
  }

  /**
   * Sets the lock store operation timeout.
   *
   * @param operationTimeout the operation timeout, never null
   */
  public void setOperationTimeout(final Duration operationTimeout) {
    this.operationTimeout = operationTimeout;
  }
}
