package org.waabox.primus.spring;

import java.util.List;
import java.util.stream.Collectors;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.primus.leader.LeaderElectionStrategy;
import org.waabox.primus.leader.LeaderElector;
import org.waabox.primus.leader.LeaderElectorConfig;
import org.waabox.primus.leader.LeaderElectorRegistry;
import org.waabox.primus.leader.SingleNodeLeaderElection;
import org.waabox.primus.lock.LockIdentifier;
import org.waabox.primus.lock.LockStore;
import org.waabox.primus.lock.jdbc.JdbcAdvisoryLockStore;
import org.waabox.primus.lock.jdbc.JdbcLockStoreConfig;

/**
 * Spring Boot auto-configuration for Primus leader election.
 *
 * <p>This configuration creates a {@link LeaderElectorRegistry} holding
 * one election per {@link LeaderDuty} bean. The kind of election depends
 * on {@code primus.mode}:
 * <ul>
 *   <li>{@code single-node}: every duty leads as soon as it starts.</li>
 *   <li>{@code lock}: every duty gets a {@link LeaderElector} on the
 *       {@link LockStore} bean, or, without one, on a
 *       {@link JdbcAdvisoryLockStore} over the {@link DataSource} bean.</li>
 *   <li>{@code disabled}: no duty is registered, none ever runs here.</li>
 * </ul>
 *
 * <p>The elections are started and stopped through Spring's
 * {@link SmartLifecycle}, late on startup and early on shutdown, so duties
 * only run while the rest of the application is up.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(PrimusProperties.class)
public class PrimusAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PrimusAutoConfiguration.class);

  /**
   * Creates the registry of leader elections, one per duty.
   *
   * @param properties the configuration properties, never null
   * @param lockStoreProvider provider for an optional LockStore bean
   * @param dataSourceProvider provider for an optional DataSource bean
   * @param dutyProvider provider for the LeaderDuty beans
   *
   * @return the registry, never null
   *
   * @throws IllegalStateException in lock mode, when neither a LockStore
   *                               nor a DataSource bean is available
   */
  @Bean
  public LeaderElectorRegistry leaderElectorRegistry(
      final PrimusProperties properties,
      final ObjectProvider<LockStore> lockStoreProvider,
      final ObjectProvider<DataSource> dataSourceProvider,
      final ObjectProvider<LeaderDuty> dutyProvider) {

    requireAtMostOne(lockStoreProvider, LockStore.class);

    final List<LeaderDuty> duties = dutyProvider.orderedStream()
        .collect(Collectors.toList());
    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    final ElectionMode mode = properties.getMode();

    if (mode == ElectionMode.DISABLED) {
      log.info("Primus leader election disabled, {} duty(ies) will not"
          + " run on this instance", duties.size());
      return registry;
    }

    LockStore lockStore = null;
    LeaderElectorConfig config = null;
    if (mode == ElectionMode.LOCK) {
      lockStore = resolveLockStore(lockStoreProvider, dataSourceProvider);
      config = LeaderElectorConfig.create(properties.getPollInterval(),
          properties.getOperationTimeout());
    }

    for (final LeaderDuty duty : duties) {
      final LockIdentifier identifier = duty.lockIdentifier();
      final LeaderElectionStrategy election;
      if (mode == ElectionMode.LOCK) {
        election = new LeaderElector(identifier, lockStore, config);
      } else {
        election = new SingleNodeLeaderElection(identifier.name());
      }
      registry.register(identifier, election, duty);
      log.debug("Registered {} election for duty {}", mode, identifier);
    }

    log.info("Primus created in {} mode with {} duty(ies)", mode,
        duties.size());
    return registry;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops all the
   * leader elections.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 2}) to
   * ensure all other beans are initialized first, and stops early for the
   * same reason.
   *
   * @param registry the registry to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle primusLifecycle(final LeaderElectorRegistry registry) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Primus leader elections...");
        registry.startAll();
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping Primus leader elections...");
        registry.stopAll();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 2;
      }
    };
  }

  /**
   * Picks the lock store for lock mode.
   *
   * @param lockStoreProvider provider for an optional LockStore bean
   * @param dataSourceProvider provider for an optional DataSource bean
   *
   * @return the lock store, never null
   */
  private LockStore resolveLockStore(
      final ObjectProvider<LockStore> lockStoreProvider,
      final ObjectProvider<DataSource> dataSourceProvider) {

    final LockStore custom = lockStoreProvider.getIfAvailable();
    if (custom != null) {
      log.info("Primus using custom LockStore: {}",
          custom.getClass().getSimpleName());
      return custom;
    }

    final DataSource dataSource = dataSourceProvider.getIfAvailable();
    if (dataSource != null) {
      log.info("Primus using JDBC advisory locks");
      return new JdbcAdvisoryLockStore(JdbcLockStoreConfig.create(dataSource));
    }

    throw new IllegalStateException("Primus lock mode requires a LockStore"
        + " or a DataSource bean");
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Primus requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
