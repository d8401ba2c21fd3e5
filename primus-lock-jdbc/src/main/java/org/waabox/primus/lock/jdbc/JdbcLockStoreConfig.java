package org.waabox.primus.lock.jdbc;

import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC advisory lock store.
 *
 * <p>Holds the {@link DataSource} sessions are borrowed from, and the two
 * statements used to acquire and release a lock. Each statement takes the
 * 64-bit lock key as its only parameter and returns a single boolean
 * column.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and
 * {@link #create(DataSource, String, String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcLockStoreConfig {

  /** Default acquire statement, PostgreSQL session advisory lock. */
  private static final String DEFAULT_ACQUIRE_SQL =
      "SELECT pg_try_advisory_lock(?)";

  /** Default release statement, PostgreSQL session advisory unlock. */
  private static final String DEFAULT_RELEASE_SQL =
      "SELECT pg_advisory_unlock(?)";

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The acquire statement, never null. */
  private final String acquireSql;

  /** The release statement, never null. */
  private final String releaseSql;

  /** Private constructor; use static factories.
   *
   * @param theDataSource the JDBC data source
   * @param theAcquireSql the acquire statement
   * @param theReleaseSql the release statement
   */
  private JdbcLockStoreConfig(final DataSource theDataSource,
      final String theAcquireSql, final String theReleaseSql) {
    dataSource = theDataSource;
    acquireSql = theAcquireSql;
    releaseSql = theReleaseSql;
  }

  /**
   * Creates a configuration with custom statements.
   *
   * @param dataSource the JDBC data source, never null
   * @param acquireSql the non-blocking acquire statement, never null or
   *                   blank
   * @param releaseSql the release statement, never null or blank
   *
   * @return a new configuration instance, never null
   */
  public static JdbcLockStoreConfig create(final DataSource dataSource,
      final String acquireSql, final String releaseSql) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(acquireSql, "acquireSql cannot be null");
    Objects.requireNonNull(releaseSql, "releaseSql cannot be null");

    if (acquireSql.isBlank()) {
      throw new IllegalArgumentException("acquireSql cannot be blank");
    }
    if (releaseSql.isBlank()) {
      throw new IllegalArgumentException("releaseSql cannot be blank");
    }

    return new JdbcLockStoreConfig(dataSource, acquireSql, releaseSql);
  }

  /**
   * Creates a configuration using PostgreSQL session advisory locks.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Acquire: {@code SELECT pg_try_advisory_lock(?)}</li>
   *   <li>Release: {@code SELECT pg_advisory_unlock(?)}</li>
   * </ul>
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcLockStoreConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_ACQUIRE_SQL, DEFAULT_RELEASE_SQL);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the acquire statement.
   *
   * @return the acquire SQL, never null
   */
  public String acquireSql() {
    return acquireSql;
  }

  /**
   * Returns the release statement.
   *
   * @return the release SQL, never null
   */
  public String releaseSql() {
    return releaseSql;
  }
}
