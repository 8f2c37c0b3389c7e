package io.intellixity.semgate.server.config;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.semgate.error.ConfigurationException;

/** Pool behind the JDBC registry store; empty when the registry lives in memory. */
public final class RegistryDataSource implements AutoCloseable {
  private final HikariDataSource dataSource;

  RegistryDataSource(HikariDataSource dataSource) {
    this.dataSource = dataSource;
  }

  static RegistryDataSource none() {
    return new RegistryDataSource(null);
  }

  public boolean present() { return dataSource != null; }

  public HikariDataSource require() {
    if (dataSource == null) throw new ConfigurationException("Registry has no JDBC data source");
    return dataSource;
  }

  @Override
  public void close() {
    if (dataSource != null) dataSource.close();
  }
}
