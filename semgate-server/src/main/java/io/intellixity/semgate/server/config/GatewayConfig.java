package io.intellixity.semgate.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.semgate.cube.CubeEngineClientFactory;
import io.intellixity.semgate.error.ConfigurationException;
import io.intellixity.semgate.governance.audit.AuditLog;
import io.intellixity.semgate.governance.audit.Slf4jAuditLog;
import io.intellixity.semgate.governance.handler.DatabaseHandlerCache;
import io.intellixity.semgate.governance.handler.DatabaseHandlerFactory;
import io.intellixity.semgate.governance.handler.DefaultDatabaseHandlerFactory;
import io.intellixity.semgate.registry.DatabaseRegistry;
import io.intellixity.semgate.registry.GovernanceCatalog;
import io.intellixity.semgate.registry.RegistrySettings;
import io.intellixity.semgate.registry.store.DatabaseStore;
import io.intellixity.semgate.registry.store.InMemoryDatabaseStore;
import io.intellixity.semgate.registry.store.JdbcDatabaseStore;
import io.intellixity.semgate.registry.store.RegistrySchema;
import io.intellixity.semgate.registry.tenant.InMemoryTenantStore;
import io.intellixity.semgate.registry.tenant.JdbcTenantStore;
import io.intellixity.semgate.registry.tenant.TenantRegistry;
import io.intellixity.semgate.registry.tenant.TenantStore;
import io.intellixity.semgate.spi.SemanticEngineClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the gateway from {@link GatewayProperties}.\n
 *
 * Every component is an explicit bean; nothing is looked up through static state.\n
 * The registry is backed either by memory or by a HikariCP pool over JDBC.\n
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {
  private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RegistrySettings registrySettings(GatewayProperties props) {
    RegistrySettings settings = props.toRegistrySettings();
    log.info("Gateway settings: {}", settings);
    return settings;
  }

  @Bean(destroyMethod = "close")
  public RegistryDataSource registryDataSource(GatewayProperties props) {
    GatewayProperties.Registry r = props.getRegistry();
    if (!"jdbc".equals(r.getStore())) return RegistryDataSource.none();
    if (r.getJdbcUrl() == null || r.getJdbcUrl().isBlank()) {
      throw new ConfigurationException("semgate.registry.jdbc-url is required when semgate.registry.store=jdbc");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("semgate-registry");
    hc.setJdbcUrl(r.getJdbcUrl());
    hc.setUsername(r.getUsername());
    hc.setPassword(r.getPassword());
    if (r.getSchema() != null && !r.getSchema().isBlank()) hc.setSchema(r.getSchema());
    hc.setMaximumPoolSize(r.getPoolSize());
    HikariDataSource ds = new HikariDataSource(hc);
    RegistrySchema.apply(ds);
    return new RegistryDataSource(ds);
  }

  @Bean
  public DatabaseStore databaseStore(GatewayProperties props, RegistryDataSource dataSource, ObjectMapper json) {
    String kind = props.getRegistry().getStore();
    switch (kind) {
      case "memory":
        return new InMemoryDatabaseStore();
      case "jdbc":
        return new JdbcDatabaseStore(new JdbcTemplate(dataSource.require()), json);
      default:
        throw new ConfigurationException("Unsupported semgate.registry.store: " + kind);
    }
  }

  @Bean
  public TenantStore tenantStore(GatewayProperties props, RegistryDataSource dataSource) {
    return "jdbc".equals(props.getRegistry().getStore())
        ? new JdbcTenantStore(new JdbcTemplate(dataSource.require()))
        : new InMemoryTenantStore();
  }

  @Bean
  public TenantRegistry tenantRegistry(TenantStore store, Clock clock) {
    return new TenantRegistry(store, clock);
  }

  @Bean
  public DatabaseRegistry databaseRegistry(DatabaseStore store, RegistrySettings settings, Clock clock) {
    return new DatabaseRegistry(store, settings, clock);
  }

  @Bean
  public GovernanceCatalog governanceCatalog(DatabaseRegistry registry) {
    return new GovernanceCatalog(registry);
  }

  @Bean
  public SemanticEngineClientFactory semanticEngineClientFactory(GatewayProperties props, ObjectMapper json, Clock clock) {
    return new CubeEngineClientFactory(props.toCubeClientSettings(), json, clock);
  }

  @Bean
  public AuditLog auditLog(ObjectMapper json) {
    return new Slf4jAuditLog(json);
  }

  @Bean
  public DatabaseHandlerFactory databaseHandlerFactory(RegistrySettings settings,
                                                       GovernanceCatalog governance,
                                                       SemanticEngineClientFactory clients,
                                                       AuditLog audit,
                                                       Clock clock) {
    return new DefaultDatabaseHandlerFactory(settings, governance, clients, audit, clock);
  }

  @Bean
  public DatabaseHandlerCache databaseHandlerCache(DatabaseRegistry registry,
                                                   DatabaseHandlerFactory factory,
                                                   GatewayProperties props,
                                                   Clock clock) {
    DatabaseHandlerCache cache = new DatabaseHandlerCache(registry, factory, props.toHandlerCacheSettings(), clock);
    registry.addListener(cache);
    return cache;
  }

  @Bean
  public ApplicationRunner bootstrapDefaultDatabase(GatewayProperties props, ObjectProvider<DatabaseRegistry> registry) {
    return args -> {
      if (!props.getRegistry().isBootstrapDefault()) return;
      String id = registry.getObject().initializeDefaultDatabase(null);
      log.info("Default database {} is ready", id);
    };
  }
}
