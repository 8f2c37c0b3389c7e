package io.intellixity.semgate.governance.handler;

import io.intellixity.semgate.governance.audit.AuditLog;
import io.intellixity.semgate.governance.catalog.CatalogIndex;
import io.intellixity.semgate.governance.orchestrator.QueryOrchestrator;
import io.intellixity.semgate.governance.policy.PolicyEnforcer;
import io.intellixity.semgate.governance.policy.PolicySettings;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.GovernanceCatalog;
import io.intellixity.semgate.registry.RegistrySettings;
import io.intellixity.semgate.spi.EngineEndpoint;
import io.intellixity.semgate.spi.SemanticEngineClient;
import io.intellixity.semgate.spi.SemanticEngineClientFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires catalog, policy and orchestrator for a database from its registry row.\n
 *
 * The engine endpoint uses the database's API URL and secret, falling back to the global ones.\n
 */
public final class DefaultDatabaseHandlerFactory implements DatabaseHandlerFactory {
  private final RegistrySettings settings;
  private final GovernanceCatalog governance;
  private final SemanticEngineClientFactory clients;
  private final AuditLog audit;
  private final Clock clock;

  public DefaultDatabaseHandlerFactory(RegistrySettings settings,
                                       GovernanceCatalog governance,
                                       SemanticEngineClientFactory clients,
                                       AuditLog audit,
                                       Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.governance = Objects.requireNonNull(governance, "governance");
    this.clients = Objects.requireNonNull(clients, "clients");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public DatabaseHandler create(DatabaseConfig db) {
    SemanticEngineClient engine = clients.create(endpoint(db));
    CatalogIndex catalog = new CatalogIndex(db.id(), engine,
        () -> governance.read(db.id(), db.tenantId()), settings.defaultSegments());
    PolicyEnforcer policy = new PolicyEnforcer(catalog, PolicySettings.forDatabase(settings, db));
    QueryOrchestrator orchestrator = new QueryOrchestrator(db.id(), policy, engine, audit, clock);
    return new DatabaseHandler(db, catalog, policy, orchestrator, audit);
  }

  EngineEndpoint endpoint(DatabaseConfig db) {
    String url = db.cubeApiUrl() != null && !db.cubeApiUrl().isBlank() ? db.cubeApiUrl() : settings.globalApiUrl();
    String secret = db.jwtSecret() != null && !db.jwtSecret().isBlank() ? db.jwtSecret() : settings.globalJwtSecret();
    return new EngineEndpoint(db.id(), url, secret);
  }
}
