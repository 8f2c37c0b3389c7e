package io.intellixity.semgate.governance.handler;

import io.intellixity.semgate.governance.Governance;
import io.intellixity.semgate.governance.audit.AuditEvent;
import io.intellixity.semgate.governance.audit.AuditLog;
import io.intellixity.semgate.governance.catalog.CatalogIndex;
import io.intellixity.semgate.governance.catalog.CatalogSearch;
import io.intellixity.semgate.governance.catalog.MemberDescription;
import io.intellixity.semgate.governance.catalog.SearchHit;
import io.intellixity.semgate.governance.orchestrator.QueryOrchestrator;
import io.intellixity.semgate.governance.policy.PolicyEnforcer;
import io.intellixity.semgate.query.QueryResult;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.registry.DatabaseConfig;

import java.util.List;
import java.util.Objects;

/** The per-database bundle serving the three tools. Ready once its catalog is initialized. */
public final class DatabaseHandler {
  private final DatabaseConfig database;
  private final CatalogIndex catalog;
  private final PolicyEnforcer policy;
  private final QueryOrchestrator orchestrator;
  private final AuditLog audit;

  public DatabaseHandler(DatabaseConfig database,
                         CatalogIndex catalog,
                         PolicyEnforcer policy,
                         QueryOrchestrator orchestrator,
                         AuditLog audit) {
    this.database = Objects.requireNonNull(database, "database");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.audit = Objects.requireNonNull(audit, "audit");
  }

  public DatabaseConfig database() { return database; }
  public String databaseId() { return database.id(); }
  public CatalogIndex catalog() { return catalog; }
  public PolicyEnforcer policy() { return policy; }
  public QueryOrchestrator orchestrator() { return orchestrator; }

  public void initialize() {
    catalog.initialize();
  }

  public boolean isReady() {
    return catalog.isInitialized();
  }

  public List<SearchHit> catalogSearch(CatalogSearch request) {
    List<SearchHit> hits = catalog.search(request);
    audit.record(AuditEvent.of(AuditEvent.CATALOG_SEARCH, AuditEvent.SUCCESS, databaseId(), Governance.currentOrNull())
        .with("query", request.query())
        .with("result_count", hits.size()));
    return hits;
  }

  public MemberDescription catalogDescribe(String memberName) {
    MemberDescription d = catalog.describe(memberName);
    audit.record(AuditEvent.of(AuditEvent.CATALOG_DESCRIBE, AuditEvent.SUCCESS, databaseId(), Governance.currentOrNull())
        .with("member", memberName));
    return d;
  }

  public QueryResult querySemantic(SemanticQuery query) {
    return orchestrator.execute(query);
  }
}
