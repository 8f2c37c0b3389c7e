package io.intellixity.semgate.governance.orchestrator;

import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.GatewayException;
import io.intellixity.semgate.governance.Governance;
import io.intellixity.semgate.governance.GovernanceContext;
import io.intellixity.semgate.governance.audit.AuditEvent;
import io.intellixity.semgate.governance.audit.AuditLog;
import io.intellixity.semgate.governance.policy.NormalizedQuery;
import io.intellixity.semgate.governance.policy.PolicyEnforcer;
import io.intellixity.semgate.query.Lineage;
import io.intellixity.semgate.query.QueryHashes;
import io.intellixity.semgate.query.QueryResult;
import io.intellixity.semgate.query.SchemaField;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.spi.LoadResponse;
import io.intellixity.semgate.spi.SemanticEngineClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one governed query: hash, validate, apply defaults, execute, optional SQL preview, assemble, audit.
 * <p>
 * Holds no state between calls. Every attempt produces exactly one {@code query.execute} audit record. The engine
 * call is not retried here; only a failed SQL preview is tolerated.
 */
public final class QueryOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

  private final String databaseId;
  private final PolicyEnforcer policy;
  private final SemanticEngineClient engine;
  private final AuditLog audit;
  private final Clock clock;

  public QueryOrchestrator(String databaseId, PolicyEnforcer policy, SemanticEngineClient engine, AuditLog audit, Clock clock) {
    this.databaseId = Objects.requireNonNull(databaseId, "databaseId");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public QueryResult execute(SemanticQuery query) {
    Objects.requireNonNull(query, "query");
    long started = clock.millis();
    String hash = QueryHashes.hash(query);
    log.info("Executing semantic query {} on {}", hash, databaseId);

    NormalizedQuery normalized;
    LoadResponse response;
    try {
      policy.validate(query);
      normalized = policy.applyDefaults(query);
      response = engine.load(normalized.query());
    } catch (RuntimeException e) {
      auditFailure(hash, started, e);
      throw e;
    }

    String sql = null;
    if (policy.shouldReturnSql()) {
      try {
        sql = engine.sql(normalized.query()).sql();
      } catch (RuntimeException e) {
        log.warn("SQL preview failed for query {} on {}", hash, databaseId, e);
      }
    }

    SemanticQuery sent = normalized.query();
    Lineage lineage = Lineage.of(sent);
    QueryResult result = new QueryResult(response.data(), schema(response.annotation()), sent, lineage,
        normalized.notes(), new QueryResult.Debug(sql, sent, hash));

    long duration = clock.millis() - started;
    audit.record(event(AuditEvent.SUCCESS)
        .with("query_hash", hash)
        .with("row_count", result.rowCount())
        .with("duration_ms", duration)
        .with("members", lineage.members()));
    log.info("Query {} on {} returned {} rows in {} ms", hash, databaseId, result.rowCount(), duration);
    return result;
  }

  private void auditFailure(String hash, long started, RuntimeException e) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", e instanceof GatewayException g ? g.code().name() : ErrorCode.INTERNAL_ERROR.name());
    error.put("message", String.valueOf(e.getMessage()));
    audit.record(event(AuditEvent.FAILURE)
        .with("query_hash", hash)
        .with("duration_ms", clock.millis() - started)
        .with("error", error));
  }

  private AuditEvent event(String result) {
    GovernanceContext ctx = Governance.currentOrNull();
    return AuditEvent.of(AuditEvent.QUERY_EXECUTE, result, databaseId, ctx).with("tool", "query_semantic");
  }

  /** Measures, then dimensions, then time dimensions, each in the engine's order. */
  static List<SchemaField> schema(LoadResponse.Annotation annotation) {
    List<SchemaField> out = new ArrayList<>();
    addFields(out, annotation.measures());
    addFields(out, annotation.dimensions());
    addFields(out, annotation.timeDimensions());
    return out;
  }

  private static void addFields(List<SchemaField> out, Map<String, LoadResponse.AnnotationEntry> entries) {
    entries.forEach((key, a) -> out.add(a == null
        ? new SchemaField(key, null, null, null, null)
        : new SchemaField(key, a.type(), a.title(), a.shortTitle(), a.meta())));
  }
}
