package io.intellixity.semgate.governance.audit;

import io.intellixity.semgate.governance.GovernanceContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One audit record.\n
 *
 * {@code fields} holds event-specific attributes (query_hash, row_count, duration_ms, error, ...) in insertion
 * order. Null values are dropped.
 */
public record AuditEvent(String event, String result, String databaseId, String tenantId, String userId,
                         Map<String, Object> fields) {
  public static final String QUERY_EXECUTE = "query.execute";
  public static final String CATALOG_SEARCH = "catalog.search";
  public static final String CATALOG_DESCRIBE = "catalog.describe";
  public static final String ERROR = "error";

  public static final String SUCCESS = "success";
  public static final String FAILURE = "error";

  public AuditEvent {
    Objects.requireNonNull(event, "event");
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static AuditEvent of(String event, String result, String databaseId, GovernanceContext ctx) {
    return new AuditEvent(event, result, databaseId,
        ctx == null ? null : ctx.tenantId(),
        ctx == null ? null : ctx.userId(),
        Map.of());
  }

  public AuditEvent with(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value == null) return this;
    Map<String, Object> next = new LinkedHashMap<>(fields);
    next.put(key, value);
    return new AuditEvent(event, result, databaseId, tenantId, userId, next);
  }

  /** Flat view used for rendering: identity first, then the event fields. */
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("event", event);
    if (result != null) out.put("result", result);
    if (databaseId != null) out.put("databaseId", databaseId);
    if (tenantId != null) out.put("tenantId", tenantId);
    if (userId != null) out.put("userId", userId);
    out.putAll(fields);
    return out;
  }
}
