package io.intellixity.semgate.registry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One registered database.
 * <p>
 * {@code id} is the global storage key; {@code slug} is the tenant-facing name. {@code connection} is passed
 * through to the semantic engine untouched. {@code tenantId} is null in single-tenant mode.
 */
public record DatabaseConfig(String id,
                             String slug,
                             String tenantId,
                             String name,
                             String description,
                             DatabaseStatus status,
                             Map<String, Object> connection,
                             String cubeApiUrl,
                             String jwtSecret,
                             Integer maxLimit,
                             List<String> denyMembers,
                             List<String> defaultSegments,
                             boolean returnSql,
                             String lastError,
                             Instant createdAt,
                             Instant updatedAt) {
  public DatabaseConfig {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(slug, "slug");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(status, "status");
    connection = connection == null ? Map.of() : connection;
    denyMembers = denyMembers == null ? List.of() : List.copyOf(denyMembers);
    defaultSegments = defaultSegments == null ? List.of() : List.copyOf(defaultSegments);
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public boolean isActive() { return status == DatabaseStatus.ACTIVE; }

  /** True if this row is visible under the tenant predicate ({@code null} sees every row). */
  public boolean visibleTo(String tenant) {
    return tenant == null || tenant.equals(tenantId);
  }

  public DatabaseConfig withStatus(DatabaseStatus s, String error, Instant at) {
    return new DatabaseConfig(id, slug, tenantId, name, description, s, connection, cubeApiUrl, jwtSecret, maxLimit,
        denyMembers, defaultSegments, returnSql, error, createdAt, at);
  }

  /** Fields set in {@code patch} replace ours. */
  DatabaseConfig patched(DatabasePatch patch, String resolvedApiUrl, Instant at) {
    return new DatabaseConfig(
        id, slug, tenantId,
        patch.name() != null ? patch.name() : name,
        patch.description() != null ? patch.description() : description,
        status,
        patch.connection() != null ? patch.connection() : connection,
        resolvedApiUrl,
        patch.jwtSecret() != null ? patch.jwtSecret() : jwtSecret,
        patch.maxLimit() != null ? patch.maxLimit() : maxLimit,
        patch.denyMembers() != null ? patch.denyMembers() : denyMembers,
        patch.defaultSegments() != null ? patch.defaultSegments() : defaultSegments,
        patch.returnSql() != null ? patch.returnSql() : returnSql,
        lastError, createdAt, at);
  }

  @Override
  public String toString() {
    return "DatabaseConfig[id=" + id + ", slug=" + slug + ", tenantId=" + tenantId + ", status=" + status.wire() + "]";
  }
}
