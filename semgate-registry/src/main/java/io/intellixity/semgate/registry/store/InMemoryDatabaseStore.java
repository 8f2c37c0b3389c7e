package io.intellixity.semgate.registry.store;

import io.intellixity.semgate.error.ConflictException;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local store for self-hosted and test setups. */
public final class InMemoryDatabaseStore implements DatabaseStore {
  private final ConcurrentMap<String, DatabaseConfig> rows = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, GovernanceDocument> governance = new ConcurrentHashMap<>();

  @Override
  public Optional<DatabaseConfig> get(String id, String tenantId) {
    DatabaseConfig row = rows.get(id);
    return (row != null && row.visibleTo(tenantId)) ? Optional.of(row) : Optional.empty();
  }

  @Override
  public List<DatabaseConfig> list(String tenantId) {
    return rows.values().stream()
        .filter(r -> r.visibleTo(tenantId))
        .sorted(Comparator.comparing(DatabaseConfig::createdAt).thenComparing(DatabaseConfig::id))
        .toList();
  }

  @Override
  public List<DatabaseConfig> listByStatus(DatabaseStatus status, String tenantId) {
    return list(tenantId).stream().filter(r -> r.status() == status).toList();
  }

  @Override
  public boolean exists(String id, String tenantId) {
    return get(id, tenantId).isPresent();
  }

  @Override
  public boolean slugExists(String slug, String tenantId) {
    return rows.values().stream().anyMatch(r -> r.slug().equals(slug) && Objects.equals(r.tenantId(), tenantId));
  }

  @Override
  public void insert(DatabaseConfig database) {
    if (rows.putIfAbsent(database.id(), database) != null) {
      throw new ConflictException(ErrorCode.DATABASE_EXISTS, "Database '" + database.id() + "' already exists");
    }
  }

  @Override
  public Optional<DatabaseConfig> replace(DatabaseConfig database, boolean onlyIfInactive, String tenantId) {
    DatabaseConfig[] stored = {null};
    rows.computeIfPresent(database.id(), (k, cur) -> {
      if (!cur.visibleTo(tenantId) || (onlyIfInactive && cur.isActive())) return cur;
      stored[0] = database.withStatus(cur.status(), cur.lastError(), database.updatedAt());
      return stored[0];
    });
    return Optional.ofNullable(stored[0]);
  }

  @Override
  public boolean updateStatus(String id, DatabaseStatus status, String lastError, Instant at, String tenantId) {
    boolean[] hit = {false};
    rows.computeIfPresent(id, (k, cur) -> {
      if (!cur.visibleTo(tenantId)) return cur;
      hit[0] = true;
      return cur.withStatus(status, lastError, at);
    });
    return hit[0];
  }

  @Override
  public boolean delete(String id, String tenantId) {
    boolean[] hit = {false};
    rows.computeIfPresent(id, (k, cur) -> {
      if (!cur.visibleTo(tenantId) || cur.isActive()) return cur;
      hit[0] = true;
      return null;
    });
    if (hit[0]) governance.remove(id);
    return hit[0];
  }

  @Override
  public Optional<GovernanceDocument> findGovernance(String databaseId) {
    return Optional.ofNullable(governance.get(databaseId));
  }

  @Override
  public void saveGovernance(String databaseId, GovernanceDocument document, Instant at) {
    governance.put(databaseId, Objects.requireNonNull(document, "document"));
  }

  @Override
  public String kind() { return "memory"; }
}
