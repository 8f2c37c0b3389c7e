package io.intellixity.semgate.registry.store;

import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of database rows and their governance documents.
 * <p>
 * Every read and write takes an optional {@code tenantId} used as a filter predicate: null matches any row,
 * non-null matches only rows owned by that tenant. A row of another tenant behaves exactly like a missing row.
 * Each write is atomic at the row level.
 */
public interface DatabaseStore {
  Optional<DatabaseConfig> get(String id, String tenantId);

  /** Rows ordered by creation time. */
  List<DatabaseConfig> list(String tenantId);

  List<DatabaseConfig> listByStatus(DatabaseStatus status, String tenantId);

  boolean exists(String id, String tenantId);

  /** True if a row of {@code tenantId} (or a tenant-less row when null) already uses {@code slug}. */
  boolean slugExists(String slug, String tenantId);

  /** @throws io.intellixity.semgate.error.ConflictException if the id is taken */
  void insert(DatabaseConfig database);

  /**
   * Replaces the editable fields of the row. {@code status} and {@code lastError} keep their stored values.
   * With {@code onlyIfInactive} the write matches only a row that is not active.
   *
   * @return the row as stored, empty if no row matched
   */
  Optional<DatabaseConfig> replace(DatabaseConfig database, boolean onlyIfInactive, String tenantId);

  boolean updateStatus(String id, DatabaseStatus status, String lastError, Instant at, String tenantId);

  /** Deletes the row and its governance document unless the row is active; false if no row matched. */
  boolean delete(String id, String tenantId);

  Optional<GovernanceDocument> findGovernance(String databaseId);

  void saveGovernance(String databaseId, GovernanceDocument document, Instant at);

  /** Short name for diagnostics ("memory", "jdbc"). */
  String kind();
}
