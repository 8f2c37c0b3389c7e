package io.intellixity.semgate.governance.policy;

import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.RegistrySettings;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Effective policy of one database.\n
 *
 * {@code defaultSegments} are database-level defaults, merged before the governance document's.\n
 */
public record PolicySettings(int maxLimit, Set<String> denyMembers, boolean returnSql, List<String> defaultSegments) {
  public static final int DEFAULT_MAX_LIMIT = 1000;
  public static final int DEFAULT_LIMIT = 100;
  public static final int MANY_DIMENSIONS = 5;

  public PolicySettings {
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
    denyMembers = denyMembers == null ? Set.of() : Set.copyOf(denyMembers);
    defaultSegments = defaultSegments == null ? List.of() : List.copyOf(defaultSegments);
  }

  public static PolicySettings defaults() {
    return new PolicySettings(DEFAULT_MAX_LIMIT, Set.of(), false, List.of());
  }

  /** Per-database values override global ones; deny lists are unioned and the SQL toggle is OR-ed. */
  public static PolicySettings forDatabase(RegistrySettings global, DatabaseConfig db) {
    Objects.requireNonNull(global, "global");
    Objects.requireNonNull(db, "db");
    Set<String> deny = new LinkedHashSet<>(global.denyMembers());
    deny.addAll(db.denyMembers());
    return new PolicySettings(
        db.maxLimit() != null ? db.maxLimit() : global.maxLimit(),
        deny,
        global.returnSql() || db.returnSql(),
        db.defaultSegments());
  }

  public PolicySettings withMaxLimit(int v) { return new PolicySettings(v, denyMembers, returnSql, defaultSegments); }
  public PolicySettings withDenyMembers(Set<String> v) { return new PolicySettings(maxLimit, v, returnSql, defaultSegments); }
  public PolicySettings withReturnSql(boolean v) { return new PolicySettings(maxLimit, denyMembers, v, defaultSegments); }
  public PolicySettings withDefaultSegments(List<String> v) { return new PolicySettings(maxLimit, denyMembers, returnSql, v); }
}
