package io.intellixity.semgate.registry;

import io.intellixity.semgate.governance.GovernanceDefaults;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.governance.MemberOverride;
import io.intellixity.semgate.query.QueryFilter;
import io.intellixity.semgate.registry.store.DatabaseStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Reads and edits the governance document of a database.
 * <p>
 * Writes replace the whole document (last writer wins) and are serialized per database within the process.
 * Overrides are cleaned on every write, so an override with nothing set is never stored.
 * Each write emits a {@code GOVERNANCE_UPDATED} registry event.
 */
public final class GovernanceCatalog {
  private final DatabaseRegistry registry;
  private final DatabaseStore store;
  private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

  public GovernanceCatalog(DatabaseRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.store = registry.store();
  }

  /** The stored document, or {@link GovernanceDocument#empty()} when none is stored. */
  public GovernanceDocument read(String databaseId, String tenantId) {
    registry.require(databaseId, tenantId);
    return store.findGovernance(databaseId).orElseGet(GovernanceDocument::empty);
  }

  public GovernanceDocument replace(String databaseId, GovernanceDocument document, String tenantId) {
    Objects.requireNonNull(document, "document").validate();
    return edit(databaseId, tenantId, cur -> document);
  }

  /** Sets a member override; an override that cleans to nothing removes the entry. */
  public GovernanceDocument updateMember(String databaseId, String memberName, MemberOverride override, String tenantId) {
    return edit(databaseId, tenantId, cur -> cur.withMemberOverride(memberName, override));
  }

  public GovernanceDocument updateDefaults(String databaseId, GovernanceDefaults patch, String tenantId) {
    return edit(databaseId, tenantId, cur -> cur.withDefaults(patch));
  }

  public GovernanceDocument setDefaultSegments(String databaseId, List<String> segments, String tenantId) {
    return edit(databaseId, tenantId, cur -> cur.withDefaultSegments(segments));
  }

  public GovernanceDocument setDefaultFilters(String databaseId, List<QueryFilter> filters, String tenantId) {
    return edit(databaseId, tenantId, cur -> cur.withDefaultFilters(filters));
  }

  private GovernanceDocument edit(String databaseId, String tenantId, UnaryOperator<GovernanceDocument> change) {
    DatabaseConfig db = registry.require(databaseId, tenantId);
    GovernanceDocument next;
    synchronized (locks.computeIfAbsent(databaseId, k -> new Object())) {
      GovernanceDocument cur = store.findGovernance(databaseId).orElseGet(GovernanceDocument::empty);
      next = change.apply(cur).cleaned().validate();
      store.saveGovernance(databaseId, next, registry.clock().instant());
    }
    registry.governanceUpdated(databaseId, db.tenantId());
    return next;
  }
}
