package io.intellixity.semgate.governance;

/**
 * Per-request identity, as resolved by the transport layer.\n
 *
 * A null {@code tenantId} means single-tenant mode: registry reads are not filtered by tenant.\n
 */
public record GovernanceContext(String tenantId, String userId, String orgRole) {
  public GovernanceContext {
    tenantId = blankToNull(tenantId);
    userId = blankToNull(userId);
    orgRole = blankToNull(orgRole);
  }

  public static GovernanceContext singleTenant() {
    return new GovernanceContext(null, null, null);
  }

  public static GovernanceContext of(String tenantId, String userId) {
    return new GovernanceContext(tenantId, userId, null);
  }

  public boolean multiTenant() { return tenantId != null; }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
