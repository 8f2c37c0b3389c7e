package io.intellixity.semgate.governance;

import java.util.Set;

/**
 * Effective governance of one member after applying override, then document defaults, then built-in defaults.
 * {@code override} is the raw override that contributed, or null.
 */
public record ResolvedGovernance(boolean exposed,
                                 boolean pii,
                                 Set<String> allowedGroupBy,
                                 Set<String> deniedGroupBy,
                                 boolean requiresTimeDimension,
                                 String description,
                                 MemberOverride override) {
  public ResolvedGovernance {
    allowedGroupBy = allowedGroupBy == null ? Set.of() : Set.copyOf(allowedGroupBy);
    deniedGroupBy = deniedGroupBy == null ? Set.of() : Set.copyOf(deniedGroupBy);
  }

  /** Built-in defaults: exposed, not PII, no group-by rules. */
  public static ResolvedGovernance defaults() {
    return new ResolvedGovernance(true, false, Set.of(), Set.of(), false, null, null);
  }
}
