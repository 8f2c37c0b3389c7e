package io.intellixity.semgate.governance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Document-wide fallbacks for members without an explicit setting. Null means "not set". */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GovernanceDefaults(Boolean exposed, Boolean pii) {
  public static GovernanceDefaults of(boolean exposed, boolean pii) {
    return new GovernanceDefaults(exposed, pii);
  }

  /** Fields set in {@code patch} replace ours. */
  public GovernanceDefaults merge(GovernanceDefaults patch) {
    if (patch == null) return this;
    return new GovernanceDefaults(
        patch.exposed != null ? patch.exposed : exposed,
        patch.pii != null ? patch.pii : pii);
  }
}
