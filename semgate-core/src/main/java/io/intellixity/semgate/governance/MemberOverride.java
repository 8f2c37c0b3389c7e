package io.intellixity.semgate.governance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Per-member governance override. Null fields inherit from {@link GovernanceDefaults} or the built-in defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemberOverride(Boolean exposed,
                             Boolean pii,
                             String description,
                             List<String> allowedGroupBy,
                             List<String> deniedGroupBy,
                             Boolean requiresTimeDimension) {
  public MemberOverride {
    allowedGroupBy = allowedGroupBy == null ? null : List.copyOf(allowedGroupBy);
    deniedGroupBy = deniedGroupBy == null ? null : List.copyOf(deniedGroupBy);
  }

  public static MemberOverride none() {
    return new MemberOverride(null, null, null, null, null, null);
  }

  public MemberOverride withExposed(Boolean v) { return new MemberOverride(v, pii, description, allowedGroupBy, deniedGroupBy, requiresTimeDimension); }
  public MemberOverride withPii(Boolean v) { return new MemberOverride(exposed, v, description, allowedGroupBy, deniedGroupBy, requiresTimeDimension); }
  public MemberOverride withDescription(String v) { return new MemberOverride(exposed, pii, v, allowedGroupBy, deniedGroupBy, requiresTimeDimension); }
  public MemberOverride withAllowedGroupBy(List<String> v) { return new MemberOverride(exposed, pii, description, v, deniedGroupBy, requiresTimeDimension); }
  public MemberOverride withDeniedGroupBy(List<String> v) { return new MemberOverride(exposed, pii, description, allowedGroupBy, v, requiresTimeDimension); }
  public MemberOverride withRequiresTimeDimension(Boolean v) { return new MemberOverride(exposed, pii, description, allowedGroupBy, deniedGroupBy, v); }

  /** Blank description and empty lists normalized to absent. */
  public MemberOverride cleaned() {
    return new MemberOverride(
        exposed,
        pii,
        description == null || description.isBlank() ? null : description,
        allowedGroupBy == null || allowedGroupBy.isEmpty() ? null : allowedGroupBy,
        deniedGroupBy == null || deniedGroupBy.isEmpty() ? null : deniedGroupBy,
        requiresTimeDimension);
  }

  /** True if, after cleaning, nothing is set. */
  @JsonIgnore
  public boolean isEmpty() {
    MemberOverride c = cleaned();
    return c.exposed == null && c.pii == null && c.description == null
        && c.allowedGroupBy == null && c.deniedGroupBy == null && c.requiresTimeDimension == null;
  }
}
