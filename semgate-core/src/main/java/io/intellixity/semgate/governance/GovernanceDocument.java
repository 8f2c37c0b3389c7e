package io.intellixity.semgate.governance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.semgate.error.ConfigurationException;
import io.intellixity.semgate.query.QueryFilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-database governance rules: defaults, per-member overrides, and default segments/filters merged into every
 * query.
 * <p>
 * Resolution for a member: override field, then {@link #defaults()} field, then built-in
 * (exposed = true, pii = false). Null {@code defaultSegments}/{@code defaultFilters} mean "not configured".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GovernanceDocument(String version,
                                 GovernanceDefaults defaults,
                                 Map<String, MemberOverride> members,
                                 List<String> defaultSegments,
                                 List<QueryFilter> defaultFilters) {
  public static final String CURRENT_VERSION = "1.0";

  public GovernanceDocument {
    if (version == null || version.isBlank()) version = CURRENT_VERSION;
    members = copyMembers(members);
    defaultSegments = defaultSegments == null ? null : List.copyOf(defaultSegments);
    defaultFilters = defaultFilters == null ? null : List.copyOf(defaultFilters);
  }

  /** No rules at all: every member resolves to built-in defaults. */
  public static GovernanceDocument empty() {
    return new GovernanceDocument(CURRENT_VERSION, null, Map.of(), null, null);
  }

  /** Document written for a newly created database. */
  public static GovernanceDocument initial() {
    return new GovernanceDocument(CURRENT_VERSION, GovernanceDefaults.of(true, false), Map.of(), List.of(), List.of());
  }

  public Optional<MemberOverride> override(String memberName) {
    return Optional.ofNullable(members.get(memberName));
  }

  public ResolvedGovernance resolve(String memberName) {
    MemberOverride o = members.get(memberName);
    GovernanceDefaults d = defaults;
    boolean exposed = firstNonNull(o == null ? null : o.exposed(), d == null ? null : d.exposed(), true);
    boolean pii = firstNonNull(o == null ? null : o.pii(), d == null ? null : d.pii(), false);
    if (o == null) {
      return new ResolvedGovernance(exposed, pii, null, null, false, null, null);
    }
    return new ResolvedGovernance(
        exposed,
        pii,
        o.allowedGroupBy() == null ? null : Set.copyOf(o.allowedGroupBy()),
        o.deniedGroupBy() == null ? null : Set.copyOf(o.deniedGroupBy()),
        Boolean.TRUE.equals(o.requiresTimeDimension()),
        o.description() == null || o.description().isBlank() ? null : o.description(),
        o);
  }

  /** Replaces a member's override; an override that cleans to nothing removes the entry. */
  public GovernanceDocument withMemberOverride(String memberName, MemberOverride override) {
    if (memberName == null || memberName.isBlank()) throw new IllegalArgumentException("memberName is blank");
    Map<String, MemberOverride> next = new LinkedHashMap<>(members);
    MemberOverride cleaned = override == null ? null : override.cleaned();
    if (cleaned == null || cleaned.isEmpty()) next.remove(memberName);
    else next.put(memberName, cleaned);
    return new GovernanceDocument(version, defaults, next, defaultSegments, defaultFilters);
  }

  public GovernanceDocument withDefaults(GovernanceDefaults patch) {
    GovernanceDefaults base = defaults == null ? new GovernanceDefaults(null, null) : defaults;
    return new GovernanceDocument(version, base.merge(patch), members, defaultSegments, defaultFilters);
  }

  public GovernanceDocument withDefaultSegments(List<String> segments) {
    return new GovernanceDocument(version, defaults, members, segments, defaultFilters);
  }

  public GovernanceDocument withDefaultFilters(List<QueryFilter> filters) {
    return new GovernanceDocument(version, defaults, members, defaultSegments, filters);
  }

  /** Every override cleaned; entries that clean to nothing are dropped. */
  public GovernanceDocument cleaned() {
    Map<String, MemberOverride> next = new LinkedHashMap<>();
    members.forEach((name, o) -> {
      MemberOverride c = o.cleaned();
      if (!c.isEmpty()) next.put(name, c);
    });
    return new GovernanceDocument(version, defaults, next, defaultSegments, defaultFilters);
  }

  /** Structural checks a stored or submitted document must pass. */
  public GovernanceDocument validate() {
    for (Map.Entry<String, MemberOverride> e : members.entrySet()) {
      if (e.getKey().isBlank()) throw new ConfigurationException("Governance document has a blank member name");
    }
    if (defaultSegments != null) {
      for (String s : defaultSegments) {
        if (s == null || s.isBlank()) throw new ConfigurationException("Governance document has a blank default segment");
      }
    }
    if (defaultFilters != null) {
      for (QueryFilter f : defaultFilters) {
        if (f.member().isBlank() || f.operator().isBlank()) {
          throw new ConfigurationException("Governance default filter needs a member and an operator");
        }
      }
    }
    return this;
  }

  private static boolean firstNonNull(Boolean a, Boolean b, boolean fallback) {
    if (a != null) return a;
    if (b != null) return b;
    return fallback;
  }

  private static Map<String, MemberOverride> copyMembers(Map<String, MemberOverride> in) {
    if (in == null || in.isEmpty()) return Map.of();
    Map<String, MemberOverride> out = new LinkedHashMap<>();
    in.forEach((k, v) -> {
      if (k != null && v != null) out.put(k, v);
    });
    return Collections.unmodifiableMap(out);
  }
}
