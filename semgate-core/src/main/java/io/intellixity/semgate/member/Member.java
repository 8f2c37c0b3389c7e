package io.intellixity.semgate.member;

import io.intellixity.semgate.governance.MemberOverride;
import io.intellixity.semgate.governance.ResolvedGovernance;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** A catalog entry: the engine definition with its effective governance applied. */
public record Member(MemberDefinition definition, ResolvedGovernance governance) {
  public Member {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(governance, "governance");
  }

  public String name() { return definition.name(); }
  public MemberKind kind() { return definition.kind(); }
  public String cubeName() { return definition.cubeName(); }
  public String title() { return definition.title(); }
  public String shortTitle() { return definition.shortTitle(); }
  public String memberType() { return definition.memberType(); }
  public List<String> drillMembers() { return definition.drillMembers(); }
  public List<Granularity> granularities() { return definition.granularities(); }
  public Map<String, Object> meta() { return definition.meta(); }

  /** The governance description when one is set, the engine description otherwise. */
  public String description() {
    return governance.description() != null ? governance.description() : definition.description();
  }

  public boolean exposed() { return governance.exposed(); }
  public boolean pii() { return governance.pii(); }
  public Set<String> allowedGroupBy() { return governance.allowedGroupBy(); }
  public Set<String> deniedGroupBy() { return governance.deniedGroupBy(); }
  public boolean requiresTimeDimension() { return governance.requiresTimeDimension(); }
  public MemberOverride override() { return governance.override(); }
}
