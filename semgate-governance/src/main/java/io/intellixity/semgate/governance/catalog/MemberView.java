package io.intellixity.semgate.governance.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.semgate.member.Granularity;
import io.intellixity.semgate.member.Member;
import io.intellixity.semgate.member.MemberKind;

import java.util.List;
import java.util.Set;

/** Governance-resolved, caller-facing rendering of a member. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record MemberView(String name,
                         MemberKind type,
                         String title,
                         String description,
                         String cube,
                         String memberType,
                         boolean exposed,
                         boolean pii,
                         String format,
                         String aggType,
                         List<String> drillMembers,
                         List<Granularity> granularities,
                         Set<String> allowedGroupBy,
                         Set<String> deniedGroupBy,
                         boolean requiresTimeDimension) {

  public static MemberView of(Member m) {
    return new MemberView(
        m.name(),
        m.kind(),
        m.title(),
        m.description(),
        m.cubeName(),
        m.memberType(),
        m.exposed(),
        m.pii(),
        m.definition().format(),
        m.definition().aggType(),
        m.drillMembers(),
        m.granularities(),
        m.allowedGroupBy(),
        m.deniedGroupBy(),
        m.requiresTimeDimension());
  }
}
