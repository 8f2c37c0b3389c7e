package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.member.Member;

import java.util.List;
import java.util.Objects;

/**
 * A member and the members related to it. A related member appears once per relationship, so a drill member of the
 * same cube is listed twice.
 */
public record MemberDescription(Member member, List<RelatedMember> relatedMembers) {
  public MemberDescription {
    Objects.requireNonNull(member, "member");
    relatedMembers = relatedMembers == null ? List.of() : List.copyOf(relatedMembers);
  }
}
