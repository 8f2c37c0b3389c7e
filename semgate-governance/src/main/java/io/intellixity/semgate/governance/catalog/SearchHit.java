package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.member.Member;

import java.util.List;
import java.util.Objects;

/** One ranked search result; {@code matches} locate the hit in each matching field for highlighting. */
public record SearchHit(Member member, double score, List<FuzzyIndex.FieldMatch> matches) {
  public SearchHit {
    Objects.requireNonNull(member, "member");
    matches = matches == null ? List.of() : List.copyOf(matches);
  }
}
