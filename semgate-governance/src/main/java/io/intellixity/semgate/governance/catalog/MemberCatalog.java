package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.member.Member;
import io.intellixity.semgate.query.QueryFilter;

import java.util.List;
import java.util.Optional;

/**
 * Read view of a database's governed members, as needed by policy enforcement.
 * <p>
 * Implementations throw {@link io.intellixity.semgate.error.NotReadyException} while not initialized.
 */
public interface MemberCatalog {
  Optional<Member> member(String name);

  /** Up to {@code limit} member names close to {@code text}. */
  List<String> suggestions(String text, int limit);

  List<String> defaultSegments();

  List<QueryFilter> defaultFilters();
}
