package io.intellixity.semgate.governance.policy;

import io.intellixity.semgate.query.SemanticQuery;

import java.util.List;
import java.util.Objects;

/** A query with database defaults applied, and one note per applied default. */
public record NormalizedQuery(SemanticQuery query, List<String> notes) {
  public NormalizedQuery {
    Objects.requireNonNull(query, "query");
    notes = notes == null ? List.of() : List.copyOf(notes);
  }
}
