package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.member.MemberKind;

import java.util.Objects;
import java.util.Set;

/** Catalog search request. Empty {@code types}/{@code cubes} mean "any". */
public record CatalogSearch(String query, Set<MemberKind> types, Set<String> cubes, int limit, boolean includeHidden) {
  public static final int DEFAULT_LIMIT = 10;

  public CatalogSearch {
    Objects.requireNonNull(query, "query");
    types = types == null ? Set.of() : Set.copyOf(types);
    cubes = cubes == null ? Set.of() : Set.copyOf(cubes);
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static CatalogSearch of(String query) {
    return new CatalogSearch(query, Set.of(), Set.of(), DEFAULT_LIMIT, false);
  }

  public CatalogSearch withTypes(Set<MemberKind> v) { return new CatalogSearch(query, v, cubes, limit, includeHidden); }
  public CatalogSearch withCubes(Set<String> v) { return new CatalogSearch(query, types, v, limit, includeHidden); }
  public CatalogSearch withLimit(int v) { return new CatalogSearch(query, types, cubes, v, includeHidden); }
  public CatalogSearch withIncludeHidden(boolean v) { return new CatalogSearch(query, types, cubes, limit, v); }
}
