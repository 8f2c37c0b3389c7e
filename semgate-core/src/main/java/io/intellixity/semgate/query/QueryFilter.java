package io.intellixity.semgate.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/** A member filter. {@code values} is empty for unary operators such as {@code set}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record QueryFilter(@JsonAlias("dimension") String member, String operator, List<String> values) {
  public QueryFilter {
    Objects.requireNonNull(member, "member");
    Objects.requireNonNull(operator, "operator");
    values = values == null ? List.of() : List.copyOf(values);
  }

  public static QueryFilter of(String member, String operator, String... values) {
    return new QueryFilter(member, operator, List.of(values));
  }
}
