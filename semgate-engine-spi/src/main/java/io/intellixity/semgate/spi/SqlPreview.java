package io.intellixity.semgate.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Generated SQL text and its bind parameters. */
public record SqlPreview(String sql, List<Object> params) {
  public SqlPreview {
    Objects.requireNonNull(sql, "sql");
    // params may contain nulls
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }
}
