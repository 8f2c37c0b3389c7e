package io.intellixity.semgate.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Result of a governed query execution. */
public record QueryResult(List<Map<String, Object>> data,
                          List<SchemaField> schema,
                          @JsonProperty("normalized_query") SemanticQuery normalizedQuery,
                          Lineage lineage,
                          List<String> notes,
                          Debug debug) {
  public QueryResult {
    // rows may hold null cells, so they are not copied with Map.copyOf
    data = data == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
    schema = schema == null ? List.of() : List.copyOf(schema);
    Objects.requireNonNull(normalizedQuery, "normalizedQuery");
    Objects.requireNonNull(lineage, "lineage");
    notes = notes == null ? List.of() : List.copyOf(notes);
    Objects.requireNonNull(debug, "debug");
  }

  @JsonIgnore
  public int rowCount() { return data.size(); }

  /** {@code sql} is null unless SQL preview is enabled and the preview succeeded. */
  public record Debug(@JsonInclude(JsonInclude.Include.ALWAYS) String sql,
                      @JsonProperty("cube_query") SemanticQuery cubeQuery,
                      @JsonProperty("query_hash") String queryHash) {
    public Debug {
      Objects.requireNonNull(cubeQuery, "cubeQuery");
      Objects.requireNonNull(queryHash, "queryHash");
    }
  }
}
