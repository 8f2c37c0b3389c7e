package io.intellixity.semgate.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/** Column descriptor of a result, derived from the engine's response annotation. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchemaField(String key, String type, String title, String shortTitle, Map<String, Object> meta) {
  public SchemaField {
    Objects.requireNonNull(key, "key");
  }
}
