package io.intellixity.semgate.spi.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DimensionMeta(String name,
                            String title,
                            String shortTitle,
                            String description,
                            String type,
                            Boolean primaryKey,
                            @JsonProperty("isVisible") Boolean visible,
                            @JsonProperty("public") Boolean isPublic,
                            Map<String, Object> meta,
                            List<GranularityMeta> granularities) {

  /** Time dimensions are dimensions of type {@code time}. */
  public boolean isTime() { return "time".equals(type); }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record GranularityMeta(String name, String title) {}
}
