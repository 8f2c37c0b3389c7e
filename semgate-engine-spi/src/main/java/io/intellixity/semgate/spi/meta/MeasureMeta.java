package io.intellixity.semgate.spi.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** {@code visible}/{@code isPublic} are null when the engine omits them; readers treat null as true. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MeasureMeta(String name,
                          String title,
                          String shortTitle,
                          String description,
                          String type,
                          String aggType,
                          List<String> drillMembers,
                          String format,
                          @JsonProperty("isVisible") Boolean visible,
                          @JsonProperty("public") Boolean isPublic,
                          Map<String, Object> meta) {}
