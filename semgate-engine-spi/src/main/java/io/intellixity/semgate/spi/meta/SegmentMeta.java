package io.intellixity.semgate.spi.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentMeta(String name,
                          String title,
                          String shortTitle,
                          String description,
                          @JsonProperty("isVisible") Boolean visible,
                          @JsonProperty("public") Boolean isPublic,
                          Map<String, Object> meta) {}
