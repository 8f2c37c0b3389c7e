package io.intellixity.semgate.spi.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CubeMeta(String name,
                       String title,
                       String description,
                       List<MeasureMeta> measures,
                       List<DimensionMeta> dimensions,
                       List<SegmentMeta> segments) {
  public CubeMeta {
    measures = measures == null ? List.of() : List.copyOf(measures);
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
