package io.intellixity.semgate.spi.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineMeta(List<CubeMeta> cubes) {
  public EngineMeta {
    cubes = cubes == null ? List.of() : List.copyOf(cubes);
  }
}
