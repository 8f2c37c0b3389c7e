package io.intellixity.semgate.member;

import java.util.Objects;

public record Granularity(String name, String title) {
  public Granularity {
    Objects.requireNonNull(name, "name");
  }
}
