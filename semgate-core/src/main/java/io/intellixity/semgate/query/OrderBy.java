package io.intellixity.semgate.query;

import java.util.Locale;
import java.util.Objects;

public record OrderBy(String member, Direction direction) {
  public OrderBy {
    Objects.requireNonNull(member, "member");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    public String wire() { return name().toLowerCase(Locale.ROOT); }

    public static Direction parse(String s) {
      if (s == null) return ASC;
      return switch (s.trim().toLowerCase(Locale.ROOT)) {
        case "asc" -> ASC;
        case "desc" -> DESC;
        default -> throw new IllegalArgumentException("Unknown order direction: " + s);
      };
    }
  }
}
