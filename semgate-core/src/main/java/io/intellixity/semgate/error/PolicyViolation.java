package io.intellixity.semgate.error;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One finding of query validation: an error or a warning. */
public record PolicyViolation(ErrorCode code, String message, String member, List<String> suggestions, Map<String, Object> details) {
  public PolicyViolation {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public PolicyViolation(ErrorCode code, String message, String member) {
    this(code, message, member, List.of(), Map.of());
  }
}
