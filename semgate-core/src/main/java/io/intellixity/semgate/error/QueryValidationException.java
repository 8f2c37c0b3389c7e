package io.intellixity.semgate.error;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a query fails governance or validation rules.
 * <p>
 * Carries every violation found, never only the first one. {@link #code()} is the code of the first violation.
 */
public final class QueryValidationException extends GatewayException {
  private final List<PolicyViolation> errors;
  private final List<PolicyViolation> warnings;

  public QueryValidationException(List<PolicyViolation> errors, List<PolicyViolation> warnings) {
    super(firstCode(errors), summarize(errors), suggestionsOf(errors), Map.of("errors", List.copyOf(errors)), null);
    this.errors = List.copyOf(errors);
    this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static QueryValidationException of(PolicyViolation violation) {
    return new QueryValidationException(List.of(violation), List.of());
  }

  public List<PolicyViolation> errors() { return errors; }
  public List<PolicyViolation> warnings() { return warnings; }

  /** GOVERNANCE if any member was refused by policy, VALIDATION otherwise. */
  @Override
  public ErrorCategory category() {
    for (PolicyViolation v : errors) {
      if (v.code().category() == ErrorCategory.GOVERNANCE) return ErrorCategory.GOVERNANCE;
    }
    return ErrorCategory.VALIDATION;
  }

  private static ErrorCode firstCode(List<PolicyViolation> errors) {
    if (errors == null || errors.isEmpty()) throw new IllegalArgumentException("errors is empty");
    return errors.get(0).code();
  }

  private static String summarize(List<PolicyViolation> errors) {
    if (errors.size() == 1) return errors.get(0).message();
    return errors.size() + " policy violations: "
        + errors.stream().map(PolicyViolation::message).collect(Collectors.joining("; "));
  }

  private static List<String> suggestionsOf(List<PolicyViolation> errors) {
    return errors.stream().flatMap(v -> v.suggestions().stream()).distinct().toList();
  }
}
