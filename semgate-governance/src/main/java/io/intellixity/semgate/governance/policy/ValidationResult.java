package io.intellixity.semgate.governance.policy;

import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.PolicyViolation;
import io.intellixity.semgate.error.QueryValidationException;

import java.util.List;

/** Every error and warning found for one query. */
public record ValidationResult(List<PolicyViolation> errors, List<PolicyViolation> warnings) {
  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean valid() { return errors.isEmpty(); }

  public boolean has(ErrorCode code) {
    return errors.stream().anyMatch(v -> v.code() == code);
  }

  public ValidationResult throwIfInvalid() {
    if (!valid()) throw new QueryValidationException(errors, warnings);
    return this;
  }
}
