package io.intellixity.semgate.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every failure the gateway reports to a caller.
 * <p>
 * Carries a discriminated {@link ErrorCode}, optional suggestions and a details map that the protocol layer renders
 * next to the code and message.
 */
public abstract class GatewayException extends RuntimeException {
  private final ErrorCode code;
  private final List<String> suggestions;
  private final Map<String, Object> details;

  protected GatewayException(ErrorCode code, String message) {
    this(code, message, List.of(), Map.of(), null);
  }

  protected GatewayException(ErrorCode code,
                             String message,
                             List<String> suggestions,
                             Map<String, ?> details,
                             Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    this.details = details == null ? Map.of() : copyDetails(details);
  }

  public ErrorCode code() { return code; }
  public ErrorCategory category() { return code.category(); }
  public List<String> suggestions() { return suggestions; }
  public Map<String, Object> details() { return details; }

  /** True if the same call may succeed later without the caller changing it. */
  public boolean retryable() {
    return code.category() == ErrorCategory.NOT_READY;
  }

  private static Map<String, Object> copyDetails(Map<String, ?> in) {
    Map<String, Object> out = new LinkedHashMap<>();
    in.forEach((k, v) -> {
      if (k != null && v != null) out.put(k, v);
    });
    return Collections.unmodifiableMap(out);
  }
}
