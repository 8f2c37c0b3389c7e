package io.intellixity.semgate.registry;

/** Outcome of a connection configuration check; {@code latencyMs} is null on failure. */
public record ConnectionTestResult(boolean success, String message, Long latencyMs) {
  static ConnectionTestResult failed(String message) {
    return new ConnectionTestResult(false, message, null);
  }
}
