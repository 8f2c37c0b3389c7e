package io.intellixity.semgate.governance.audit;

/** Sink for audit records. Implementations must not throw. */
@FunctionalInterface
public interface AuditLog {
  void record(AuditEvent event);

  static AuditLog noop() {
    return e -> {};
  }
}
