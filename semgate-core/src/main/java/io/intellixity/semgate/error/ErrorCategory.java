package io.intellixity.semgate.error;

/** Coarse classification of {@link ErrorCode}s, used for rendering and retry decisions. */
public enum ErrorCategory {
  /** Client-correctable query or request problem. */
  VALIDATION,
  /** Policy refused access to a member. */
  GOVERNANCE,
  NOT_FOUND,
  CONFLICT,
  /** Remote semantic engine failed or timed out. */
  UPSTREAM,
  CONFIGURATION,
  /** Component not initialized yet; the caller may retry. */
  NOT_READY,
  INTERNAL
}
