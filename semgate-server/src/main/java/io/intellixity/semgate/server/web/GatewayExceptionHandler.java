package io.intellixity.semgate.server.web;

import io.intellixity.semgate.error.ErrorCategory;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.GatewayException;
import io.intellixity.semgate.error.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Renders failures as {@code {"error": {"code", "message", "suggestions"?, ...details}}}. */
@RestControllerAdvice
public class GatewayExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

  @ExceptionHandler(GatewayException.class)
  public ResponseEntity<Map<String, Object>> handleGateway(GatewayException ex) {
    HttpStatus status = statusOf(ex);
    if (status.is5xxServerError()) log.warn("Request failed: {} {}", ex.code(), ex.getMessage(), ex);
    else log.debug("Request rejected: {} {}", ex.code(), ex.getMessage());

    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", ex.code().name());
    error.put("message", ex.getMessage());
    if (!ex.suggestions().isEmpty()) error.put("suggestions", ex.suggestions());
    ex.details().forEach(error::putIfAbsent);
    if (ex instanceof QueryValidationException qv && !qv.warnings().isEmpty()) {
      error.put("warnings", qv.warnings());
    }
    return ResponseEntity.status(status).body(Map.of("error", error));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_ARGUMENT, "Request body is not valid JSON"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleAll(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(body(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred"));
  }

  static HttpStatus statusOf(GatewayException ex) {
    if (ex.code() == ErrorCode.UPSTREAM_TIMEOUT) return HttpStatus.GATEWAY_TIMEOUT;
    ErrorCategory category = ex.category();
    switch (category) {
      case VALIDATION:
        return HttpStatus.BAD_REQUEST;
      case GOVERNANCE:
        return HttpStatus.FORBIDDEN;
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case CONFLICT:
        return HttpStatus.CONFLICT;
      case UPSTREAM:
        return HttpStatus.BAD_GATEWAY;
      case NOT_READY:
        return HttpStatus.SERVICE_UNAVAILABLE;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private static Map<String, Object> body(ErrorCode code, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", code.name());
    error.put("message", message);
    return Map.of("error", error);
  }
}
