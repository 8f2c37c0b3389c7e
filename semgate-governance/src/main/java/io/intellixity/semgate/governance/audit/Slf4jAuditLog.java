package io.intellixity.semgate.governance.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Writes {@code [AUDIT] <event> <json>} lines to the {@code semgate.audit} logger. */
public final class Slf4jAuditLog implements AuditLog {
  public static final String LOGGER_NAME = "semgate.audit";

  private static final Logger log = LoggerFactory.getLogger(Slf4jAuditLog.class);

  private final Logger audit;
  private final ObjectMapper json;

  public Slf4jAuditLog(ObjectMapper json) {
    this(json, LoggerFactory.getLogger(LOGGER_NAME));
  }

  Slf4jAuditLog(ObjectMapper json, Logger audit) {
    this.json = Objects.requireNonNull(json, "json");
    this.audit = Objects.requireNonNull(audit, "audit");
  }

  @Override
  public void record(AuditEvent event) {
    if (!audit.isInfoEnabled()) return;
    audit.info("[AUDIT] {} {}", event.event(), render(event));
  }

  String render(AuditEvent event) {
    try {
      return json.writeValueAsString(event.toMap());
    } catch (JsonProcessingException e) {
      log.warn("Failed to render audit event {}", event.event(), e);
      return event.toMap().toString();
    }
  }
}
