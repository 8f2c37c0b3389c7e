package io.intellixity.semgate.registry;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DatabaseStatus {
  INITIALIZING, ACTIVE, INACTIVE, ERROR;

  @JsonValue
  public String wire() { return name().toLowerCase(Locale.ROOT); }

  public static DatabaseStatus fromWire(String s) {
    return valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
