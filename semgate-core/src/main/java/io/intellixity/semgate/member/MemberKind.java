package io.intellixity.semgate.member;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberKind {
  MEASURE("measure"),
  DIMENSION("dimension"),
  TIME_DIMENSION("timeDimension"),
  SEGMENT("segment");

  private final String wire;

  MemberKind(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  public static MemberKind fromWire(String s) {
    for (MemberKind k : values()) if (k.wire.equals(s)) return k;
    throw new IllegalArgumentException("Unknown member kind: " + s);
  }
}
