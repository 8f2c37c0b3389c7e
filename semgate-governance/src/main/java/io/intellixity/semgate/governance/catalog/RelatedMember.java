package io.intellixity.semgate.governance.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.semgate.member.MemberKind;

public record RelatedMember(String name, MemberKind type, Relationship relationship) {
  public enum Relationship {
    SAME_CUBE("same_cube"),
    DRILL_MEMBER("drill_member");

    private final String wire;

    Relationship(String wire) { this.wire = wire; }

    @JsonValue
    public String wire() { return wire; }
  }
}
