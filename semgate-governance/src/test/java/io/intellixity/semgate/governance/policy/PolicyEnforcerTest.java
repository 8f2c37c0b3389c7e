package io.intellixity.semgate.governance.policy;

import io.intellixity.semgate.error.ErrorCategory;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.PolicyViolation;
import io.intellixity.semgate.error.QueryValidationException;
import io.intellixity.semgate.governance.FakeEngine;
import io.intellixity.semgate.governance.GovernanceDefaults;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.governance.MemberOverride;
import io.intellixity.semgate.governance.catalog.CatalogIndex;
import io.intellixity.semgate.governance.catalog.GovernanceDocumentSource;
import io.intellixity.semgate.query.QueryFilter;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.query.TimeDimension;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseStatus;
import io.intellixity.semgate.registry.RegistrySettings;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PolicyEnforcerTest {

  private static PolicyEnforcer enforcer(GovernanceDocument doc) {
    return enforcer(doc, PolicySettings.defaults());
  }

  private static PolicyEnforcer enforcer(GovernanceDocument doc, PolicySettings settings) {
    CatalogIndex catalog = new CatalogIndex("db1", new FakeEngine(), GovernanceDocumentSource.fixed(doc), List.of());
    catalog.initialize();
    return new PolicyEnforcer(catalog, settings);
  }

  private static SemanticQuery count() {
    return SemanticQuery.empty().withMeasures("Orders.count").withLimit(10);
  }

  private static List<ErrorCode> codes(ValidationResult r) {
    return r.errors().stream().map(PolicyViolation::code).toList();
  }

  @Test
  void plainQuery_isValid() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(count());
    assertTrue(r.valid(), r.errors().toString());
  }

  @Test
  void missingLimit_isRejected() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(count().withLimit(null));
    assertEquals(List.of(ErrorCode.MISSING_LIMIT), codes(r));
  }

  @Test
  void limitAboveCeiling_isRejectedWithMessageNamingLimit() {
    PolicyEnforcer p = enforcer(GovernanceDocument.initial());

    QueryValidationException e = assertThrows(QueryValidationException.class, () -> p.validate(count().withLimit(5000)));

    assertEquals(ErrorCode.LIMIT_EXCEEDED, e.code());
    assertTrue(e.getMessage().contains("limit"), e.getMessage());
    assertEquals(ErrorCategory.VALIDATION, e.category());
  }

  @Test
  void perDatabaseMaxLimit_applies() {
    PolicyEnforcer p = enforcer(GovernanceDocument.initial(), PolicySettings.defaults().withMaxLimit(50));
    assertEquals(List.of(ErrorCode.LIMIT_EXCEEDED), codes(p.evaluate(count().withLimit(51))));
    assertTrue(p.evaluate(count().withLimit(50)).valid());
  }

  @Test
  void nonPositiveLimit_andNegativeOffset_areRejected() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(count().withLimit(0).withOffset(-1));
    assertEquals(List.of(ErrorCode.INVALID_LIMIT, ErrorCode.INVALID_OFFSET), codes(r));
  }

  @Test
  void queryWithoutMeasuresOrDimensions_isEmpty() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(
        SemanticQuery.empty().withSegments("Orders.completed").withLimit(10));
    assertEquals(List.of(ErrorCode.EMPTY_QUERY), codes(r));
  }

  @Test
  void unexposedMember_isRejected_evenAsFilterTarget() {
    GovernanceDocument doc = GovernanceDocument.initial()
        .withMemberOverride("Users.email", MemberOverride.none().withExposed(false));

    ValidationResult r = enforcer(doc).evaluate(count().withFilters(QueryFilter.of("Users.email", "set")));

    assertEquals(List.of(ErrorCode.MEMBER_NOT_EXPOSED), codes(r));
    assertEquals("Users.email", r.errors().get(0).member());
  }

  @Test
  void piiMember_isRejected_whateverElseItsOverrideSays() {
    MemberOverride o = MemberOverride.none()
        .withPii(true)
        .withExposed(true)
        .withAllowedGroupBy(List.of("Users.city"))
        .withDescription("Contact address");
    PolicyEnforcer p = enforcer(GovernanceDocument.initial().withMemberOverride("Users.email", o));

    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> p.validate(SemanticQuery.empty().withDimensions("Users.email").withLimit(10)));

    assertEquals(ErrorCode.PII_MEMBER_BLOCKED, e.code());
    assertEquals(ErrorCategory.GOVERNANCE, e.category());
  }

  @Test
  void documentDefaults_governMembersWithoutOverride() {
    GovernanceDocument doc = GovernanceDocument.initial().withDefaults(GovernanceDefaults.of(true, true))
        .withMemberOverride("Orders.count", MemberOverride.none().withPii(false));
    PolicyEnforcer p = enforcer(doc);

    assertTrue(p.evaluate(count()).valid());
    assertEquals(List.of(ErrorCode.PII_MEMBER_BLOCKED),
        codes(p.evaluate(count().withDimensions("Orders.status"))));
  }

  @Test
  void globalDenyList_blocksMember_independentOfOverrides() {
    PolicyEnforcer p = enforcer(GovernanceDocument.initial(),
        PolicySettings.defaults().withDenyMembers(Set.of("Orders.status")));

    ValidationResult r = p.evaluate(count().withDimensions("Orders.status"));

    assertEquals(List.of(ErrorCode.MEMBER_DENIED), codes(r));
    assertEquals(ErrorCategory.GOVERNANCE, r.errors().get(0).code().category());
  }

  @Test
  void unknownMember_isReportedWithSuggestions() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(count().withDimensions("Orders.stauts"));

    assertEquals(List.of(ErrorCode.UNKNOWN_MEMBER), codes(r));
    assertTrue(r.errors().get(0).suggestions().contains("Orders.status"));
  }

  @Test
  void allowedGroupBy_reportsOnlyTheDisallowedDimension() {
    GovernanceDocument doc = GovernanceDocument.initial().withMemberOverride("Orders.count",
        MemberOverride.none().withAllowedGroupBy(List.of("Orders.status")));
    PolicyEnforcer p = enforcer(doc);

    ValidationResult bad = p.evaluate(count().withDimensions("Orders.status", "Users.city"));
    assertEquals(List.of(ErrorCode.GROUP_BY_NOT_ALLOWED), codes(bad));
    assertEquals(List.of("Users.city"), bad.errors().get(0).details().get("dimensions"));
    assertTrue(bad.errors().get(0).message().contains("Users.city"));
    assertFalse(bad.errors().get(0).message().contains("Orders.status"));

    assertTrue(p.evaluate(count().withDimensions("Orders.status")).valid());
  }

  @Test
  void allowedAndDeniedLists_areCheckedIndependently() {
    GovernanceDocument doc = GovernanceDocument.initial().withMemberOverride("Orders.count",
        MemberOverride.none()
            .withAllowedGroupBy(List.of("Orders.status"))
            .withDeniedGroupBy(List.of("Users.city", "Orders.createdAt")));

    ValidationResult r = enforcer(doc).evaluate(count()
        .withDimensions("Users.city")
        .withTimeDimensions(TimeDimension.of("Orders.createdAt", "day")));

    assertEquals(List.of(ErrorCode.GROUP_BY_NOT_ALLOWED, ErrorCode.GROUP_BY_DENIED), codes(r));
    assertEquals(List.of("Users.city", "Orders.createdAt"), r.errors().get(1).details().get("dimensions"));
  }

  @Test
  void requiredTimeDimension_failsUntilOneIsAdded() {
    GovernanceDocument doc = GovernanceDocument.initial().withMemberOverride("Orders.totalRevenue",
        MemberOverride.none().withRequiresTimeDimension(true));
    PolicyEnforcer p = enforcer(doc);
    SemanticQuery q = SemanticQuery.empty().withMeasures("Orders.totalRevenue").withLimit(10);

    assertEquals(List.of(ErrorCode.TIME_DIMENSION_REQUIRED), codes(p.evaluate(q)));
    assertTrue(p.evaluate(q.withTimeDimensions(TimeDimension.of("Orders.createdAt"))).valid());
  }

  @Test
  void timeDimensionTarget_mustBeATimeDimension() {
    ValidationResult r = enforcer(GovernanceDocument.initial())
        .evaluate(count().withTimeDimensions(TimeDimension.of("Orders.status", "day")));
    assertEquals(List.of(ErrorCode.INVALID_TIME_DIMENSION), codes(r));
  }

  @Test
  void everyViolation_isReported() {
    GovernanceDocument doc = GovernanceDocument.initial()
        .withMemberOverride("Users.email", MemberOverride.none().withPii(true));

    ValidationResult r = enforcer(doc).evaluate(SemanticQuery.empty()
        .withMeasures("Orders.count")
        .withDimensions("Users.email", "Nope.nothing")
        .withLimit(5000));

    assertEquals(List.of(ErrorCode.LIMIT_EXCEEDED, ErrorCode.PII_MEMBER_BLOCKED, ErrorCode.UNKNOWN_MEMBER), codes(r));
    QueryValidationException e = assertThrows(QueryValidationException.class, r::throwIfInvalid);
    assertEquals(3, e.errors().size());
  }

  @Test
  void manyDimensions_isOnlyAWarning() {
    ValidationResult r = enforcer(GovernanceDocument.initial()).evaluate(count().withDimensions(
        "Orders.status", "Orders.id", "Users.city", "Users.email", "Users.country", "Orders.createdAt"));

    assertTrue(r.valid(), r.errors().toString());
    assertEquals(ErrorCode.MANY_DIMENSIONS, r.warnings().get(0).code());
  }

  @Test
  void applyDefaults_mergesSegmentsAndFilters_withoutRemovingAnything() {
    GovernanceDocument doc = GovernanceDocument.initial()
        .withDefaultSegments(List.of("Orders.completed", "Orders.archived"))
        .withDefaultFilters(List.of(
            QueryFilter.of("Orders.status", "equals", "shipped"),
            QueryFilter.of("Users.city", "set")));
    PolicyEnforcer p = enforcer(doc);
    SemanticQuery q = count()
        .withSegments("Orders.completed")
        .withFilters(new QueryFilter("Orders.status", "notEquals", List.of("void")));

    NormalizedQuery n = p.applyDefaults(q);

    assertEquals(List.of("Orders.completed", "Orders.archived"), n.query().segments());
    assertEquals(2, n.query().filters().size());
    assertEquals("notEquals", n.query().filters().get(0).operator());
    assertEquals("Users.city", n.query().filters().get(1).member());
    assertEquals(10, n.query().limit());
    assertEquals(List.of("Applied default segments: Orders.archived", "Applied default filters on: Users.city"), n.notes());
  }

  @Test
  void applyDefaults_fillsMissingLimit() {
    NormalizedQuery n = enforcer(GovernanceDocument.initial()).applyDefaults(count().withLimit(null));
    assertEquals(PolicySettings.DEFAULT_LIMIT, n.query().limit());
    assertEquals(List.of("Applied default limit: 100"), n.notes());
  }

  @Test
  void databaseSegments_comeBeforeDocumentSegments() {
    GovernanceDocument doc = GovernanceDocument.initial().withDefaultSegments(List.of("Orders.completed"));
    PolicyEnforcer p = enforcer(doc, PolicySettings.defaults().withDefaultSegments(List.of("Orders.recent")));

    assertEquals(List.of("Orders.recent", "Orders.completed"), p.applyDefaults(count()).query().segments());
  }

  @Test
  void shouldReturnSql_followsSettings() {
    assertFalse(enforcer(GovernanceDocument.initial()).shouldReturnSql());
    assertTrue(enforcer(GovernanceDocument.initial(), PolicySettings.defaults().withReturnSql(true)).shouldReturnSql());
  }

  @Test
  void forDatabase_overridesAndUnions() {
    RegistrySettings global = new RegistrySettings("http://cube", "s".repeat(32), 1000,
        List.of("Users.email"), List.of(), false, Map.of());
    DatabaseConfig db = new DatabaseConfig("db1", "db1", null, "DB", null, DatabaseStatus.ACTIVE, Map.of(), null, null,
        200, List.of("Orders.id"), List.of("Orders.completed"), true, null, Instant.EPOCH, Instant.EPOCH);

    PolicySettings s = PolicySettings.forDatabase(global, db);

    assertEquals(200, s.maxLimit());
    assertEquals(Set.of("Users.email", "Orders.id"), s.denyMembers());
    assertTrue(s.returnSql());
    assertEquals(List.of("Orders.completed"), s.defaultSegments());
  }
}
