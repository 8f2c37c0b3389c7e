package io.intellixity.semgate.governance.policy;

import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.PolicyViolation;
import io.intellixity.semgate.governance.catalog.MemberCatalog;
import io.intellixity.semgate.member.Member;
import io.intellixity.semgate.member.MemberKind;
import io.intellixity.semgate.query.QueryFilter;
import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.query.TimeDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Gatekeeper between an incoming query and its execution.\n
 *
 * Validates:\n
 * - limit and offset\n
 * - that something is selected\n
 * - every referenced member: known, exposed, not PII, not on the deny list\n
 * - time dimension targets\n
 * - per-measure group-by rules and required time dimensions\n
 *
 * All findings are collected; nothing stops at the first one.\n
 */
public final class PolicyEnforcer {
  private static final Logger log = LoggerFactory.getLogger(PolicyEnforcer.class);
  private static final int SUGGESTIONS = 5;

  private final MemberCatalog catalog;
  private final PolicySettings settings;

  public PolicyEnforcer(MemberCatalog catalog, PolicySettings settings) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PolicySettings settings() { return settings; }

  public ValidationResult evaluate(SemanticQuery query) {
    Objects.requireNonNull(query, "query");
    List<PolicyViolation> errors = new ArrayList<>();
    List<PolicyViolation> warnings = new ArrayList<>();

    validatePaging(query, errors);
    if (query.measures().isEmpty() && query.dimensions().isEmpty()) {
      errors.add(new PolicyViolation(ErrorCode.EMPTY_QUERY,
          "Query must include at least one measure or dimension", null));
    }
    validateMembers(query, errors);
    validateTimeDimensions(query, errors);
    validateGroupBy(query, errors);

    if (query.dimensions().size() > PolicySettings.MANY_DIMENSIONS) {
      warnings.add(new PolicyViolation(ErrorCode.MANY_DIMENSIONS,
          "Query requests many dimensions (" + query.dimensions().size() + "); results may be sparse", null));
    }
    log.debug("Validated query: {} errors, {} warnings", errors.size(), warnings.size());
    return new ValidationResult(errors, warnings);
  }

  /** Throws {@link io.intellixity.semgate.error.QueryValidationException} carrying every error. */
  public ValidationResult validate(SemanticQuery query) {
    return evaluate(query).throwIfInvalid();
  }

  /** Fills in defaults without removing anything the caller specified. */
  public NormalizedQuery applyDefaults(SemanticQuery query) {
    Objects.requireNonNull(query, "query");
    List<String> notes = new ArrayList<>();
    SemanticQuery out = query;

    Set<String> defaults = new LinkedHashSet<>(settings.defaultSegments());
    defaults.addAll(catalog.defaultSegments());
    List<String> addedSegments = new ArrayList<>();
    for (String s : defaults) {
      if (!out.segments().contains(s)) addedSegments.add(s);
    }
    if (!addedSegments.isEmpty()) {
      List<String> merged = new ArrayList<>(out.segments());
      merged.addAll(addedSegments);
      out = out.withSegments(merged);
      notes.add("Applied default segments: " + String.join(", ", addedSegments));
    }

    Set<String> filtered = new LinkedHashSet<>(out.filterTargets());
    List<QueryFilter> addedFilters = new ArrayList<>();
    for (QueryFilter f : catalog.defaultFilters()) {
      if (filtered.add(f.member())) addedFilters.add(f);
    }
    if (!addedFilters.isEmpty()) {
      List<QueryFilter> merged = new ArrayList<>(out.filters());
      merged.addAll(addedFilters);
      out = out.withFilters(merged);
      notes.add("Applied default filters on: "
          + String.join(", ", addedFilters.stream().map(QueryFilter::member).toList()));
    }

    if (out.limit() == null) {
      out = out.withLimit(PolicySettings.DEFAULT_LIMIT);
      notes.add("Applied default limit: " + PolicySettings.DEFAULT_LIMIT);
    }
    return new NormalizedQuery(out, notes);
  }

  public boolean shouldReturnSql() {
    return settings.returnSql();
  }

  private void validatePaging(SemanticQuery q, List<PolicyViolation> errors) {
    Integer limit = q.limit();
    if (limit == null) {
      errors.add(new PolicyViolation(ErrorCode.MISSING_LIMIT,
          "Query must specify a limit (maximum " + settings.maxLimit() + ")", null, List.of(),
          Map.of("maxLimit", settings.maxLimit())));
    } else if (limit < 1) {
      errors.add(new PolicyViolation(ErrorCode.INVALID_LIMIT, "Limit must be at least 1, got " + limit, null));
    } else if (limit > settings.maxLimit()) {
      errors.add(new PolicyViolation(ErrorCode.LIMIT_EXCEEDED,
          "Limit " + limit + " exceeds the maximum limit of " + settings.maxLimit(), null, List.of(),
          Map.of("limit", limit, "maxLimit", settings.maxLimit())));
    }
    if (q.offset() != null && q.offset() < 0) {
      errors.add(new PolicyViolation(ErrorCode.INVALID_OFFSET, "Offset must not be negative, got " + q.offset(), null));
    }
  }

  private void validateMembers(SemanticQuery q, List<PolicyViolation> errors) {
    for (String name : q.referencedMembers()) {
      if (settings.denyMembers().contains(name)) {
        errors.add(new PolicyViolation(ErrorCode.MEMBER_DENIED, "Member is denied by policy: " + name, name));
      }
      Optional<Member> member = catalog.member(name);
      if (member.isEmpty()) {
        errors.add(new PolicyViolation(ErrorCode.UNKNOWN_MEMBER, "Unknown member: " + name, name,
            catalog.suggestions(name, SUGGESTIONS), Map.of()));
        continue;
      }
      if (!member.get().exposed()) {
        errors.add(new PolicyViolation(ErrorCode.MEMBER_NOT_EXPOSED, "Member is not exposed: " + name, name));
      }
      if (member.get().pii()) {
        errors.add(new PolicyViolation(ErrorCode.PII_MEMBER_BLOCKED, "Member contains PII and cannot be queried: " + name, name));
      }
    }
  }

  private void validateTimeDimensions(SemanticQuery q, List<PolicyViolation> errors) {
    for (TimeDimension td : q.timeDimensions()) {
      Optional<Member> member = catalog.member(td.dimension());
      if (member.isPresent() && member.get().kind() != MemberKind.TIME_DIMENSION) {
        errors.add(new PolicyViolation(ErrorCode.INVALID_TIME_DIMENSION,
            "Not a time dimension: " + td.dimension(), td.dimension()));
      }
    }
  }

  private void validateGroupBy(SemanticQuery q, List<PolicyViolation> errors) {
    Set<String> grouping = q.groupingMembers();
    for (String measureName : new LinkedHashSet<>(q.measures())) {
      Optional<Member> found = catalog.member(measureName);
      if (found.isEmpty() || found.get().override() == null) continue;
      Member measure = found.get();

      if (!measure.allowedGroupBy().isEmpty()) {
        List<String> offending = grouping.stream().filter(d -> !measure.allowedGroupBy().contains(d)).toList();
        if (!offending.isEmpty()) {
          errors.add(new PolicyViolation(ErrorCode.GROUP_BY_NOT_ALLOWED,
              "Measure " + measureName + " cannot be grouped by: " + String.join(", ", offending),
              measureName, List.of(), Map.of("dimensions", offending, "allowed", List.copyOf(measure.allowedGroupBy()))));
        }
      }
      if (!measure.deniedGroupBy().isEmpty()) {
        List<String> offending = grouping.stream().filter(d -> measure.deniedGroupBy().contains(d)).toList();
        if (!offending.isEmpty()) {
          errors.add(new PolicyViolation(ErrorCode.GROUP_BY_DENIED,
              "Measure " + measureName + " must not be grouped by: " + String.join(", ", offending),
              measureName, List.of(), Map.of("dimensions", offending)));
        }
      }
      if (measure.requiresTimeDimension() && q.timeDimensions().isEmpty()) {
        errors.add(new PolicyViolation(ErrorCode.TIME_DIMENSION_REQUIRED,
            "Measure " + measureName + " requires a time dimension", measureName));
      }
    }
  }
}
