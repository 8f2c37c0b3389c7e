package io.intellixity.semgate.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative semantic-layer query.
 * <p>
 * Immutable: every {@code with*} method returns a copy. Absent collections are empty, absent {@code limit} and
 * {@code offset} are null.
 */
@JsonSerialize(using = SemanticQueryJsonSerializer.class)
@JsonDeserialize(using = SemanticQueryJsonDeserializer.class)
public record SemanticQuery(List<String> measures,
                            List<String> dimensions,
                            List<TimeDimension> timeDimensions,
                            List<QueryFilter> filters,
                            List<String> segments,
                            List<OrderBy> order,
                            Integer limit,
                            Integer offset) {

  /** Top-level keys accepted on the wire. */
  public static final Set<String> ALLOWED_KEYS = Set.of(
      "measures", "dimensions", "timeDimensions", "filters", "segments", "order", "limit", "offset");

  public SemanticQuery {
    measures = copy(measures);
    dimensions = copy(dimensions);
    timeDimensions = copy(timeDimensions);
    filters = copy(filters);
    segments = copy(segments);
    order = copy(order);
  }

  public static SemanticQuery empty() {
    return new SemanticQuery(null, null, null, null, null, null, null, null);
  }

  public SemanticQuery withMeasures(List<String> v) { return new SemanticQuery(v, dimensions, timeDimensions, filters, segments, order, limit, offset); }
  public SemanticQuery withMeasures(String... v) { return withMeasures(List.of(v)); }
  public SemanticQuery withDimensions(List<String> v) { return new SemanticQuery(measures, v, timeDimensions, filters, segments, order, limit, offset); }
  public SemanticQuery withDimensions(String... v) { return withDimensions(List.of(v)); }
  public SemanticQuery withTimeDimensions(List<TimeDimension> v) { return new SemanticQuery(measures, dimensions, v, filters, segments, order, limit, offset); }
  public SemanticQuery withTimeDimensions(TimeDimension... v) { return withTimeDimensions(List.of(v)); }
  public SemanticQuery withFilters(List<QueryFilter> v) { return new SemanticQuery(measures, dimensions, timeDimensions, v, segments, order, limit, offset); }
  public SemanticQuery withFilters(QueryFilter... v) { return withFilters(List.of(v)); }
  public SemanticQuery withSegments(List<String> v) { return new SemanticQuery(measures, dimensions, timeDimensions, filters, v, order, limit, offset); }
  public SemanticQuery withSegments(String... v) { return withSegments(List.of(v)); }
  public SemanticQuery withOrder(List<OrderBy> v) { return new SemanticQuery(measures, dimensions, timeDimensions, filters, segments, v, limit, offset); }
  public SemanticQuery withLimit(Integer v) { return new SemanticQuery(measures, dimensions, timeDimensions, filters, segments, order, v, offset); }
  public SemanticQuery withOffset(Integer v) { return new SemanticQuery(measures, dimensions, timeDimensions, filters, segments, order, limit, v); }

  public List<String> timeDimensionTargets() {
    return timeDimensions.stream().map(TimeDimension::dimension).toList();
  }

  public List<String> filterTargets() {
    return filters.stream().map(QueryFilter::member).toList();
  }

  /** Dimensions and time-dimension targets, in that order, without duplicates. */
  public Set<String> groupingMembers() {
    Set<String> out = new LinkedHashSet<>(dimensions);
    out.addAll(timeDimensionTargets());
    return out;
  }

  /** Every member the query touches: measures, dimensions, segments, time dimensions, filter targets. */
  public Set<String> referencedMembers() {
    Set<String> out = new LinkedHashSet<>(measures);
    out.addAll(dimensions);
    out.addAll(segments);
    out.addAll(timeDimensionTargets());
    out.addAll(filterTargets());
    return out;
  }

  private static <T> List<T> copy(List<T> in) {
    if (in == null || in.isEmpty()) return List.of();
    List<T> out = new ArrayList<>(in.size());
    for (T t : in) if (t != null) out.add(t);
    return List.copyOf(out);
  }
}
