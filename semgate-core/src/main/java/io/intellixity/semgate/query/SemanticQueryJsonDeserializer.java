package io.intellixity.semgate.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link SemanticQuery}.\n
 *
 * Accepts:\n
 * - filters naming their target with either {@code member} or {@code dimension}\n
 * - {@code order} as an object {@code {member: dir}} or an array of {@code [member, dir]} pairs\n
 * - {@code dateRange} as a string or a two-element array\n
 *
 * Unknown top-level keys are ignored here; callers that must reject them check {@link SemanticQuery#ALLOWED_KEYS}.\n
 */
public final class SemanticQueryJsonDeserializer extends JsonDeserializer<SemanticQuery> {
  private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
  private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

  @Override
  public SemanticQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) return ctxt.reportInputMismatch(SemanticQuery.class, "Query JSON must be an object");

    return new SemanticQuery(
        strings(root.get("measures"), "measures", ctxt),
        strings(root.get("dimensions"), "dimensions", ctxt),
        timeDimensions(root.get("timeDimensions"), ctxt),
        filters(root.get("filters"), ctxt),
        strings(root.get("segments"), "segments", ctxt),
        order(root.get("order"), ctxt),
        integer(root.get("limit"), "limit", ctxt),
        integer(root.get("offset"), "offset", ctxt)
    );
  }

  private static List<String> strings(JsonNode n, String field, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) return ctxt.reportInputMismatch(SemanticQuery.class, field + " must be an array of strings");
    List<String> out = new ArrayList<>();
    for (JsonNode x : n) {
      if (!x.isValueNode() || x.isNull()) {
        return ctxt.reportInputMismatch(SemanticQuery.class, field + " must be an array of strings");
      }
      out.add(x.asText());
    }
    return out;
  }

  private static List<TimeDimension> timeDimensions(JsonNode n, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) return ctxt.reportInputMismatch(SemanticQuery.class, "timeDimensions must be an array");
    List<TimeDimension> out = new ArrayList<>();
    for (JsonNode td : n) {
      String dimension = textOrNull(td.get("dimension"));
      if (dimension == null) return ctxt.reportInputMismatch(SemanticQuery.class, "timeDimensions[].dimension is required");
      out.add(new TimeDimension(dimension, textOrNull(td.get("granularity")), dateRange(td.get("dateRange"), ctxt)));
    }
    return out;
  }

  private static DateRange dateRange(JsonNode n, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return null;
    if (n.isTextual()) return DateRange.relative(n.asText());
    if (n.isArray() && n.size() == 2) return DateRange.between(n.get(0).asText(), n.get(1).asText());
    return ctxt.reportInputMismatch(SemanticQuery.class, "dateRange must be a string or a [from, to] pair");
  }

  private static List<QueryFilter> filters(JsonNode n, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) return ctxt.reportInputMismatch(SemanticQuery.class, "filters must be an array");
    List<QueryFilter> out = new ArrayList<>();
    for (JsonNode f : n) {
      String member = textOrNull(f.get("member"));
      if (member == null) member = textOrNull(f.get("dimension"));
      String operator = textOrNull(f.get("operator"));
      if (member == null || operator == null) {
        return ctxt.reportInputMismatch(SemanticQuery.class, "filters[] need a member and an operator");
      }
      out.add(new QueryFilter(member, operator, strings(f.get("values"), "filters[].values", ctxt)));
    }
    return out;
  }

  private static List<OrderBy> order(JsonNode n, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return List.of();
    List<OrderBy> out = new ArrayList<>();
    try {
      if (n.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          out.add(new OrderBy(e.getKey(), OrderBy.Direction.parse(e.getValue().asText())));
        }
        return out;
      }
      if (n.isArray()) {
        for (JsonNode pair : n) {
          if (!pair.isArray() || pair.size() != 2) {
            return ctxt.reportInputMismatch(SemanticQuery.class, "order entries must be [member, direction] pairs");
          }
          out.add(new OrderBy(pair.get(0).asText(), OrderBy.Direction.parse(pair.get(1).asText())));
        }
        return out;
      }
    } catch (IllegalArgumentException e) {
      return ctxt.reportInputMismatch(SemanticQuery.class, e.getMessage());
    }
    return ctxt.reportInputMismatch(SemanticQuery.class, "order must be an object or an array of pairs");
  }

  /** Integral values beyond the int range saturate, so policy reports them as out of range. */
  private static Integer integer(JsonNode n, String field, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return null;
    if (n.isIntegralNumber()) return saturated(n.bigIntegerValue());
    if (n.isTextual()) {
      try {
        return saturated(new BigInteger(n.asText().trim()));
      } catch (NumberFormatException e) {
        return ctxt.reportInputMismatch(SemanticQuery.class, field + " must be an integer");
      }
    }
    return ctxt.reportInputMismatch(SemanticQuery.class, field + " must be an integer");
  }

  private static int saturated(BigInteger v) {
    if (v.compareTo(INT_MAX) > 0) return Integer.MAX_VALUE;
    if (v.compareTo(INT_MIN) < 0) return Integer.MIN_VALUE;
    return v.intValue();
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s == null || s.isBlank() ? null : s;
  }
}
