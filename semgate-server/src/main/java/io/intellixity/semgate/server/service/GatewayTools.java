package io.intellixity.semgate.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.error.ErrorCode;
import io.intellixity.semgate.error.GatewayException;
import io.intellixity.semgate.error.InvalidRequestException;
import io.intellixity.semgate.governance.Governance;
import io.intellixity.semgate.governance.audit.AuditEvent;
import io.intellixity.semgate.governance.audit.AuditLog;
import io.intellixity.semgate.governance.catalog.CatalogSearch;
import io.intellixity.semgate.governance.catalog.MemberDescription;
import io.intellixity.semgate.governance.catalog.MemberView;
import io.intellixity.semgate.governance.catalog.RelatedMember;
import io.intellixity.semgate.governance.catalog.SearchHit;
import io.intellixity.semgate.governance.handler.DatabaseHandler;
import io.intellixity.semgate.governance.handler.DatabaseHandlerCache;
import io.intellixity.semgate.member.MemberKind;
import io.intellixity.semgate.query.QueryResult;
import io.intellixity.semgate.query.SemanticQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The three gateway tools, bound to one database per call.
 * <p>
 * Arguments arrive as a loosely typed JSON object and are checked here; the handler is resolved through the cache
 * for the tenant bound to the current request. A failing call is audited as an {@code error} event and rethrown.
 */
@Service
public final class GatewayTools {
  private static final Logger log = LoggerFactory.getLogger(GatewayTools.class);

  public static final String CATALOG_SEARCH = "catalog_search";
  public static final String CATALOG_DESCRIBE = "catalog_describe";
  public static final String QUERY_SEMANTIC = "query_semantic";
  public static final List<String> TOOLS = List.of(CATALOG_SEARCH, CATALOG_DESCRIBE, QUERY_SEMANTIC);

  static final int MAX_SEARCH_LIMIT = 50;

  private final DatabaseHandlerCache handlers;
  private final AuditLog audit;
  private final ObjectMapper json;

  public GatewayTools(DatabaseHandlerCache handlers, AuditLog audit, ObjectMapper json) {
    this.handlers = Objects.requireNonNull(handlers, "handlers");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.json = Objects.requireNonNull(json, "json");
  }

  public record SearchArgs(String query, List<String> types, List<String> cubes, Integer limit) {}

  public record DescribeArgs(String member) {}

  public record SearchResult(String name, MemberKind type, String title, String description, String cube, double score) {}

  public record SearchResponse(List<SearchResult> results, int count) {}

  public record DescribeResponse(MemberView member, List<RelatedMember> relatedMembers) {}

  public Object call(String databaseId, String tool, Map<String, Object> args) {
    Objects.requireNonNull(databaseId, "databaseId");
    Map<String, Object> input = args == null ? Map.of() : args;
    log.debug("Tool call {} on {}: {}", tool, databaseId, input);
    try {
      switch (tool) {
        case CATALOG_SEARCH:
          return catalogSearch(databaseId, input);
        case CATALOG_DESCRIBE:
          return catalogDescribe(databaseId, input);
        case QUERY_SEMANTIC:
          return querySemantic(databaseId, input);
        default:
          throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, "Unknown tool: " + tool, TOOLS);
      }
    } catch (RuntimeException e) {
      auditError(databaseId, tool, e);
      throw e;
    }
  }

  public SearchResponse catalogSearch(String databaseId, Map<String, Object> args) {
    SearchArgs a = bind(args, SearchArgs.class);
    if (a.query() == null || a.query().isBlank()) {
      throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, "query is required");
    }
    int limit = a.limit() == null ? CatalogSearch.DEFAULT_LIMIT : a.limit();
    if (limit < 1) throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, "limit must be positive, got " + limit);
    CatalogSearch request = CatalogSearch.of(a.query())
        .withTypes(kinds(a.types()))
        .withCubes(a.cubes() == null ? Set.of() : new LinkedHashSet<>(a.cubes()))
        .withLimit(Math.min(limit, MAX_SEARCH_LIMIT));

    List<SearchResult> results = new ArrayList<>();
    for (SearchHit hit : handler(databaseId).catalogSearch(request)) {
      results.add(new SearchResult(hit.member().name(), hit.member().kind(), hit.member().title(),
          hit.member().description(), hit.member().cubeName(), hit.score()));
    }
    return new SearchResponse(results, results.size());
  }

  public DescribeResponse catalogDescribe(String databaseId, Map<String, Object> args) {
    DescribeArgs a = bind(args, DescribeArgs.class);
    if (a.member() == null || a.member().isBlank()) {
      throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, "member is required");
    }
    MemberDescription d = handler(databaseId).catalogDescribe(a.member());
    return new DescribeResponse(MemberView.of(d.member()), d.relatedMembers());
  }

  public QueryResult querySemantic(String databaseId, Map<String, Object> args) {
    Set<String> unknown = new TreeSet<>(args.keySet());
    unknown.removeAll(SemanticQuery.ALLOWED_KEYS);
    if (!unknown.isEmpty()) {
      throw new InvalidRequestException(ErrorCode.QUERY_KEY_NOT_ALLOWED,
          "Query keys not allowed: " + String.join(", ", unknown), List.copyOf(new TreeSet<>(SemanticQuery.ALLOWED_KEYS)));
    }
    return handler(databaseId).querySemantic(bind(args, SemanticQuery.class));
  }

  private DatabaseHandler handler(String databaseId) {
    return handlers.getHandler(databaseId, Governance.tenantIdOrNull());
  }

  private <T> T bind(Map<String, Object> args, Class<T> type) {
    try {
      return json.convertValue(args, type);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, "Invalid arguments: " + rootMessage(e));
    }
  }

  private static Set<MemberKind> kinds(List<String> types) {
    if (types == null) return Set.of();
    Set<MemberKind> out = new LinkedHashSet<>();
    for (String t : types) {
      try {
        out.add(MemberKind.fromWire(t));
      } catch (IllegalArgumentException e) {
        throw new InvalidRequestException(ErrorCode.INVALID_ARGUMENT, e.getMessage(),
            List.of("measure", "dimension", "timeDimension", "segment"));
      }
    }
    return out;
  }

  private void auditError(String databaseId, String tool, RuntimeException e) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", e instanceof GatewayException g ? g.code().name() : ErrorCode.INTERNAL_ERROR.name());
    error.put("message", String.valueOf(e.getMessage()));
    audit.record(AuditEvent.of(AuditEvent.ERROR, AuditEvent.FAILURE, databaseId, Governance.currentOrNull())
        .with("tool", tool)
        .with("error", error));
  }

  private static String rootMessage(Throwable t) {
    Throwable c = t;
    while (c.getCause() != null && c.getCause() != c) c = c.getCause();
    String m = c.getMessage();
    if (m == null) return c.getClass().getSimpleName();
    int nl = m.indexOf('\n');
    return nl < 0 ? m : m.substring(0, nl);
  }
}
