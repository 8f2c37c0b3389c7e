package io.intellixity.semgate.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.error.UpstreamException;
import io.intellixity.semgate.governance.audit.AuditEvent;
import io.intellixity.semgate.governance.handler.DatabaseHandlerCache;
import io.intellixity.semgate.governance.handler.DefaultDatabaseHandlerFactory;
import io.intellixity.semgate.governance.handler.HandlerCacheSettings;
import io.intellixity.semgate.registry.DatabaseConfig;
import io.intellixity.semgate.registry.DatabaseRegistry;
import io.intellixity.semgate.registry.GovernanceCatalog;
import io.intellixity.semgate.registry.NewDatabase;
import io.intellixity.semgate.registry.RegistrySettings;
import io.intellixity.semgate.registry.store.InMemoryDatabaseStore;
import io.intellixity.semgate.registry.tenant.InMemoryTenantStore;
import io.intellixity.semgate.registry.tenant.TenantRegistry;
import io.intellixity.semgate.server.StubEngine;
import io.intellixity.semgate.server.service.GatewayTools;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class ToolControllerTest {
  private static final String SECRET = "0123456789abcdef0123456789abcdef";
  private static final Map<String, Object> PG = Map.of("type", "postgres", "host", "db", "database", "shop");

  private final Clock clock = Clock.systemUTC();
  private final ObjectMapper json = Jackson2ObjectMapperBuilder.json().build();
  private final StubEngine engine = new StubEngine();
  private final List<AuditEvent> audits = new CopyOnWriteArrayList<>();

  private DatabaseRegistry registry;
  private DatabaseHandlerCache handlers;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    registry = new DatabaseRegistry(new InMemoryDatabaseStore(),
        new RegistrySettings("http://cube:4000/cubejs-api/v1", SECRET, 1000, List.of("Orders.email"), List.of(), false,
            Map.of()), clock);
    GovernanceCatalog governance = new GovernanceCatalog(registry);
    handlers = new DatabaseHandlerCache(registry,
        new DefaultDatabaseHandlerFactory(registry.settings(), governance, ep -> engine, audits::add, clock),
        HandlerCacheSettings.defaults(), clock);
    registry.addListener(handlers);

    GatewayTools tools = new GatewayTools(handlers, audits::add, json);
    mvc = MockMvcBuilders.standaloneSetup(new ToolController(tools, registry, handlers))
        .setControllerAdvice(new GatewayExceptionHandler())
        .addFilters(new TenantGovernanceFilter(new TenantRegistry(new InMemoryTenantStore(), clock)))
        .build();
  }

  private String activeDatabase(String id, String tenantId) {
    DatabaseConfig db = registry.create(NewDatabase.of(id, "Shop", PG), tenantId);
    registry.activate(db.id(), tenantId);
    return db.id();
  }

  private String body(Map<String, Object> args) throws Exception {
    return json.writeValueAsString(args);
  }

  @Test
  void catalogSearch_returnsRankedResultsWithCount() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "revenue"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.results[0].name").value("Orders.totalRevenue"))
        .andExpect(jsonPath("$.results[0].type").value("measure"))
        .andExpect(jsonPath("$.results[0].cube").value("Orders"));

    assertTrue(audits.stream().anyMatch(e -> e.event().equals(AuditEvent.CATALOG_SEARCH)));
  }

  @Test
  void catalogSearch_requiresQuery() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("limit", 5))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
  }

  @Test
  void catalogSearch_rejectsUnknownType() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "count", "types", List.of("cube")))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.suggestions", hasItem("timeDimension")));
  }

  @Test
  void catalogDescribe_returnsMemberAndRelated() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_describe", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("member", "Orders.totalRevenue"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.member.name").value("Orders.totalRevenue"))
        .andExpect(jsonPath("$.member.aggType").value("sum"))
        .andExpect(jsonPath("$.member.exposed").value(true))
        .andExpect(jsonPath("$.relatedMembers[?(@.relationship == 'drill_member')].name", hasItem("Orders.status")));
  }

  @Test
  void catalogDescribe_unknownMemberIs404WithSuggestions() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_describe", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("member", "Orders.statu"))))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.code").value("UNKNOWN_MEMBER"))
        .andExpect(jsonPath("$.error.suggestions", hasItem("Orders.status")));
  }

  @Test
  void querySemantic_returnsGovernedResult() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of(
                "measures", List.of("Orders.count"),
                "dimensions", List.of("Orders.status"),
                "limit", 10))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0]['Orders.count']").value(42))
        .andExpect(jsonPath("$.schema[0].key").value("Orders.count"))
        .andExpect(jsonPath("$.lineage.cubes[0]").value("Orders"))
        .andExpect(jsonPath("$.debug.query_hash").isNotEmpty());
  }

  @Test
  void querySemantic_rejectsKeysOutsideTheAllowList() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("measures", List.of("Orders.count"), "limit", 10, "ungrouped", true))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.code").value("QUERY_KEY_NOT_ALLOWED"))
        .andExpect(jsonPath("$.error.message").value("Query keys not allowed: ungrouped"))
        .andExpect(jsonPath("$.error.suggestions", hasItem("timeDimensions")));

    AuditEvent error = audits.stream().filter(e -> e.event().equals(AuditEvent.ERROR)).findFirst().orElseThrow();
    assertEquals("query_semantic", error.fields().get("tool"));
    assertEquals(id, error.databaseId());
  }

  @Test
  void querySemantic_missingLimitIsAValidationError() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("measures", List.of("Orders.count")))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.code").value("MISSING_LIMIT"))
        .andExpect(jsonPath("$.error.errors[0].code").value("MISSING_LIMIT"));
  }

  @Test
  void querySemantic_limitBeyondIntRangeIsLimitExceeded() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("measures", List.of("Orders.count"), "limit", 5_000_000_000L))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.code").value("LIMIT_EXCEEDED"));
  }

  @Test
  void querySemantic_deniedMemberIsForbidden() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("measures", List.of("Orders.count"), "dimensions", List.of("Orders.email"),
                "limit", 10))))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error.code").value("MEMBER_DENIED"));
  }

  @Test
  void querySemantic_upstreamFailureIsBadGateway() throws Exception {
    String id = activeDatabase("shop", null);
    engine.loadFailure = new UpstreamException("Cube API error: 500", 500, "{\"error\":\"boom\"}", null);

    mvc.perform(post("/api/databases/{id}/tools/query_semantic", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("measures", List.of("Orders.count"), "limit", 10))))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error.code").value("CUBE_ERROR"));

    assertTrue(audits.stream().anyMatch(e -> e.event().equals(AuditEvent.QUERY_EXECUTE)
        && AuditEvent.FAILURE.equals(e.result())));
  }

  @Test
  void unknownDatabaseIs404() throws Exception {
    mvc.perform(post("/api/databases/{id}/tools/catalog_search", "missing")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "count"))))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.code").value("DATABASE_NOT_FOUND"));
  }

  @Test
  void inactiveDatabaseIs503() throws Exception {
    DatabaseConfig db = registry.create(NewDatabase.of("shop", "Shop", PG), null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", db.id())
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "count"))))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error.code").value("DATABASE_NOT_ACTIVE"));
  }

  @Test
  void unknownToolIsRejected() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/drop_table", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.message", startsWith("Unknown tool")))
        .andExpect(jsonPath("$.error.suggestions", hasItem("query_semantic")));
  }

  @Test
  void malformedBodyIsRejected() throws Exception {
    String id = activeDatabase("shop", null);

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
  }

  @Test
  void tenantHeaderScopesDatabaseAccess() throws Exception {
    String id = activeDatabase("shop", "acme");

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .header(TenantGovernanceFilter.TENANT_HEADER, "acme")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "count"))))
        .andExpect(status().isOk());

    mvc.perform(post("/api/databases/{id}/tools/catalog_search", id)
            .header(TenantGovernanceFilter.TENANT_HEADER, "globex")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("query", "count"))))
        .andExpect(status().isNotFound());
  }

  @Test
  void auditCarriesIdentityFromHeaders() throws Exception {
    String id = activeDatabase("shop", "acme");

    mvc.perform(post("/api/databases/{id}/tools/catalog_describe", id)
            .header(TenantGovernanceFilter.TENANT_HEADER, "acme")
            .header(TenantGovernanceFilter.USER_HEADER, "u-7")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("member", "Orders.count"))))
        .andExpect(status().isOk());

    AuditEvent describe = audits.stream()
        .filter(e -> e.event().equals(AuditEvent.CATALOG_DESCRIBE)).findFirst().orElseThrow();
    assertEquals("acme", describe.tenantId());
    assertEquals("u-7", describe.userId());
  }

  @Test
  void health_reportsStoreAndCachedHandlers() throws Exception {
    String id = activeDatabase("shop", null);
    handlers.getHandler(id, null);

    mvc.perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.store").value("memory"))
        .andExpect(jsonPath("$.handlers").value(1));
  }
}
