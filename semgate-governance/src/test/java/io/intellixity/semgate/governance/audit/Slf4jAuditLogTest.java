package io.intellixity.semgate.governance.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.governance.GovernanceContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jAuditLogTest {
  private final ObjectMapper json = new ObjectMapper();

  @Test
  void rendersIdentityThenFields_andDropsNulls() throws Exception {
    AuditEvent e = AuditEvent.of(AuditEvent.QUERY_EXECUTE, AuditEvent.SUCCESS, "db1", GovernanceContext.of("t1", null))
        .with("query_hash", "0123456789abcdef")
        .with("row_count", 3)
        .with("ignored", null)
        .with("members", List.of("Orders.count"));

    String rendered = new Slf4jAuditLog(json).render(e);
    JsonNode n = json.readTree(rendered);

    assertTrue(rendered.startsWith("{\"event\":\"query.execute\",\"result\":\"success\",\"databaseId\":\"db1\""), rendered);
    assertEquals("t1", n.get("tenantId").asText());
    assertFalse(n.has("userId"));
    assertFalse(n.has("ignored"));
    assertEquals(3, n.get("row_count").asInt());
    assertEquals("Orders.count", n.get("members").get(0).asText());
  }

  @Test
  void record_neverThrows() {
    assertDoesNotThrow(() -> new Slf4jAuditLog(json).record(
        AuditEvent.of(AuditEvent.CATALOG_SEARCH, AuditEvent.SUCCESS, "db1", null)));
  }
}
