package io.intellixity.semgate.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SemanticQueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesFullQuery() throws Exception {
    String s = """
        {
          "measures": ["orders.revenue"],
          "dimensions": ["orders.status"],
          "timeDimensions": [
            { "dimension": "orders.created_at", "granularity": "month", "dateRange": "last 30 days" },
            { "dimension": "orders.shipped_at", "dateRange": ["2024-01-01", "2024-01-31"] }
          ],
          "filters": [ { "member": "orders.status", "operator": "equals", "values": ["paid"] } ],
          "segments": ["orders.completed"],
          "order": { "orders.revenue": "desc" },
          "limit": 50,
          "offset": 10
        }
        """;
    SemanticQuery q = JSON.readValue(s, SemanticQuery.class);
    assertEquals(List.of("orders.revenue"), q.measures());
    assertEquals(2, q.timeDimensions().size());
    assertTrue(q.timeDimensions().get(0).dateRange().isRelative());
    assertEquals("2024-01-31", q.timeDimensions().get(1).dateRange().to());
    assertNull(q.timeDimensions().get(1).granularity());
    assertEquals(List.of("paid"), q.filters().get(0).values());
    assertEquals(new OrderBy("orders.revenue", OrderBy.Direction.DESC), q.order().get(0));
    assertEquals(50, q.limit());
    assertEquals(10, q.offset());
  }

  @Test
  void acceptsLegacyDimensionKeyOnFilters() throws Exception {
    SemanticQuery q = JSON.readValue(
        "{\"filters\":[{\"dimension\":\"users.country\",\"operator\":\"set\"}]}", SemanticQuery.class);
    assertEquals("users.country", q.filters().get(0).member());
    assertTrue(q.filters().get(0).values().isEmpty());
  }

  @Test
  void acceptsOrderAsPairs() throws Exception {
    SemanticQuery q = JSON.readValue(
        "{\"order\":[[\"orders.count\",\"asc\"],[\"orders.status\",\"desc\"]]}", SemanticQuery.class);
    assertEquals(2, q.order().size());
    assertEquals(OrderBy.Direction.DESC, q.order().get(1).direction());
  }

  @Test
  void omitsEmptyFieldsWhenWriting() {
    JsonNode n = JSON.valueToTree(SemanticQuery.empty().withMeasures("orders.count").withLimit(5));
    assertEquals(2, n.size());
    assertEquals("orders.count", n.get("measures").get(0).asText());
    assertEquals(5, n.get("limit").asInt());
    assertFalse(n.has("offset"));
  }

  @Test
  void writesOrderAsPairs() {
    JsonNode n = JSON.valueToTree(SemanticQuery.empty()
        .withOrder(List.of(new OrderBy("orders.count", OrderBy.Direction.DESC))));
    assertEquals("orders.count", n.get("order").get(0).get(0).asText());
    assertEquals("desc", n.get("order").get(0).get(1).asText());
  }

  @Test
  void rejectsNonIntegerLimit() {
    assertThrows(MismatchedInputException.class,
        () -> JSON.readValue("{\"limit\": 10.5}", SemanticQuery.class));
  }

  @Test
  void oversizedIntegersSaturate() throws Exception {
    SemanticQuery q = JSON.readValue("{\"limit\": 5000000000, \"offset\": \"-5000000000\"}", SemanticQuery.class);
    assertEquals(Integer.MAX_VALUE, q.limit());
    assertEquals(Integer.MIN_VALUE, q.offset());
  }

  @Test
  void rejectsUnknownOrderDirection() {
    assertThrows(MismatchedInputException.class,
        () -> JSON.readValue("{\"order\": {\"orders.count\": \"sideways\"}}", SemanticQuery.class));
  }
}
