package io.intellixity.semgate.spi;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semgate.spi.meta.DimensionMeta;
import io.intellixity.semgate.spi.meta.EngineMeta;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EngineResponseJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void readsMetaWithVisibilityFlags() throws Exception {
    String s = """
        {
          "cubes": [{
            "name": "orders", "title": "Orders", "connectedComponent": 1,
            "measures": [{ "name": "orders.count", "title": "Orders Count", "type": "number",
                           "aggType": "count", "isVisible": true, "public": false, "drillMembers": ["orders.id"] }],
            "dimensions": [{ "name": "orders.created_at", "type": "time",
                             "granularities": [{ "name": "day", "title": "day", "interval": "1 day" }] }],
            "segments": []
          }]
        }
        """;
    EngineMeta meta = JSON.readValue(s, EngineMeta.class);
    assertEquals(1, meta.cubes().size());
    assertEquals(Boolean.FALSE, meta.cubes().get(0).measures().get(0).isPublic());
    assertEquals(List.of("orders.id"), meta.cubes().get(0).measures().get(0).drillMembers());
    DimensionMeta created = meta.cubes().get(0).dimensions().get(0);
    assertTrue(created.isTime());
    assertEquals("day", created.granularities().get(0).name());
    assertNull(created.visible());
  }

  @Test
  void keepsAnnotationOrder() throws Exception {
    String s = """
        {
          "data": [ { "orders.status": "paid", "orders.count": "3" } ],
          "annotation": {
            "measures": { "orders.count": { "title": "Orders Count", "type": "number" } },
            "dimensions": {
              "orders.status": { "title": "Status", "type": "string" },
              "orders.city": { "title": "City", "type": "string" }
            }
          },
          "lastRefreshTime": "2024-01-01T00:00:00.000Z"
        }
        """;
    LoadResponse r = JSON.readValue(s, LoadResponse.class);
    assertEquals(1, r.data().size());
    assertEquals(List.of("orders.status", "orders.city"), List.copyOf(r.annotation().dimensions().keySet()));
    assertTrue(r.annotation().timeDimensions().isEmpty());
    assertFalse(r.isContinueWait());
  }

  @Test
  void detectsContinueWait() throws Exception {
    LoadResponse r = JSON.readValue("{\"error\":\"Continue wait\"}", LoadResponse.class);
    assertTrue(r.isContinueWait());
    assertTrue(r.data().isEmpty());
  }

  @Test
  void endpointDropsTrailingSlash() {
    EngineEndpoint e = new EngineEndpoint("db1", "http://cube:4000/cubejs-api/v1/", "s");
    assertEquals("http://cube:4000/cubejs-api/v1", e.apiUrl());
    assertFalse(e.toString().contains("jwtSecret"));
  }
}
