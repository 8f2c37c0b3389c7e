package io.intellixity.semgate.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LineageTest {
  @Test
  void collectsMembersOnceInFirstSeenOrder() {
    SemanticQuery q = SemanticQuery.empty()
        .withMeasures("orders.revenue")
        .withDimensions("users.country", "orders.status")
        .withSegments("orders.completed")
        .withTimeDimensions(TimeDimension.of("orders.created_at", "month"))
        .withFilters(QueryFilter.of("orders.status", "equals", "paid"));

    Lineage l = Lineage.of(q);
    assertEquals(List.of("orders.revenue", "users.country", "orders.status", "orders.completed", "orders.created_at"),
        l.members());
    assertEquals(List.of("orders", "users"), l.cubes());
  }

  @Test
  void cubeIsTextBeforeFirstDot() {
    assertEquals("orders", Lineage.cubeOf("orders.meta.total"));
    assertEquals("bare", Lineage.cubeOf("bare"));
  }
}
