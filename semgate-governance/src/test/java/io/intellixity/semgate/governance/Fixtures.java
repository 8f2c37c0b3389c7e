package io.intellixity.semgate.governance;

import io.intellixity.semgate.spi.meta.CubeMeta;
import io.intellixity.semgate.spi.meta.DimensionMeta;
import io.intellixity.semgate.spi.meta.EngineMeta;
import io.intellixity.semgate.spi.meta.MeasureMeta;
import io.intellixity.semgate.spi.meta.SegmentMeta;

import java.util.List;

/** Engine metadata shared by the governance tests: an Orders cube and a Users cube. */
public final class Fixtures {
  private Fixtures() {}

  public static EngineMeta meta() {
    CubeMeta orders = new CubeMeta("Orders", "Orders", null,
        List.of(
            measure("Orders.count", "Count", "count", null, List.of()),
            measure("Orders.totalRevenue", "Total Revenue", "sum", "Sum of order amounts",
                List.of("Orders.status", "Orders.createdAt"))),
        List.of(
            dimension("Orders.status", "Status", "string", null),
            new DimensionMeta("Orders.createdAt", "Created At", "Created", null, "time", null, null, null, null,
                List.of(new DimensionMeta.GranularityMeta("day", "Day"), new DimensionMeta.GranularityMeta("month", "Month"))),
            new DimensionMeta("Orders.id", "Id", null, null, "number", true, false, null, null, null)),
        List.of(new SegmentMeta("Orders.completed", "Completed", null, "Completed orders", null, null, null)));

    CubeMeta users = new CubeMeta("Users", "Users", null,
        List.of(measure("Users.count", "Users", "count", null, List.of())),
        List.of(
            dimension("Users.city", "City", "string", null),
            dimension("Users.country", "Country", "string", null),
            dimension("Users.email", "Email", "string", "Contact address")),
        List.of());
    return new EngineMeta(List.of(orders, users));
  }

  static MeasureMeta measure(String name, String title, String type, String description, List<String> drill) {
    return new MeasureMeta(name, title, title, description, "number", type, drill, null, null, null, null);
  }

  static DimensionMeta dimension(String name, String title, String type, String description) {
    return new DimensionMeta(name, title, title, description, type, null, null, null, null, null);
  }
}
