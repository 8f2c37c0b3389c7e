package io.intellixity.semgate.server;

import io.intellixity.semgate.query.SemanticQuery;
import io.intellixity.semgate.spi.LoadResponse;
import io.intellixity.semgate.spi.SemanticEngineClient;
import io.intellixity.semgate.spi.SqlPreview;
import io.intellixity.semgate.spi.meta.CubeMeta;
import io.intellixity.semgate.spi.meta.DimensionMeta;
import io.intellixity.semgate.spi.meta.EngineMeta;
import io.intellixity.semgate.spi.meta.MeasureMeta;

import java.util.List;
import java.util.Map;

/** Engine with an Orders cube that answers every load with the same rows. */
public final class StubEngine implements SemanticEngineClient {
  public volatile LoadResponse loadResponse = new LoadResponse(
      List.of(Map.of("Orders.status", "completed", "Orders.count", 42)),
      new LoadResponse.Annotation(
          Map.of("Orders.count", new LoadResponse.AnnotationEntry("Count", "Count", "number", null, null)),
          Map.of("Orders.status", new LoadResponse.AnnotationEntry("Status", "Status", "string", null, null)),
          null, null));
  public volatile RuntimeException loadFailure;

  @Override
  public EngineMeta meta() {
    CubeMeta orders = new CubeMeta("Orders", "Orders", null,
        List.of(
            new MeasureMeta("Orders.count", "Count", "Count", null, "number", "count", List.of(), null, null, null, null),
            new MeasureMeta("Orders.totalRevenue", "Total Revenue", "Revenue", "Sum of order amounts", "number", "sum",
                List.of("Orders.status"), null, null, null, null)),
        List.of(
            new DimensionMeta("Orders.status", "Status", "Status", null, "string", null, null, null, null, null),
            new DimensionMeta("Orders.email", "Email", "Email", "Customer email", "string", null, null, null, null, null)),
        List.of());
    return new EngineMeta(List.of(orders));
  }

  @Override
  public LoadResponse load(SemanticQuery query) {
    if (loadFailure != null) throw loadFailure;
    return loadResponse;
  }

  @Override
  public SqlPreview sql(SemanticQuery query) {
    return new SqlPreview("SELECT 1", List.of());
  }
}
