package io.intellixity.semgate.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link SemanticQuery}; the wire form the semantic engine accepts. */
public final class SemanticQueryJsonSerializer extends JsonSerializer<SemanticQuery> {
  @Override
  public void serialize(SemanticQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    writeStrings(g, "measures", q.measures());
    writeStrings(g, "dimensions", q.dimensions());

    if (!q.timeDimensions().isEmpty()) {
      g.writeArrayFieldStart("timeDimensions");
      for (TimeDimension td : q.timeDimensions()) {
        g.writeStartObject();
        g.writeStringField("dimension", td.dimension());
        if (td.granularity() != null) g.writeStringField("granularity", td.granularity());
        if (td.dateRange() != null) {
          g.writeFieldName("dateRange");
          writeDateRange(td.dateRange(), g);
        }
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.filters().isEmpty()) {
      g.writeArrayFieldStart("filters");
      for (QueryFilter f : q.filters()) {
        g.writeStartObject();
        g.writeStringField("member", f.member());
        g.writeStringField("operator", f.operator());
        if (!f.values().isEmpty()) writeStrings(g, "values", f.values());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    writeStrings(g, "segments", q.segments());

    if (!q.order().isEmpty()) {
      g.writeArrayFieldStart("order");
      for (OrderBy o : q.order()) {
        g.writeStartArray();
        g.writeString(o.member());
        g.writeString(o.direction().wire());
        g.writeEndArray();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());
    g.writeEndObject();
  }

  private static void writeStrings(JsonGenerator g, String field, List<String> values) throws IOException {
    if (values == null || values.isEmpty()) return;
    g.writeArrayFieldStart(field);
    for (String v : values) g.writeString(v);
    g.writeEndArray();
  }

  private static void writeDateRange(DateRange r, JsonGenerator g) throws IOException {
    if (r.isRelative()) {
      g.writeString(r.expression());
      return;
    }
    g.writeStartArray();
    g.writeString(r.from());
    g.writeString(r.to());
    g.writeEndArray();
  }
}
