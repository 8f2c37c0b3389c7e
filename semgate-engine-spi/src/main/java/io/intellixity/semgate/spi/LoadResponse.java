package io.intellixity.semgate.spi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine answer to a load request.
 * <p>
 * {@code error} is only set on a 200 answer that is not a result yet (the engine's "Continue wait").
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoadResponse(List<Map<String, Object>> data, Annotation annotation, String error) {
  public static final String CONTINUE_WAIT = "Continue wait";

  public LoadResponse {
    data = data == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
    annotation = annotation == null ? Annotation.EMPTY : annotation;
  }

  public LoadResponse(List<Map<String, Object>> data, Annotation annotation) {
    this(data, annotation, null);
  }

  public boolean isContinueWait() {
    return CONTINUE_WAIT.equals(error);
  }

  /** Column descriptors per member kind; iteration order is the engine's. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Annotation(Map<String, AnnotationEntry> measures,
                           Map<String, AnnotationEntry> dimensions,
                           Map<String, AnnotationEntry> segments,
                           Map<String, AnnotationEntry> timeDimensions) {
    public static final Annotation EMPTY = new Annotation(null, null, null, null);

    public Annotation {
      measures = ordered(measures);
      dimensions = ordered(dimensions);
      segments = ordered(segments);
      timeDimensions = ordered(timeDimensions);
    }

    private static Map<String, AnnotationEntry> ordered(Map<String, AnnotationEntry> in) {
      if (in == null || in.isEmpty()) return Map.of();
      return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AnnotationEntry(String title, String shortTitle, String type, String format, Map<String, Object> meta) {}
}
