package io.intellixity.semgate.governance.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Weighted multi-field approximate text index.
 * <p>
 * Each field value is matched against the whole pattern with an approximate substring search (edit distance, free
 * start and end in the value), case-insensitive and location-insensitive. A field matches when
 * {@code errors / patternLength <= threshold} and the aligned span covers at least {@code minMatchLength}
 * characters. An item's distance is the product over its matching fields of
 * {@code fieldScore ^ (weight * lengthNorm)}, where an exact match counts as a tiny epsilon and
 * {@code lengthNorm = 1 / sqrt(wordCount)}; so more, better and shorter matching fields rank first.
 * Relevance is {@code 1 - distance}.
 * <p>
 * Immutable once built; safe for concurrent searches.
 */
public final class FuzzyIndex<T> {
  private static final double EPSILON = Math.ulp(1.0);

  private final List<Field<T>> fields;
  private final double threshold;
  private final int minMatchLength;
  private final List<Doc<T>> docs;

  /** A searchable field. Weights are normalized to sum to 1. */
  public record Field<T>(String name, double weight, Function<T, String> extractor) {
    public Field {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(extractor, "extractor");
      if (weight <= 0) throw new IllegalArgumentException("weight must be > 0");
    }
  }

  /** Inclusive character range of a match within a field value. */
  public record Range(int start, int end) {
    @JsonValue
    public int[] pair() { return new int[] {start, end}; }
  }

  public record FieldMatch(String key, String value, List<Range> indices) {
    public FieldMatch {
      indices = List.copyOf(indices);
    }
  }

  /** {@code score} is relevance in [0, 1], higher is better. */
  public record Match<T>(T item, double score, List<FieldMatch> matches) {
    public Match {
      matches = List.copyOf(matches);
    }
  }

  private record Doc<T>(T item, int position, String[] raw, String[] lower, double[] norms) {}

  record Alignment(int errors, int start, int end) {
    int span() { return end - start + 1; }
  }

  public FuzzyIndex(List<Field<T>> fields, double threshold, int minMatchLength, Iterable<T> items) {
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) throw new IllegalArgumentException("fields is empty");
    if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("threshold must be within [0, 1]");
    if (minMatchLength < 1) throw new IllegalArgumentException("minMatchLength must be >= 1");
    double total = 0;
    for (Field<T> f : fields) total += f.weight();
    List<Field<T>> normalized = new ArrayList<>(fields.size());
    for (Field<T> f : fields) normalized.add(new Field<>(f.name(), f.weight() / total, f.extractor()));
    this.fields = List.copyOf(normalized);
    this.threshold = threshold;
    this.minMatchLength = minMatchLength;

    List<Doc<T>> out = new ArrayList<>();
    int pos = 0;
    for (T item : Objects.requireNonNull(items, "items")) {
      String[] raw = new String[this.fields.size()];
      String[] lower = new String[raw.length];
      double[] norms = new double[raw.length];
      for (int i = 0; i < raw.length; i++) {
        String v = this.fields.get(i).extractor().apply(item);
        if (v == null || v.isEmpty()) continue;
        raw[i] = v;
        lower[i] = v.toLowerCase(Locale.ROOT);
        norms[i] = lengthNorm(v);
      }
      out.add(new Doc<>(item, pos++, raw, lower, norms));
    }
    this.docs = List.copyOf(out);
  }

  public int size() { return docs.size(); }

  /** All matches, best first; ties keep insertion order. A blank pattern matches nothing. */
  public List<Match<T>> search(String pattern) {
    return search(pattern, Integer.MAX_VALUE);
  }

  public List<Match<T>> search(String pattern, int limit) {
    if (pattern == null || pattern.isBlank() || limit <= 0) return List.of();
    String p = pattern.trim().toLowerCase(Locale.ROOT);

    record Scored<T>(Doc<T> doc, double distance, List<FieldMatch> matches) {}
    List<Scored<T>> scored = new ArrayList<>();
    for (Doc<T> d : docs) {
      double distance = 1.0;
      boolean any = false;
      List<FieldMatch> matches = new ArrayList<>();
      for (int i = 0; i < fields.size(); i++) {
        if (d.lower()[i] == null) continue;
        Alignment a = align(p, d.lower()[i]);
        double fieldScore = (double) a.errors() / p.length();
        if (fieldScore > threshold || a.span() < minMatchLength) continue;
        any = true;
        distance *= Math.pow(fieldScore == 0 ? EPSILON : fieldScore, fields.get(i).weight() * d.norms()[i]);
        matches.add(new FieldMatch(fields.get(i).name(), d.raw()[i], List.of(new Range(a.start(), a.end()))));
      }
      if (any) scored.add(new Scored<>(d, distance, matches));
    }
    scored.sort(Comparator.<Scored<T>>comparingDouble(Scored::distance)
        .thenComparingInt(s -> s.doc().position()));

    List<Match<T>> out = new ArrayList<>(Math.min(limit, scored.size()));
    for (Scored<T> s : scored) {
      if (out.size() >= limit) break;
      out.add(new Match<>(s.doc().item(), 1.0 - s.distance(), s.matches()));
    }
    return out;
  }

  /**
   * Best approximate occurrence of {@code p} anywhere in {@code t} (Sellers' algorithm): minimal edit distance with
   * free leading and trailing text, plus the span of {@code t} it aligns to.
   */
  static Alignment align(String p, String t) {
    int m = p.length();
    int[] col = new int[m + 1];
    int[] start = new int[m + 1];
    for (int i = 0; i <= m; i++) col[i] = i;

    int bestErrors = m;
    int bestStart = 0;
    int bestEnd = -1;
    int[] next = new int[m + 1];
    int[] nextStart = new int[m + 1];
    for (int j = 1; j <= t.length(); j++) {
      char c = t.charAt(j - 1);
      next[0] = 0;
      nextStart[0] = j;
      for (int i = 1; i <= m; i++) {
        int sub = col[i - 1] + (p.charAt(i - 1) == c ? 0 : 1);
        int skipText = col[i] + 1;
        int skipPattern = next[i - 1] + 1;
        if (sub <= skipText && sub <= skipPattern) {
          next[i] = sub;
          nextStart[i] = start[i - 1];
        } else if (skipText <= skipPattern) {
          next[i] = skipText;
          nextStart[i] = start[i];
        } else {
          next[i] = skipPattern;
          nextStart[i] = nextStart[i - 1];
        }
      }
      if (next[m] < bestErrors) {
        bestErrors = next[m];
        bestStart = nextStart[m];
        bestEnd = j - 1;
      }
      int[] tmp = col; col = next; next = tmp;
      tmp = start; start = nextStart; nextStart = tmp;
    }
    // an alignment made only of skipped pattern characters has no span of its own
    if (bestEnd >= 0 && bestStart > bestEnd) bestStart = bestEnd;
    return new Alignment(bestErrors, bestStart, bestEnd);
  }

  /** 1 / sqrt(number of space-separated words), rounded to 3 decimals. */
  static double lengthNorm(String value) {
    int words = 0;
    boolean inWord = false;
    for (int i = 0; i < value.length(); i++) {
      boolean space = value.charAt(i) == ' ';
      if (!space && !inWord) words++;
      inWord = !space;
    }
    if (words == 0) words = 1;
    return Math.round(1000.0 / Math.sqrt(words)) / 1000.0;
  }
}
