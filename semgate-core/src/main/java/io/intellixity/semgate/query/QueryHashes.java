package io.intellixity.semgate.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.semgate.util.Digests;

import java.util.Iterator;
import java.util.TreeMap;

/**
 * Deterministic fingerprint of a query.
 * <p>
 * The query is rendered to its canonical JSON with object keys sorted at every depth (array order kept), then
 * hashed with SHA-256. The first 16 hex characters are the fingerprint.
 */
public final class QueryHashes {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final int LENGTH = 16;

  private QueryHashes() {}

  public static String hash(SemanticQuery query) {
    return Digests.sha256Prefix(canonicalJson(query), LENGTH);
  }

  public static String canonicalJson(SemanticQuery query) {
    JsonNode tree = MAPPER.valueToTree(query);
    try {
      return MAPPER.writeValueAsString(sortKeys(tree));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render query", e);
    }
  }

  private static JsonNode sortKeys(JsonNode n) {
    if (n.isObject()) {
      TreeMap<String, JsonNode> sorted = new TreeMap<>();
      Iterator<String> names = n.fieldNames();
      while (names.hasNext()) {
        String name = names.next();
        sorted.put(name, sortKeys(n.get(name)));
      }
      ObjectNode out = MAPPER.createObjectNode();
      sorted.forEach(out::set);
      return out;
    }
    if (n.isArray()) {
      ArrayNode out = MAPPER.createArrayNode();
      for (JsonNode x : n) out.add(sortKeys(x));
      return out;
    }
    return n;
  }
}
