package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Receives exactly one encoded value.
 */
public final class Encoder {
  private JsonNode result;

  /** Start an object value and return a writer for its entries. */
  public ObjectEncoder addObject() {
    if (result != null) throw new IllegalStateException("value already written");
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    result = node;
    return new ObjectEncoder(node);
  }

  /** The encoded value, or {@code null} if nothing was written. */
  public JsonNode result() {
    return result;
  }
}
