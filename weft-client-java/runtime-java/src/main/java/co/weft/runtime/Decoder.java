package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Source of exactly one encoded value.
 */
public final class Decoder {
  private final JsonNode node;

  public Decoder(JsonNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  public ObjectDecoder getObject() {
    if (!node.isObject()) throw new DecodingException("expected an object, got " + node.getNodeType());
    return new ObjectDecoder((ObjectNode) node);
  }

  /**
   * Tag of a union value. Void variants may be written either as a bare string or as an
   * object holding only the tag entry.
   */
  public String getUnionTag() {
    if (node.isTextual()) return node.textValue();
    return getObject().getTag();
  }
}
