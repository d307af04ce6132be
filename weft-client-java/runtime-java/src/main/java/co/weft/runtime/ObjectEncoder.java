package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Writes the entries of one object. A {@code null} value is written as JSON {@code null},
 * which decoders treat as absent.
 */
public final class ObjectEncoder {
  private final ObjectNode node;

  ObjectEncoder(ObjectNode node) {
    this.node = node;
  }

  public ObjectEncoder addTag(String tag) {
    node.put(WireFormat.TAG, tag);
    return this;
  }

  public <T> ObjectEncoder addField(String name, Codec<T> codec, T value) {
    if (value == null) {
      node.putNull(name);
    } else {
      node.set(name, codec.encode(value));
    }
    return this;
  }

  public <T> ObjectEncoder addFieldList(String name, Codec<T> codec, Collection<? extends T> values) {
    if (values == null) {
      node.putNull(name);
      return this;
    }
    ArrayNode array = node.putArray(name);
    for (T value : values) {
      array.add(value == null ? array.nullNode() : codec.encode(value));
    }
    return this;
  }

  public ObjectEncoder addFieldObject(String name, Encodable<?> value) {
    node.set(name, encodeObject(value));
    return this;
  }

  public ObjectEncoder addFieldObjectList(String name, Collection<? extends Encodable<?>> values) {
    if (values == null) {
      node.putNull(name);
      return this;
    }
    ArrayNode array = node.putArray(name);
    for (Encodable<?> value : values) {
      array.add(encodeObject(value));
    }
    return this;
  }

  private JsonNode encodeObject(Encodable<?> value) {
    if (value == null) return node.nullNode();
    Encoder child = new Encoder();
    value.encode(child);
    if (child.result() == null) throw new IllegalStateException(value.getClass().getName() + " wrote no value");
    return child.result();
  }
}
