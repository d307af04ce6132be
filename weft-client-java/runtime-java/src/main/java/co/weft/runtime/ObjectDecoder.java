package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads the entries of one object. An entry holding JSON {@code null} counts as absent.
 */
public final class ObjectDecoder {
  private final ObjectNode node;

  ObjectDecoder(ObjectNode node) {
    this.node = node;
  }

  public boolean hasField(String name) {
    JsonNode value = node.get(name);
    return value != null && !value.isNull();
  }

  public String getTag() {
    JsonNode tag = node.get(WireFormat.TAG);
    if (tag == null || !tag.isTextual()) throw new DecodingException("missing " + WireFormat.TAG + " entry");
    return tag.textValue();
  }

  public <T> T getField(String name, Codec<T> codec) {
    return decode(name, codec, require(name));
  }

  /** Elements of a list entry; an absent entry reads as an empty list. */
  public <T> List<T> getFieldList(String name, Codec<T> codec) {
    List<T> out = new ArrayList<>();
    if (!hasField(name)) return out;
    for (JsonNode element : requireArray(name)) {
      out.add(decode(name, codec, element));
    }
    return out;
  }

  /**
   * Decode a nested object through a prototype from {@code factory}.
   *
   * @throws DecodingException if the entry is absent or decodes to something that is not a {@code type}
   */
  public <T> T getFieldObject(String name, Class<T> type, Supplier<? extends Encodable<?>> factory) {
    return decodeObject(name, type, factory, require(name));
  }

  /** Nested objects of a list entry; an absent entry reads as an empty list. */
  public <T> List<T> getFieldObjectList(String name, Class<T> type, Supplier<? extends Encodable<?>> factory) {
    List<T> out = new ArrayList<>();
    if (!hasField(name)) return out;
    for (JsonNode element : requireArray(name)) {
      out.add(decodeObject(name, type, factory, element));
    }
    return out;
  }

  private JsonNode require(String name) {
    if (!hasField(name)) throw new DecodingException("missing field " + name);
    return node.get(name);
  }

  private JsonNode requireArray(String name) {
    JsonNode value = node.get(name);
    if (!value.isArray()) throw new DecodingException("field " + name + ": expected an array, got " + value.getNodeType());
    return value;
  }

  private static <T> T decode(String name, Codec<T> codec, JsonNode value) {
    if (value.isNull()) throw new DecodingException("field " + name + ": unexpected null");
    try {
      return codec.decode(value);
    } catch (DecodingException e) {
      throw new DecodingException("field " + name + ": " + e.getMessage(), e);
    }
  }

  private static <T> T decodeObject(String name, Class<T> type, Supplier<? extends Encodable<?>> factory, JsonNode value) {
    if (value.isNull()) throw new DecodingException("field " + name + ": unexpected null");
    Object decoded = factory.get().decode(new Decoder(value));
    if (!type.isInstance(decoded)) {
      throw new DecodingException("field " + name + ": expected " + type.getSimpleName()
          + ", got " + (decoded == null ? "null" : decoded.getClass().getSimpleName()));
    }
    return type.cast(decoded);
  }
}
