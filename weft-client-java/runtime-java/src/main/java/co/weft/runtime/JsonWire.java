package co.weft.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.function.Supplier;

/**
 * Entry points between generated types and JSON text.
 *
 * <pre>
 *   String json = JsonWire.toJson(person);
 *   Person copy = JsonWire.fromJson(json, Person::new);
 * </pre>
 */
public final class JsonWire {
  private static final ObjectMapper JSON = new ObjectMapper();

  private JsonWire() {}

  public static JsonNode toTree(Encodable<?> value) {
    Encoder encoder = new Encoder();
    value.encode(encoder);
    if (encoder.result() == null) throw new IllegalStateException(value.getClass().getName() + " wrote no value");
    return encoder.result();
  }

  public static <T> T fromTree(JsonNode node, Supplier<? extends Encodable<T>> factory) {
    return factory.get().decode(new Decoder(node));
  }

  public static String toJson(Encodable<?> value) throws JsonProcessingException {
    return JSON.writeValueAsString(toTree(value));
  }

  public static <T> T fromJson(String json, Supplier<? extends Encodable<T>> factory) throws JsonProcessingException {
    return fromTree(JSON.readTree(json), factory);
  }
}
