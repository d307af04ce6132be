package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts one scalar value to and from its wire form.
 *
 * @see Codecs
 */
public interface Codec<T> {

  JsonNode encode(T value);

  /** @throws DecodingException if {@code node} does not hold a valid {@code T} */
  T decode(JsonNode node);
}
