package co.weft.runtime;

/**
 * A generated struct or union that can write itself to, and read itself from, the wire.
 *
 * <p>Decoding uses a prototype: create an instance with its no-arg constructor and call
 * {@link #decode}. The returned value may be a different instance, for example the concrete
 * subtype named by a tag.
 *
 * @param <T> the type {@link #decode} produces
 */
public interface Encodable<T> {

  void encode(Encoder encoder);

  T decode(Decoder decoder);
}
