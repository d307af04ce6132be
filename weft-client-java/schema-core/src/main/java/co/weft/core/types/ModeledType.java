package co.weft.core.types;

/**
 * A type a field, list element or union variant can carry.
 *
 * @see Types
 */
public interface ModeledType {

  /** Short name used in generated prose and error messages, e.g. {@code List(String)}. */
  String describe();
}
