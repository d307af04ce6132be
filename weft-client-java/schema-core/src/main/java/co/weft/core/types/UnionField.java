package co.weft.core.types;

import java.util.Objects;

/**
 * A union variant. Carries no value when its type is Void.
 */
public record UnionField(String name, ModeledType type, String doc) {

  public UnionField {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public boolean isVoid() {
    return Types.isVoid(type);
  }
}
