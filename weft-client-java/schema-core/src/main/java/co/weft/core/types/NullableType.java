package co.weft.core.types;

import java.util.Objects;

/**
 * Marks a field whose value may be absent. Never nested.
 */
public record NullableType(ModeledType inner) implements ModeledType {

  public NullableType {
    Objects.requireNonNull(inner, "inner");
    if (inner instanceof NullableType) throw new IllegalArgumentException("nullable types do not nest");
  }

  @Override
  public String describe() {
    return "Nullable(" + inner.describe() + ")";
  }
}
