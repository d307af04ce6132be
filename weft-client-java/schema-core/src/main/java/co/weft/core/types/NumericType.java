package co.weft.core.types;

import co.weft.core.FieldType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fixed-width integer or floating point type with optional inclusive bounds.
 *
 * @param kind one of the numeric {@link FieldType}s
 * @param min lower bound or {@code null}
 * @param max upper bound or {@code null}
 */
public record NumericType(FieldType kind, BigDecimal min, BigDecimal max) implements ModeledType {

  public NumericType {
    Objects.requireNonNull(kind, "kind");
    if (!kind.isNumeric()) throw new IllegalArgumentException("not a numeric type: " + kind);
  }

  public static NumericType of(FieldType kind) {
    return new NumericType(kind, null, null);
  }

  @Override
  public String describe() {
    return kind.schemaName();
  }
}
