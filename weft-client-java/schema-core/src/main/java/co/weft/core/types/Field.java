package co.weft.core.types;

import java.util.Objects;

/**
 * A struct field.
 *
 * @param defaultValue declared default: a {@link Boolean}, {@link java.math.BigDecimal},
 *                     {@link String}, or for union-typed fields the name of a Void variant;
 *                     {@code null} when none is declared
 */
public record Field(String name, ModeledType type, Object defaultValue, String doc) {

  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }
}
