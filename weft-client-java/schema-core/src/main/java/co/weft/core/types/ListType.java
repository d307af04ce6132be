package co.weft.core.types;

import java.util.Objects;

/**
 * Ordered sequence with optional item-count bounds.
 */
public record ListType(ModeledType elementType, Integer minItems, Integer maxItems) implements ModeledType {

  public ListType {
    Objects.requireNonNull(elementType, "elementType");
  }

  public static ListType of(ModeledType elementType) {
    return new ListType(elementType, null, null);
  }

  @Override
  public String describe() {
    return "List(" + elementType.describe() + ")";
  }
}
