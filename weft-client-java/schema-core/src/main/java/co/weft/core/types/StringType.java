package co.weft.core.types;

/**
 * Text type with optional length bounds and a full-match pattern.
 */
public record StringType(Integer minLength, Integer maxLength, String pattern) implements ModeledType {

  public static final StringType UNCONSTRAINED = new StringType(null, null, null);

  public boolean hasConstraints() {
    return minLength != null || maxLength != null || pattern != null;
  }

  @Override
  public String describe() {
    return "String";
  }
}
