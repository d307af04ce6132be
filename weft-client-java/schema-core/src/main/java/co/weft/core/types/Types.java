package co.weft.core.types;

/**
 * Predicates over {@link ModeledType}s. All of them look through a nullable wrapper
 * unless noted otherwise.
 */
public final class Types {

  private Types() {}

  public static boolean isNullable(ModeledType t) {
    return t instanceof NullableType;
  }

  /** Strip the nullable wrapper, if any. */
  public static ModeledType unwrap(ModeledType t) {
    return t instanceof NullableType n ? n.inner() : t;
  }

  public static boolean isVoid(ModeledType t) {
    return unwrap(t) == PrimitiveType.VOID;
  }

  public static boolean isList(ModeledType t) {
    return unwrap(t) instanceof ListType;
  }

  public static boolean isComposite(ModeledType t) {
    return unwrap(t) instanceof CompositeType;
  }

  public static boolean isStruct(ModeledType t) {
    return unwrap(t) instanceof Struct;
  }

  public static boolean isUnion(ModeledType t) {
    return unwrap(t) instanceof Union;
  }

  public static boolean isNumeric(ModeledType t) {
    return unwrap(t) instanceof NumericType;
  }

  public static boolean isString(ModeledType t) {
    return unwrap(t) instanceof StringType;
  }
}
