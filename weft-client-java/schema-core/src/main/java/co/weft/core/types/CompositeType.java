package co.weft.core.types;

import java.util.Objects;

/**
 * A struct or union declared in a namespace. Compared by identity.
 */
public abstract class CompositeType implements ModeledType {
  private final String name;
  private final String doc;
  private final Namespace namespace;

  CompositeType(String name, String doc, Namespace namespace) {
    this.name = Objects.requireNonNull(name, "name");
    this.doc = doc;
    this.namespace = Objects.requireNonNull(namespace, "namespace");
  }

  public String name() {
    return name;
  }

  /** Declared documentation, or {@code null}. */
  public String doc() {
    return doc;
  }

  public Namespace namespace() {
    return namespace;
  }

  /** {@code namespace/Name}, unique across an {@link Api}. */
  public String qualifiedName() {
    return namespace.name() + "/" + name;
  }

  @Override
  public String describe() {
    return name;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + qualifiedName() + ")";
  }
}
