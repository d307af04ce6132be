package co.weft.core.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named group of composite types, in declaration order (structs first, then unions).
 */
public final class Namespace {
  private final String name;
  private final String doc;
  private final List<CompositeType> types = new ArrayList<>();

  Namespace(String name, String doc) {
    this.name = Objects.requireNonNull(name, "name");
    this.doc = doc;
  }

  public String name() {
    return name;
  }

  public String doc() {
    return doc;
  }

  public List<CompositeType> types() {
    return Collections.unmodifiableList(types);
  }

  /** Type by schema name, or {@code null}. */
  public CompositeType type(String typeName) {
    for (CompositeType t : types) {
      if (t.name().equals(typeName)) return t;
    }
    return null;
  }

  public List<Struct> structs() {
    List<Struct> out = new ArrayList<>();
    for (CompositeType t : types) {
      if (t instanceof Struct s) out.add(s);
    }
    return out;
  }

  public List<Union> unions() {
    List<Union> out = new ArrayList<>();
    for (CompositeType t : types) {
      if (t instanceof Union u) out.add(u);
    }
    return out;
  }

  void addType(CompositeType type) {
    types.add(type);
  }

  @Override
  public String toString() {
    return "Namespace(" + name + ")";
  }
}
