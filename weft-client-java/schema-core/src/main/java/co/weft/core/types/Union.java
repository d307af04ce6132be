package co.weft.core.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tagged choice between variants. At most one Void variant may be the catch-all.
 */
public final class Union extends CompositeType {
  private final List<UnionField> fields = new ArrayList<>();
  private UnionField catchAllField;

  Union(String name, String doc, Namespace namespace) {
    super(name, doc, namespace);
  }

  public List<UnionField> fields() {
    return Collections.unmodifiableList(fields);
  }

  /** The catch-all variant, or {@code null} when the union is closed. */
  public UnionField catchAllField() {
    return catchAllField;
  }

  /** Variant by schema name, or {@code null}. */
  public UnionField field(String name) {
    for (UnionField f : fields) {
      if (f.name().equals(name)) return f;
    }
    return null;
  }

  void addField(UnionField field) {
    fields.add(field);
  }

  void setCatchAllField(UnionField field) {
    this.catchAllField = field;
  }
}
