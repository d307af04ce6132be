package co.weft.core.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A record-like composite type. A struct that enumerates subtypes roots a tagged family;
 * its subtypes name it as their parent.
 */
public final class Struct extends CompositeType {

  /**
   * An enumerated subtype and the tag it is written with. The tag is empty for the
   * family's catch-all member.
   */
  public record Subtype(String tag, Struct type) {}

  private final List<Field> fields = new ArrayList<>();
  private final List<Subtype> subtypes = new ArrayList<>();
  private Struct parent;
  private boolean catchAll;

  Struct(String name, String doc, Namespace namespace) {
    super(name, doc, namespace);
  }

  /** Fields declared on this struct only. */
  public List<Field> fields() {
    return Collections.unmodifiableList(fields);
  }

  /** Parent fields followed by own fields, in declaration order. */
  public List<Field> allFields() {
    if (parent == null) return fields();
    List<Field> all = new ArrayList<>(parent.allFields());
    all.addAll(fields);
    return Collections.unmodifiableList(all);
  }

  /** Parent struct, or {@code null} when this struct is not an enumerated subtype. */
  public Struct parent() {
    return parent;
  }

  public List<Subtype> subtypes() {
    return Collections.unmodifiableList(subtypes);
  }

  public boolean hasEnumeratedSubtypes() {
    return !subtypes.isEmpty();
  }

  /** True when this struct absorbs tags its family does not recognize. */
  public boolean isCatchAll() {
    return catchAll;
  }

  void addField(Field field) {
    fields.add(field);
  }

  void setParent(Struct parent) {
    this.parent = parent;
  }

  void addSubtype(Subtype subtype) {
    subtypes.add(subtype);
  }

  void setCatchAll(boolean catchAll) {
    this.catchAll = catchAll;
  }
}
