package co.weft.core.types;

import co.weft.core.FieldType;
import co.weft.core.model.SchemaDocument;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link Api} type model from a validated {@link SchemaDocument}.
 *
 * <p>All composite types are allocated before any field is wired, so forward and
 * cross-namespace references resolve regardless of declaration order.
 */
public final class ApiResolver {

  private ApiResolver() {}

  public static Api resolve(SchemaDocument doc) {
    List<Namespace> namespaces = new ArrayList<>();
    Map<String, CompositeType> index = new LinkedHashMap<>();

    for (SchemaDocument.NamespaceDef nd : nullSafe(doc.namespaces)) {
      Namespace ns = new Namespace(nd.name, nd.doc);
      namespaces.add(ns);
      for (SchemaDocument.StructDef sd : nullSafe(nd.structs)) {
        Struct s = new Struct(sd.name, sd.doc, ns);
        s.setCatchAll(sd.catchAll);
        ns.addType(s);
        index.put(s.qualifiedName(), s);
      }
      for (SchemaDocument.UnionDef ud : nullSafe(nd.unions)) {
        Union u = new Union(ud.name, ud.doc, ns);
        ns.addType(u);
        index.put(u.qualifiedName(), u);
      }
    }

    for (SchemaDocument.NamespaceDef nd : nullSafe(doc.namespaces)) {
      for (SchemaDocument.StructDef sd : nullSafe(nd.structs)) {
        Struct s = (Struct) index.get(nd.name + "/" + sd.name);
        if (sd.parent != null) {
          s.setParent((Struct) lookup(index, sd.parent, nd.name));
        }
        for (SchemaDocument.SubtypeDef sub : nullSafe(sd.subtypes)) {
          Struct subtype = (Struct) lookup(index, sub.type, nd.name);
          // the catch-all member is written with the empty tag whatever the document says
          String tag = subtype.isCatchAll() ? "" : sub.tag;
          s.addSubtype(new Struct.Subtype(tag, subtype));
        }
        for (SchemaDocument.FieldDef fd : nullSafe(sd.fields)) {
          ModeledType type = resolveType(fd, index, nd.name);
          s.addField(new Field(fd.name, type, normalizeDefault(fd.defaultValue), fd.doc));
        }
      }
      for (SchemaDocument.UnionDef ud : nullSafe(nd.unions)) {
        Union u = (Union) index.get(nd.name + "/" + ud.name);
        for (SchemaDocument.FieldDef fd : nullSafe(ud.fields)) {
          ModeledType type = fd.type == null ? PrimitiveType.VOID : resolveType(fd, index, nd.name);
          UnionField f = new UnionField(fd.name, type, fd.doc);
          u.addField(f);
          if (fd.name.equals(ud.catchAll)) u.setCatchAllField(f);
        }
      }
    }
    return new Api(namespaces);
  }

  /**
   * Qualify a type reference as {@code namespace/Name}. A reference without a dot
   * belongs to {@code currentNamespace}.
   */
  public static String qualifiedName(String reference, String currentNamespace) {
    int dot = reference.lastIndexOf('.');
    if (dot < 0) return currentNamespace + "/" + reference;
    return reference.substring(0, dot) + "/" + reference.substring(dot + 1);
  }

  private static ModeledType resolveType(SchemaDocument.FieldDef fd, Map<String, CompositeType> index, String ns) {
    SchemaDocument.Constraints c = fd.constraints != null ? fd.constraints : new SchemaDocument.Constraints();
    ModeledType base;
    if (FieldType.isValid(fd.type) && FieldType.fromName(fd.type) == FieldType.LIST) {
      ModeledType element = resolveBase(fd.items.type, new SchemaDocument.Constraints(), index, ns);
      base = new ListType(element, c.minItems, c.maxItems);
    } else {
      base = resolveBase(fd.type, c, index, ns);
    }
    return fd.nullable ? new NullableType(base) : base;
  }

  private static ModeledType resolveBase(String typeName, SchemaDocument.Constraints c,
      Map<String, CompositeType> index, String ns) {
    if (!FieldType.isValid(typeName)) return lookup(index, typeName, ns);
    FieldType ft = FieldType.fromName(typeName);
    return switch (ft) {
      case VOID -> PrimitiveType.VOID;
      case BOOLEAN -> PrimitiveType.BOOLEAN;
      case BYTES -> PrimitiveType.BYTES;
      case TIMESTAMP -> PrimitiveType.TIMESTAMP;
      case STRING -> new StringType(c.minLength, c.maxLength, c.pattern);
      case LIST -> throw new IllegalArgumentException("nested lists are not supported");
      default -> new NumericType(ft, c.min, c.max);
    };
  }

  private static CompositeType lookup(Map<String, CompositeType> index, String reference, String ns) {
    CompositeType t = index.get(qualifiedName(reference, ns));
    if (t == null) throw new IllegalArgumentException(ns + ": unresolved type reference " + reference);
    return t;
  }

  private static Object normalizeDefault(Object value) {
    if (value instanceof Number n && !(value instanceof BigDecimal)) {
      return new BigDecimal(n.toString());
    }
    return value;
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list != null ? list : List.of();
  }
}
