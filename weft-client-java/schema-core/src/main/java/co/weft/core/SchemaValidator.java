package co.weft.core;

import co.weft.core.model.SchemaDocument;
import co.weft.core.types.ApiResolver;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class SchemaValidator {

  private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

  private static final BigDecimal INT32_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
  private static final BigDecimal INT32_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
  private static final BigDecimal UINT32_MAX = BigDecimal.valueOf(0xFFFFFFFFL);
  private static final BigDecimal INT64_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal INT64_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
  private static final BigDecimal UINT64_MAX = new BigDecimal(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));

  private SchemaValidator() {}

  public static void validate(SchemaDocument doc) {
    if (doc == null) fail("schema document required");
    if (doc.namespaces == null || doc.namespaces.isEmpty()) fail("namespaces must have at least one namespace");

    Map<String, SchemaDocument.StructDef> structs = new HashMap<>();
    Map<String, SchemaDocument.UnionDef> unions = new HashMap<>();

    Set<String> namespaceKeys = new HashSet<>();
    for (SchemaDocument.NamespaceDef ns : doc.namespaces) {
      if (ns == null) fail("namespace entry cannot be null");
      checkName(ns.name, "namespace");
      if (!namespaceKeys.add(identityKey(ns.name))) fail("duplicate namespace " + ns.name);

      Set<String> typeKeys = new HashSet<>();
      for (SchemaDocument.StructDef s : nullSafe(ns.structs)) {
        checkName(s.name, ns.name + ": struct");
        if (!typeKeys.add(identityKey(s.name))) fail(ns.name + ": duplicate type " + s.name);
        structs.put(ns.name + "/" + s.name, s);
      }
      for (SchemaDocument.UnionDef u : nullSafe(ns.unions)) {
        checkName(u.name, ns.name + ": union");
        if (!typeKeys.add(identityKey(u.name))) fail(ns.name + ": duplicate type " + u.name);
        unions.put(ns.name + "/" + u.name, u);
      }
    }

    Context ctx = new Context(structs, unions);
    for (SchemaDocument.NamespaceDef ns : doc.namespaces) {
      for (SchemaDocument.StructDef s : nullSafe(ns.structs)) {
        validateStruct(ctx, ns.name, s);
      }
      for (SchemaDocument.UnionDef u : nullSafe(ns.unions)) {
        validateUnion(ctx, ns.name, u);
      }
    }
  }

  // =========================================================================
  // Structs and tagged families
  // =========================================================================

  private static void validateStruct(Context ctx, String ns, SchemaDocument.StructDef s) {
    String path = ns + "." + s.name;

    Set<String> fieldKeys = new HashSet<>();
    SchemaDocument.StructDef parent = null;
    if (s.parent != null) {
      String parentName = ApiResolver.qualifiedName(s.parent, ns);
      parent = ctx.structs.get(parentName);
      if (parent == null) fail(path + ": parent " + s.parent + " is not a struct");
      if (parent == s) fail(path + ": struct cannot extend itself");
      if (parent.parent != null) fail(path + ": parent " + s.parent + " is itself a subtype; families are single-level");
      if (!listsSubtype(parent, parentName, ns + "/" + s.name)) {
        fail(path + ": parent " + s.parent + " does not list " + s.name + " as a subtype");
      }
      if (s.subtypes != null && !s.subtypes.isEmpty()) {
        fail(path + ": a subtype cannot declare subtypes of its own");
      }
      for (SchemaDocument.FieldDef f : nullSafe(parent.fields)) {
        if (f != null && f.name != null) fieldKeys.add(identityKey(f.name));
      }
    }

    for (SchemaDocument.FieldDef f : nullSafe(s.fields)) {
      if (f == null) fail(path + ": field entry cannot be null");
      checkName(f.name, path + ": field");
      if (!fieldKeys.add(identityKey(f.name))) fail(path + ": duplicate field " + f.name);
      validateStructField(ctx, ns, path + "." + f.name, f);
    }

    if (s.subtypes != null && !s.subtypes.isEmpty()) {
      validateFamily(ctx, ns, path, s);
    } else if (s.catchAll && parent == null) {
      fail(path + ": catchAll is only valid on a struct with subtypes or on one of its subtypes");
    }
  }

  private static void validateFamily(Context ctx, String ns, String path, SchemaDocument.StructDef root) {
    String rootName = ns + "/" + root.name;
    Set<String> tags = new HashSet<>();
    Set<String> members = new HashSet<>();
    int catchAlls = root.catchAll ? 1 : 0;

    for (SchemaDocument.SubtypeDef sub : root.subtypes) {
      if (sub == null || isBlank(sub.type)) fail(path + ": subtype type required");
      String subName = ApiResolver.qualifiedName(sub.type, ns);
      SchemaDocument.StructDef subtype = ctx.structs.get(subName);
      if (subtype == null) fail(path + ": subtype " + sub.type + " is not a struct");
      if (!members.add(subName)) fail(path + ": subtype " + sub.type + " listed twice");
      if (subtype.parent == null
          || !ApiResolver.qualifiedName(subtype.parent, namespaceOf(subName)).equals(rootName)) {
        fail(path + ": subtype " + sub.type + " must extend " + root.name);
      }
      if (subtype.catchAll) {
        catchAlls++;
        continue;
      }
      if (isBlank(sub.tag)) fail(path + ": subtype " + sub.type + " requires a tag");
      if (!tags.add(sub.tag)) fail(path + ": duplicate subtype tag " + sub.tag);
    }

    if (catchAlls > 1) fail(path + ": a tagged family can have at most one catchAll member");
  }

  private static boolean listsSubtype(SchemaDocument.StructDef parent, String parentName, String subName) {
    String parentNs = namespaceOf(parentName);
    for (SchemaDocument.SubtypeDef sub : nullSafe(parent.subtypes)) {
      if (sub != null && sub.type != null && ApiResolver.qualifiedName(sub.type, parentNs).equals(subName)) {
        return true;
      }
    }
    return false;
  }

  private static void validateStructField(Context ctx, String ns, String path, SchemaDocument.FieldDef f) {
    if (isBlank(f.type)) fail(path + ": type required");
    Kind kind = validateType(ctx, ns, path, f);
    if (kind.builtIn == FieldType.VOID) fail(path + ": struct fields cannot be Void");
    if (f.defaultValue != null) validateDefault(ctx, ns, path, f, kind);
  }

  // =========================================================================
  // Unions
  // =========================================================================

  private static void validateUnion(Context ctx, String ns, SchemaDocument.UnionDef u) {
    String path = ns + "." + u.name;
    if (u.fields == null || u.fields.isEmpty()) fail(path + ": union must have at least one field");

    Set<String> fieldKeys = new HashSet<>();
    Map<String, String> variantClasses = new HashMap<>();
    boolean catchAllFound = u.catchAll == null;
    for (SchemaDocument.FieldDef f : u.fields) {
      if (f == null) fail(path + ": field entry cannot be null");
      checkName(f.name, path + ": field");
      if (!fieldKeys.add(identityKey(f.name))) fail(path + ": duplicate field " + f.name);
      String clash = variantClasses.putIfAbsent(variantClassKey(u.name, f.name), f.name);
      if (clash != null) fail(path + ": fields " + clash + " and " + f.name + " map to the same variant class");
      String fieldPath = path + "." + f.name;
      if (f.nullable) fail(fieldPath + ": union fields cannot be nullable");
      if (f.defaultValue != null) fail(fieldPath + ": union fields cannot declare a default");

      boolean isVoid = f.type == null;
      if (!isVoid) {
        isVoid = validateType(ctx, ns, fieldPath, f).builtIn == FieldType.VOID;
      }
      if (f.name.equals(u.catchAll)) {
        if (!isVoid) fail(fieldPath + ": catchAll field must be Void");
        catchAllFound = true;
      }
    }
    if (!catchAllFound) fail(path + ": catchAll field " + u.catchAll + " not found");
  }

  // =========================================================================
  // Types, constraints and defaults
  // =========================================================================

  /** Resolved shape of a field type, enough to validate constraints and defaults. */
  private record Kind(FieldType builtIn, SchemaDocument.StructDef struct, SchemaDocument.UnionDef union) {
    boolean isList() {
      return builtIn == FieldType.LIST;
    }
  }

  private record Context(Map<String, SchemaDocument.StructDef> structs, Map<String, SchemaDocument.UnionDef> unions) {}

  private static Kind validateType(Context ctx, String ns, String path, SchemaDocument.FieldDef f) {
    Kind kind = resolveKind(ctx, ns, path, f.type);
    if (kind.isList()) {
      if (f.items == null || isBlank(f.items.type)) fail(path + ": list fields require items.type");
      Kind element = resolveKind(ctx, ns, path, f.items.type);
      if (element.isList()) fail(path + ": nested lists are not supported");
      if (element.builtIn == FieldType.VOID) fail(path + ": list items cannot be Void");
    }
    validateConstraints(path, f.constraints, kind);
    return kind;
  }

  private static Kind resolveKind(Context ctx, String ns, String path, String type) {
    if (FieldType.isValid(type)) return new Kind(FieldType.fromName(type), null, null);
    String name = ApiResolver.qualifiedName(type, ns);
    SchemaDocument.StructDef s = ctx.structs.get(name);
    if (s != null) return new Kind(null, s, null);
    SchemaDocument.UnionDef u = ctx.unions.get(name);
    if (u != null) return new Kind(null, null, u);
    if (!type.contains(".") && !NAME.matcher(type).matches()) fail(path + ": unsupported type " + type);
    fail(path + ": unresolved type reference " + type);
    return null;
  }

  private static void validateConstraints(String path, SchemaDocument.Constraints c, Kind kind) {
    if (c == null) return;
    FieldType t = kind.builtIn;
    boolean numeric = t != null && t.isNumeric();
    boolean string = t == FieldType.STRING;
    boolean list = t == FieldType.LIST;

    if ((c.min != null || c.max != null) && !numeric) fail(path + ": min/max only apply to numeric fields");
    if ((c.minLength != null || c.maxLength != null || c.pattern != null) && !string) {
      fail(path + ": minLength/maxLength/pattern only apply to String fields");
    }
    if ((c.minItems != null || c.maxItems != null) && !list) fail(path + ": minItems/maxItems only apply to List fields");

    if (numeric) {
      if (c.min != null) checkNumber(path + ": min", t, c.min);
      if (c.max != null) checkNumber(path + ": max", t, c.max);
      if (c.min != null && c.max != null && c.min.compareTo(c.max) > 0) fail(path + ": min must be <= max");
    }
    if (string) {
      if (c.minLength != null && c.minLength < 0) fail(path + ": minLength must be >= 0");
      if (c.maxLength != null && c.maxLength < 0) fail(path + ": maxLength must be >= 0");
      if (c.minLength != null && c.maxLength != null && c.minLength > c.maxLength) {
        fail(path + ": minLength must be <= maxLength");
      }
      if (c.pattern != null) {
        try {
          Pattern.compile(c.pattern);
        } catch (PatternSyntaxException e) {
          throw new IllegalArgumentException(path + ": invalid pattern " + c.pattern, e);
        }
      }
    }
    if (list) {
      if (c.minItems != null && c.minItems < 0) fail(path + ": minItems must be >= 0");
      if (c.maxItems != null && c.maxItems < 0) fail(path + ": maxItems must be >= 0");
      if (c.minItems != null && c.maxItems != null && c.minItems > c.maxItems) {
        fail(path + ": minItems must be <= maxItems");
      }
    }
  }

  private static void validateDefault(Context ctx, String ns, String path, SchemaDocument.FieldDef f, Kind kind) {
    Object value = f.defaultValue;
    if (f.nullable) fail(path + ": nullable fields cannot declare a default");
    if (kind.struct != null) fail(path + ": struct-typed fields cannot declare a default");
    if (kind.union != null) {
      SchemaDocument.FieldDef tag = value instanceof String name ? unionField(kind.union, name) : null;
      if (tag == null || !isVoidField(tag)) {
        fail(path + ": default must name a Void field of " + kind.union.name);
      }
      return;
    }

    SchemaDocument.Constraints c = f.constraints;
    switch (kind.builtIn) {
      case BOOLEAN -> {
        if (!(value instanceof Boolean)) fail(path + ": default must be a boolean");
      }
      case STRING -> {
        if (!(value instanceof String s)) {
          fail(path + ": default must be a string");
          return;
        }
        if (c != null) {
          if (c.minLength != null && s.length() < c.minLength) fail(path + ": default is shorter than minLength");
          if (c.maxLength != null && s.length() > c.maxLength) fail(path + ": default is longer than maxLength");
          if (c.pattern != null && !Pattern.compile(c.pattern).matcher(s).matches()) {
            fail(path + ": default does not match pattern");
          }
        }
      }
      case INT32, UINT32, INT64, UINT64, FLOAT32, FLOAT64 -> {
        if (!(value instanceof Number n)) {
          fail(path + ": default must be a number");
          return;
        }
        BigDecimal d = new BigDecimal(n.toString());
        checkNumber(path + ": default", kind.builtIn, d);
        if (c != null && c.min != null && d.compareTo(c.min) < 0) fail(path + ": default is below min");
        if (c != null && c.max != null && d.compareTo(c.max) > 0) fail(path + ": default is above max");
      }
      default -> fail(path + ": " + kind.builtIn.schemaName() + " fields cannot declare a default");
    }
  }

  private static void checkNumber(String what, FieldType t, BigDecimal value) {
    if (t.isIntegral() && value.stripTrailingZeros().scale() > 0) fail(what + " must be an integer for " + t.schemaName());
    BigDecimal lo = null;
    BigDecimal hi = null;
    switch (t) {
      case INT32 -> { lo = INT32_MIN; hi = INT32_MAX; }
      case UINT32 -> { lo = BigDecimal.ZERO; hi = UINT32_MAX; }
      case INT64 -> { lo = INT64_MIN; hi = INT64_MAX; }
      case UINT64 -> { lo = BigDecimal.ZERO; hi = UINT64_MAX; }
      default -> { }
    }
    if (lo != null && (value.compareTo(lo) < 0 || value.compareTo(hi) > 0)) {
      fail(what + " " + value.toPlainString() + " is out of range for " + t.schemaName());
    }
  }

  private static SchemaDocument.FieldDef unionField(SchemaDocument.UnionDef u, String name) {
    for (SchemaDocument.FieldDef f : nullSafe(u.fields)) {
      if (f != null && name.equals(f.name)) return f;
    }
    return null;
  }

  private static boolean isVoidField(SchemaDocument.FieldDef f) {
    return f.type == null || FieldType.VOID.schemaName().equals(f.type);
  }

  // =========================================================================
  // Names
  // =========================================================================

  private static void checkName(String name, String what) {
    if (isBlank(name)) fail(what + " name required");
    if (!NAME.matcher(name).matches()) fail(what + " name '" + name + "' is not a valid identifier");
  }

  /**
   * Names that differ only by case or {@code _} separators produce the same generated
   * identifiers, so they count as duplicates.
   */
  static String identityKey(String name) {
    return name.replace("_", "").toLowerCase(Locale.ROOT);
  }

  /**
   * Identity of the nested class a union field becomes. A field named like its union, or
   * like the {@code Tag} enum, takes a {@code Value} suffix, so it can meet a field that
   * already carries that suffix.
   */
  static String variantClassKey(String unionName, String fieldName) {
    String key = identityKey(fieldName);
    return key.equals(identityKey(unionName)) || key.equals("tag") ? key + "value" : key;
  }

  private static String namespaceOf(String qualifiedName) {
    return qualifiedName.substring(0, qualifiedName.indexOf('/'));
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list != null ? list : List.of();
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
