package co.weft.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw schema document as read from a {@code .weft} / {@code .json} file.
 *
 * <p>Fields are public and mutable on purpose: this is the Jackson binding only. Consumers
 * should work with the resolved {@link co.weft.core.types.Api} returned by
 * {@link co.weft.core.SchemaLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaDocument {
  public List<NamespaceDef> namespaces;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class NamespaceDef {
    public String name;
    @JsonAlias({"doc", "description"})
    public String doc;
    public List<StructDef> structs;
    public List<UnionDef> unions;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class StructDef {
    public String name;
    @JsonAlias({"doc", "description"})
    public String doc;
    /** Name of the parent struct; only set on enumerated subtypes. */
    @JsonProperty("extends")
    public String parent;
    public List<FieldDef> fields;
    public List<SubtypeDef> subtypes;
    /** Marks this struct as the fallback member of its tagged family. */
    public boolean catchAll;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SubtypeDef {
    /** Wire tag; may be left blank for the family's catch-all member. */
    public String tag;
    public String type;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class UnionDef {
    public String name;
    @JsonAlias({"doc", "description"})
    public String doc;
    public List<FieldDef> fields;
    /** Name of the Void field that absorbs unrecognized tags. */
    public String catchAll;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FieldDef {
    public String name;
    /**
     * Type name. Either one of the {@link co.weft.core.FieldType} names or a composite
     * reference ({@code Name} or {@code namespace.Name}). Absent on a union field means Void.
     */
    public String type;
    public boolean nullable;
    @JsonAlias({"default", "defaultValue"})
    public Object defaultValue;
    @JsonAlias({"doc", "description"})
    public String doc;
    public Constraints constraints;
    /** Element type definition for list fields. */
    public ListItems items;
  }

  /**
   * Field-level constraints.
   * Numeric: min, max. String: minLength, maxLength, pattern. List: minItems, maxItems.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Constraints {
    public BigDecimal min;
    public BigDecimal max;

    public Integer minLength;
    public Integer maxLength;
    public String pattern;

    public Integer minItems;
    public Integer maxItems;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ListItems {
    public String type;
  }
}
