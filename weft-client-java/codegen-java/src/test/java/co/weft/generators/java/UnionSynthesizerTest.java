package co.weft.generators.java;

import co.weft.core.SchemaLoader;
import co.weft.core.types.Api;
import co.weft.core.types.Union;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.TypeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class UnionSynthesizerTest {

  private static final String SCHEMA = """
      {"namespaces": [
        {"name": "geo", "structs": [
          {"name": "Point", "fields": [{"name": "x", "type": "Int32"}, {"name": "y", "type": "Int32"}]}
        ]},
        {"name": "paint",
         "unions": [
          {"name": "Color", "doc": "A paint color.", "fields": [
            {"name": "red"}, {"name": "green"},
            {"name": "custom", "type": "UInt32", "constraints": {"max": 16777215}}
          ]},
          {"name": "Status", "catchAll": "other", "fields": [{"name": "ok"}, {"name": "other"}]},
          {"name": "Geometry", "fields": [
            {"name": "point", "type": "geo.Point"},
            {"name": "path", "type": "List", "items": {"type": "geo.Point"}},
            {"name": "blob", "type": "Bytes"},
            {"name": "chunks", "type": "List", "items": {"type": "Bytes"}},
            {"name": "tag", "type": "String"},
            {"name": "geometry"}
          ]}
        ]}
      ]}
      """;

  private Api api;
  private UnionSynthesizer synthesizer;

  @BeforeEach
  void setUp() throws Exception {
    api = SchemaLoader.parse(SCHEMA);
    IdentifierEngine names = new IdentifierEngine();
    TypeMapper types = new TypeMapper(names, "com.example");
    synthesizer = new UnionSynthesizer(names, types, new ConstraintCompiler(names, types), new HierarchyResolver());
  }

  private Union union(String name) {
    return (Union) api.namespace("paint").type(name);
  }

  private String render(String name) {
    TypeSpec spec = synthesizer.synthesize(union(name), List.of());
    return JavaFile.builder("com.example.paint", spec).build().toString();
  }

  @Test
  void baseClassHoldsTagEnumAndPrototypeConstructor() {
    String content = render("Color");

    assertThat(content).contains(" * A paint color.");
    assertThat(content).contains("public class Color implements Encodable<Color> {");
    assertThat(content).contains("public enum Tag {");
    assertThat(content).contains("RED,");
    assertThat(content).contains("CUSTOM");
    assertThat(content).contains("public Color() {");
  }

  @Test
  void closedUnionBaseHasNoTag() {
    String content = render("Color");

    assertThat(content).contains("public Tag tag() {\n    throw new IllegalStateException(\"Color is not one of its variants\");");
    assertThat(content).contains("default -> throw new IllegalStateException(\"Unknown tag '\" + tag + \"' for Color\");");
  }

  @Test
  void openUnionRoutesUnknownTagsToCatchAll() {
    String content = render("Status");

    assertThat(content).contains("return Tag.OTHER;");
    assertThat(content).contains("default -> Other.INSTANCE;");
    assertThat(content).contains("Unrecognized tags decode as {@link Other}.");
  }

  @Test
  void voidVariantsAreSingletons() {
    String content = render("Color");

    assertThat(content).contains("public static final class Red extends Color {");
    assertThat(content).contains("public static final Red INSTANCE = new Red();");
    assertThat(content).contains("private Red() {");
    assertThat(content).contains("return \"Color.Red\";");
    assertThat(content).contains("case \"red\" -> Red.INSTANCE;");
    assertThat(content).contains("case RED -> obj.addTag(\"red\");");
  }

  @Test
  void valueVariantsValidateAndCarryValue() {
    String content = render("Color");

    assertThat(content).contains("public static final class Custom extends Color {");
    assertThat(content).contains("private final long value;");
    assertThat(content).contains("public Custom(long value) {");
    assertThat(content).contains("if (value > 16777215L) {");
    assertThat(content).contains("\"custom must be <= 16777215, got \" + value");
    assertThat(content).contains("public long getValue() {");
    assertThat(content).contains("case \"custom\" -> new Custom(decoder.getObject().getField(\"custom\", Codecs.UINT32));");
    assertThat(content).contains("obj.addField(\"custom\", Codecs.UINT32, asCustom().getValue());");
  }

  @Test
  void variantsRefuseDirectDecoding() {
    String content = render("Color");

    assertThat(content).contains("throw new IllegalStateException(\"Decoding happens through the Color base class\");");
  }

  @Test
  void accessorsTestTheTag() {
    String content = render("Color");

    assertThat(content).contains("public boolean isRed() {");
    assertThat(content).contains("return tag() == Tag.RED;");
    assertThat(content).contains("public Custom asCustom() {");
    assertThat(content).doesNotContain("asRed()");
  }

  @Test
  void variantNamesThatWouldShadowAreRenamed() {
    String content = render("Geometry");

    assertThat(content).contains("public static final class GeometryValue extends Geometry {");
    assertThat(content).contains("public static final class TagValue extends Geometry {");
    assertThat(content).contains("public enum Tag {");
  }

  @Test
  void structNamedLikeVariantIsQualified() {
    String content = render("Geometry");

    assertThat(content).contains("public static final class Point extends Geometry {");
    assertThat(content).contains("private final com.example.geo.Point value;");
    assertThat(content).contains("getFieldObject(\"point\", com.example.geo.Point.class, com.example.geo.Point::new)");
    assertThat(content).doesNotContain("import com.example.geo.Point;");
    assertThat(content).contains("Carries a {@code com.example.geo.Point}.");
  }

  @Test
  void compositeAndListValuesAreNestedUnderVariantName() {
    String content = render("Geometry");

    assertThat(content).contains("obj.addFieldObject(\"point\", asPoint().getValue());");
    assertThat(content).contains("obj.addFieldObjectList(\"path\", asPath().getValue());");
    assertThat(content).contains("this.value = value != null ? new ArrayList<>(value) : new ArrayList<>();");
    assertThat(content).contains("getFieldObjectList(\"path\", com.example.geo.Point.class, com.example.geo.Point::new)");
  }

  @Test
  void binaryVariantComparedByContent() {
    String content = render("Geometry");

    assertThat(content).contains("return Arrays.equals(this.value, ((Blob) o).value);");
    assertThat(content).contains("return Arrays.hashCode(this.value);");
  }

  @Test
  void binaryListVariantComparedElementByElement() {
    String content = render("Geometry");

    assertThat(content).contains("return BinaryLists.equals(this.value, ((Chunks) o).value);");
    assertThat(content).contains("return BinaryLists.hashCode(this.value);");
    assertThat(content).contains("return \"Geometry.Chunks(\" + BinaryLists.toString(this.value) + \")\";");
  }

  @Test
  void listValuesAreHandedOutReadOnly() {
    String content = render("Geometry");

    assertThat(content).contains("return Collections.unmodifiableList(this.value);");
    assertThat(content).contains("public List<byte[]> getValue() {");
  }
}
