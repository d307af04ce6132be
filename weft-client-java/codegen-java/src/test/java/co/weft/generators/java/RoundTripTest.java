package co.weft.generators.java;

import co.weft.core.SchemaLoader;
import co.weft.runtime.Decoder;
import co.weft.runtime.DecodingException;
import co.weft.runtime.Encodable;
import co.weft.runtime.JsonWire;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Generates bindings, compiles them against the wire runtime and exercises them through reflection.
 */
public class RoundTripTest {

  private static final String SCHEMA = """
      {"namespaces": [
        {"name": "geo", "structs": [
          {"name": "Point", "fields": [{"name": "x", "type": "Int32"}, {"name": "y", "type": "Int32"}]}
        ]},
        {"name": "shop",
         "structs": [
           {"name": "Item", "fields": [
             {"name": "code", "type": "String",
              "constraints": {"minLength": 1, "maxLength": 10, "pattern": "^[a-z]+$"}},
             {"name": "qty", "type": "Int32", "default": 1, "constraints": {"min": 1}},
             {"name": "tags", "type": "List", "items": {"type": "String"}},
             {"name": "note", "type": "String", "nullable": true}
           ]},
           {"name": "Shape", "fields": [{"name": "label", "type": "String"}],
            "subtypes": [{"tag": "circle", "type": "Circle"}, {"type": "UnknownShape"}]},
           {"name": "Circle", "extends": "Shape", "fields": [{"name": "radius", "type": "Int32"}]},
           {"name": "UnknownShape", "extends": "Shape", "catchAll": true},
           {"name": "Holder", "fields": [
             {"name": "shape", "type": "Shape"},
             {"name": "color", "type": "Color", "default": "red"},
             {"name": "points", "type": "List", "items": {"type": "geo.Point"}}
           ]},
           {"name": "Blob", "fields": [
             {"name": "data", "type": "Bytes"},
             {"name": "at", "type": "Timestamp"},
             {"name": "big", "type": "UInt64"},
             {"name": "ratio", "type": "Float32"}
           ]},
           {"name": "Blobs", "fields": [{"name": "chunks", "type": "List", "items": {"type": "Bytes"}}]}
         ],
         "unions": [
           {"name": "Color", "fields": [
             {"name": "red"}, {"name": "green"}, {"name": "blue"},
             {"name": "custom", "type": "UInt32"}
           ]},
           {"name": "Geometry", "fields": [
             {"name": "point", "type": "geo.Point"},
             {"name": "labels", "type": "List", "items": {"type": "String"}},
             {"name": "none"}
           ]}
         ]}
      ]}
      """;

  private static final String PKG = "com.example";
  private static final ObjectMapper JSON = new ObjectMapper();

  @TempDir
  static Path tempDir;

  private static URLClassLoader loader;

  @BeforeAll
  static void generateAndCompile() throws Exception {
    Path src = tempDir.resolve("src");
    Path classes = tempDir.resolve("classes");
    Files.createDirectories(classes);
    new JavaGenerator().generate(SchemaLoader.parse(SCHEMA), PKG, src);

    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    assertThat(compiler).as("system Java compiler").isNotNull();

    List<File> sources;
    try (Stream<Path> files = Files.walk(src)) {
      sources = files.filter(p -> p.toString().endsWith(".java")).map(Path::toFile).collect(Collectors.toList());
    }
    String classpath = Stream.of(Encodable.class, JsonNode.class, JsonParser.class, JsonProperty.class)
        .map(RoundTripTest::location)
        .collect(Collectors.joining(File.pathSeparator));

    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    try (StandardJavaFileManager fm = compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
      Iterable<? extends JavaFileObject> units = fm.getJavaFileObjectsFromFiles(sources);
      List<String> options = List.of("-classpath", classpath, "-d", classes.toString(), "-proc:none");
      Boolean ok = compiler.getTask(null, fm, diagnostics, options, null, units).call();
      assertThat(ok).as("compilation: %s", diagnostics.getDiagnostics()).isTrue();
    }

    loader = new URLClassLoader(new URL[] {classes.toUri().toURL()}, RoundTripTest.class.getClassLoader());
  }

  @AfterAll
  static void closeLoader() throws IOException {
    if (loader != null) loader.close();
  }

  // =========================================================================
  // Constructor validation
  // =========================================================================

  @Test
  void stringChecksRunInOrder() throws Exception {
    Class<?> item = type("shop.Item");

    assertThatThrownBy(() -> construct(item, "", 1, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("code must have minimum length 1, got 0");
    assertThatThrownBy(() -> construct(item, "TOOLONGSTRING!", 1, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("code must have maximum length 10, got 14");
    assertThatThrownBy(() -> construct(item, "ABC", 1, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("code must match pattern '^[a-z]+$'");
    assertThatThrownBy(() -> construct(item, null, 1, null, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("code");
    assertThatThrownBy(() -> construct(item, "abc", 0, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("qty must be >= 1, got 0");

    Object ok = construct(item, "abc", 2, null, null);
    assertThat(get(ok, "getCode")).isEqualTo("abc");
    assertThat(get(ok, "getTags")).isEqualTo(List.of());
  }

  @Test
  void builderStartsFromDefaults() throws Exception {
    Class<?> item = type("shop.Item");
    Object builder = item.getMethod("builder").invoke(null);
    builder.getClass().getMethod("code", String.class).invoke(builder, "pen");
    Object built = builder.getClass().getMethod("build").invoke(builder);

    assertThat(get(built, "getQty")).isEqualTo(1);
    assertThat(get(built, "getNote")).isNull();
  }

  // =========================================================================
  // Wire behavior
  // =========================================================================

  @Test
  void absentListDecodesEmptyAndEmptyListIsOmitted() throws Exception {
    Object item = decode("shop.Item", "{\"code\":\"abc\"}");

    assertThat(get(item, "getTags")).isEqualTo(List.of());
    assertThat(get(item, "getQty")).isEqualTo(1);
    assertThat(get(item, "getNote")).isNull();

    JsonNode encoded = JsonWire.toTree((Encodable<?>) item);
    assertThat(encoded.has("tags")).isFalse();
    assertThat(encoded.has("note")).isFalse();
    assertThat(encoded.get("qty").intValue()).isEqualTo(1);
  }

  @Test
  void missingRequiredFieldFailsDecoding() {
    assertThatThrownBy(() -> decode("shop.Item", "{\"qty\":3}"))
        .isInstanceOf(DecodingException.class)
        .hasMessageContaining("code");
  }

  @Test
  void knownTagDecodesToSubtype() throws Exception {
    Object shape = decode("shop.Shape", "{\".tag\":\"circle\",\"label\":\"c\",\"radius\":5}");

    assertThat(shape.getClass().getSimpleName()).isEqualTo("Circle");
    assertThat(get(shape, "getRadius")).isEqualTo(5);
    assertThat(get(shape, "getLabel")).isEqualTo("c");
    assertThat(get(shape, "isCircle")).isEqualTo(true);
  }

  @Test
  void unknownTagDecodesToCatchAllSubtype() throws Exception {
    Object shape = decode("shop.Shape", "{\".tag\":\"hexagon\",\"label\":\"h\",\"sides\":6}");

    assertThat(shape.getClass().getSimpleName()).isEqualTo("UnknownShape");
    assertThat(get(shape, "getLabel")).isEqualTo("h");
  }

  @Test
  void subtypeEncodesItsTagFirst() throws Exception {
    Object circle = construct(type("shop.Circle"), "c", 3);
    JsonNode encoded = JsonWire.toTree((Encodable<?>) circle);

    assertThat(encoded.fieldNames().next()).isEqualTo(".tag");
    assertThat(encoded.get(".tag").textValue()).isEqualTo("circle");
    assertThat(encoded.get("radius").intValue()).isEqualTo(3);
  }

  @Test
  void uint32VariantRejectsValuesOutsideItsWireRange() throws Exception {
    Class<?> custom = type("shop.Color$Custom");

    assertThatThrownBy(() -> construct(custom, -1L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("custom must be >= 0, got -1");
    assertThatThrownBy(() -> construct(custom, 5_000_000_000L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("custom must be <= 4294967295, got 5000000000");
    assertThat(get(construct(custom, 4294967295L), "getValue")).isEqualTo(4294967295L);
  }

  @Test
  void listVariantValueIsReadOnly() throws Exception {
    Object labels = decode("shop.Geometry", "{\".tag\":\"labels\",\"labels\":[\"a\",\"b\"]}");

    @SuppressWarnings("unchecked")
    List<String> value = (List<String>) get(labels, "getValue");
    assertThat(value).containsExactly("a", "b");
    assertThatThrownBy(value::clear).isInstanceOf(UnsupportedOperationException.class);
    assertThat(roundTrip("shop.Geometry", labels)).isEqualTo(labels);
  }

  @Test
  void closedUnionRejectsUnknownTag() {
    assertThatThrownBy(() -> decode("shop.Color", "\"purple\""))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Unknown tag 'purple' for Color");
  }

  @Test
  void voidVariantsDecodeFromStringOrObject() throws Exception {
    Object red = decode("shop.Color", "\"red\"");
    Object green = decode("shop.Color", "{\".tag\":\"green\"}");

    assertThat(red).isSameAs(type("shop.Color$Red").getField("INSTANCE").get(null));
    assertThat(green).isSameAs(type("shop.Color$Green").getField("INSTANCE").get(null));
  }

  @Test
  void valueVariantCarriesEntryNamedAfterVariant() throws Exception {
    Object custom = decode("shop.Color", "{\".tag\":\"custom\",\"custom\":4278190080}");

    assertThat(get(custom, "getValue")).isEqualTo(4278190080L);
    JsonNode encoded = JsonWire.toTree((Encodable<?>) custom);
    assertThat(encoded.get(".tag").textValue()).isEqualTo("custom");
    assertThat(encoded.get("custom").longValue()).isEqualTo(4278190080L);
  }

  @Test
  void variantsCannotBeDecodedDirectly() throws Exception {
    Object red = type("shop.Color$Red").getField("INSTANCE").get(null);

    assertThatThrownBy(() -> ((Encodable<?>) red).decode(new Decoder(JSON.readTree("\"red\""))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Decoding happens through the Color base class");
  }

  @Test
  void unionVariantShadowingStructNameCompilesAndDecodes() throws Exception {
    Object geometry = decode("shop.Geometry", "{\".tag\":\"point\",\"point\":{\"x\":1,\"y\":2}}");

    assertThat(geometry.getClass().getSimpleName()).isEqualTo("Point");
    Object point = get(geometry, "getValue");
    assertThat(point).isEqualTo(construct(type("geo.Point"), 1, 2));
  }

  // =========================================================================
  // Round trip
  // =========================================================================

  @Test
  void nestedValuesRoundTrip() throws Exception {
    Object circle = construct(type("shop.Circle"), "wheel", 7);
    Object green = type("shop.Color$Green").getField("INSTANCE").get(null);
    List<Object> points = List.of(construct(type("geo.Point"), 1, 2), construct(type("geo.Point"), -3, 4));
    Object holder = construct(type("shop.Holder"), circle, green, points);

    Object copy = roundTrip("shop.Holder", holder);

    assertThat(copy).isEqualTo(holder);
    assertThat(copy).isNotSameAs(holder);
    assertThat(get(copy, "getShape").getClass().getSimpleName()).isEqualTo("Circle");
  }

  @Test
  void absentUnionFieldTakesDefault() throws Exception {
    Object holder = decode("shop.Holder", "{\"shape\":{\".tag\":\"circle\",\"label\":\"x\",\"radius\":1}}");

    assertThat(get(holder, "getColor")).isSameAs(type("shop.Color$Red").getField("INSTANCE").get(null));
  }

  @Test
  void scalarEdgeValuesRoundTrip() throws Exception {
    Object blob = construct(type("shop.Blob"),
        new byte[] {1, 2, 3}, Instant.parse("2024-05-01T10:15:30Z"), -1L, 0.5F);

    JsonNode encoded = JsonWire.toTree((Encodable<?>) blob);
    assertThat(encoded.get("data").textValue()).isEqualTo("AQID");
    assertThat(encoded.get("at").textValue()).isEqualTo("2024-05-01T10:15:30Z");
    assertThat(encoded.get("big").toString()).isEqualTo("18446744073709551615");

    assertThat(roundTrip("shop.Blob", blob)).isEqualTo(blob);
  }

  @Test
  void binaryListsCompareByContent() throws Exception {
    Object blobs = construct(type("shop.Blobs"), List.of(new byte[] {1, 2}, new byte[] {}));
    Object same = construct(type("shop.Blobs"), List.of(new byte[] {1, 2}, new byte[] {}));

    assertThat(same).isEqualTo(blobs);
    assertThat(same.hashCode()).isEqualTo(blobs.hashCode());
    assertThat(blobs.toString()).isEqualTo("Blobs{chunks=[[1, 2], []]}");
    assertThat(roundTrip("shop.Blobs", blobs)).isEqualTo(blobs);
  }

  @Test
  void unknownShapeRoundTripsThroughEmptyTag() throws Exception {
    Object unknown = construct(type("shop.UnknownShape"), "blob");
    JsonNode encoded = JsonWire.toTree((Encodable<?>) unknown);

    assertThat(encoded.get(".tag").textValue()).isEmpty();
    assertThat(roundTrip("shop.Shape", unknown)).isEqualTo(unknown);
  }

  // =========================================================================
  // Reflection helpers
  // =========================================================================

  private static Class<?> type(String name) throws ClassNotFoundException {
    return Class.forName(PKG + "." + name, true, loader);
  }

  private static Object construct(Class<?> type, Object... args) throws Exception {
    for (Constructor<?> c : type.getConstructors()) {
      if (c.getParameterCount() != args.length) continue;
      try {
        return c.newInstance(args);
      } catch (InvocationTargetException e) {
        if (e.getCause() instanceof RuntimeException re) throw re;
        throw e;
      }
    }
    throw new AssertionError("no public constructor of " + type.getName() + " takes " + args.length + " arguments");
  }

  private static Object get(Object target, String method) throws Exception {
    return target.getClass().getMethod(method).invoke(target);
  }

  private static Object decode(String typeName, String json) throws Exception {
    Encodable<?> prototype = (Encodable<?>) type(typeName).getConstructor().newInstance();
    return prototype.decode(new Decoder(JSON.readTree(json)));
  }

  private static Object roundTrip(String typeName, Object value) throws Exception {
    String json = JSON.writeValueAsString(JsonWire.toTree((Encodable<?>) value));
    return decode(typeName, json);
  }

  private static String location(Class<?> type) {
    try {
      return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }
}
