package co.weft.generators.java;

import co.weft.core.SchemaLoader;
import co.weft.core.types.Api;
import co.weft.generators.java.JavaGenerator.GeneratedUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

public class JavaGeneratorTest {

  private static final String SCHEMA = """
      {"namespaces": [
        {"name": "geo", "doc": "Coordinates and shapes.",
         "structs": [
           {"name": "Point", "fields": [{"name": "x", "type": "Int32"}, {"name": "y", "type": "Int32"}]},
           {"name": "Line", "fields": [
             {"name": "from", "type": "Point"},
             {"name": "to", "type": "Point"}
           ]},
           {"name": "Shape", "fields": [{"name": "label", "type": "String"}],
            "subtypes": [{"tag": "circle", "type": "Circle"}]},
           {"name": "Circle", "extends": "Shape", "fields": [{"name": "radius", "type": "Float64"}]}
         ]},
        {"name": "paint_box",
         "unions": [{"name": "Color", "fields": [{"name": "red"}, {"name": "blue"}]}]}
      ]}
      """;

  @TempDir
  Path tempDir;

  private Api api;
  private JavaGenerator generator;

  @BeforeEach
  void setUp() throws Exception {
    api = SchemaLoader.parse(SCHEMA);
    generator = new JavaGenerator();
  }

  @Test
  void writesOneFilePerTypeUnderNamespacePackages() throws Exception {
    Path out = tempDir.resolve("generated");
    generator.generate(api, "com.example.model", out);

    assertThat(out.resolve("com/example/model/geo/Point.java")).exists();
    assertThat(out.resolve("com/example/model/geo/Line.java")).exists();
    assertThat(out.resolve("com/example/model/geo/Shape.java")).exists();
    assertThat(out.resolve("com/example/model/geo/Circle.java")).exists();
    assertThat(out.resolve("com/example/model/paintbox/Color.java")).exists();
    assertThat(out.resolve("com/example/model/geo/package-info.java")).exists();
    assertThat(out.resolve("com/example/model/paintbox/package-info.java")).exists();
  }

  @Test
  void unitIdsAreNamespaceSlashPublicName() {
    List<String> ids = generator.render(api, "com.example").stream()
        .map(GeneratedUnit::id)
        .collect(Collectors.toList());

    assertThat(ids).containsExactly(
        "geo/package-info", "geo/Point", "geo/Line", "geo/Shape", "geo/Circle",
        "paint_box/package-info", "paint_box/Color");
  }

  @Test
  void filesCarryHeaderAndPackage() throws Exception {
    Path out = tempDir.resolve("generated");
    generator.generate(api, "com.example.model", out);

    String content = Files.readString(out.resolve("com/example/model/geo/Point.java"));
    assertThat(content).startsWith("// Auto-generated by weft, do not modify.");
    assertThat(content).contains("package com.example.model.geo;");
    assertThat(content).doesNotContain("import java.lang.");
    assertThat(content).contains("    private int x;");
  }

  @Test
  void packageInfoCarriesNamespaceDocOrDefaultSentence() throws Exception {
    Path out = tempDir.resolve("generated");
    generator.generate(api, "com.example.model", out);

    String geo = Files.readString(out.resolve("com/example/model/geo/package-info.java"));
    assertThat(geo).startsWith("// Auto-generated by weft, do not modify.");
    assertThat(geo).contains(" * Coordinates and shapes.");
    assertThat(geo).contains("package com.example.model.geo;");

    String paint = Files.readString(out.resolve("com/example/model/paintbox/package-info.java"));
    assertThat(paint).contains(" * Types of the paint box namespace.");
  }

  @Test
  void javadocLinksRelatedTypes() {
    List<GeneratedUnit> units = generator.render(api, "com.example");

    assertThat(source(units, "geo/Point")).contains(" * @see Line");
    assertThat(source(units, "geo/Circle")).contains(" * @see Shape");
    assertThat(source(units, "geo/Shape")).contains(" * @see Circle");
    assertThat(source(units, "geo/Line")).doesNotContain("@see");
  }

  @Test
  void renderingIsDeterministic() {
    List<String> first = generator.render(api, "com.example").stream().map(GeneratedUnit::source).collect(Collectors.toList());
    List<String> second = generator.render(api, "com.example").stream().map(GeneratedUnit::source).collect(Collectors.toList());

    assertThat(first).isEqualTo(second);
  }

  @Test
  void emptyBasePackageWritesNamespacePackagesAtRoot() throws Exception {
    Path out = tempDir.resolve("generated");
    List<GeneratedUnit> units = generator.generate(api, "", out);

    assertThat(out.resolve("geo/Point.java")).exists();
    assertThat(units.get(1).relativePath()).isEqualTo(Path.of("geo", "Point.java"));
  }

  @Test
  void optionsOverloadUsesPackageAndOutput() throws Exception {
    Path out = tempDir.resolve("opts");
    generator.generate(api, new GeneratorOptions(null, SCHEMA, "org.acme", out));

    assertThat(out.resolve("org/acme/geo/Line.java")).exists();
  }

  private static String source(List<GeneratedUnit> units, String id) {
    return units.stream()
        .filter(u -> u.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no unit " + id))
        .source();
  }
}
