package co.weft.core;

import co.weft.core.model.SchemaDocument;
import co.weft.core.types.Api;
import co.weft.core.types.ApiResolver;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class SchemaLoader {
  private static final ObjectMapper JSON = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private SchemaLoader() {}

  /** Read, validate and resolve a schema file. */
  public static Api load(Path path) throws IOException {
    return ApiResolver.resolve(read(path));
  }

  /** Validate and resolve schema text. */
  public static Api parse(String json) throws IOException {
    SchemaDocument doc = JSON.readValue(json, SchemaDocument.class);
    SchemaValidator.validate(doc);
    return ApiResolver.resolve(doc);
  }

  /** Read and validate a schema file without resolving it. */
  public static SchemaDocument read(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    // .weft files are JSON too
    SchemaDocument doc = JSON.readValue(bytes, SchemaDocument.class);
    SchemaValidator.validate(doc);
    return doc;
  }
}
