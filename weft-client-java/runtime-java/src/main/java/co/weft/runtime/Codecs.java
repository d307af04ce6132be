package co.weft.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Codecs for the built-in schema types.
 *
 * <pre>
 *   BOOLEAN    Boolean   true / false
 *   INT32      Integer   number
 *   UINT32     Long      number in [0, 2^32)
 *   INT64      Long      number
 *   UINT64     Long      number in [0, 2^64), bits reinterpreted as unsigned
 *   FLOAT32    Float     number
 *   FLOAT64    Double    number
 *   STRING     String    string
 *   BINARY     byte[]    base64 string
 *   TIMESTAMP  Instant   ISO-8601 instant string
 * </pre>
 */
public final class Codecs {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final BigInteger UINT64_LIMIT = BigInteger.ONE.shiftLeft(64);
  private static final long UINT32_MAX = 0xFFFFFFFFL;

  private Codecs() {}

  public static final Codec<Boolean> BOOLEAN = new Codec<>() {
    @Override
    public JsonNode encode(Boolean value) {
      return NODES.booleanNode(value);
    }

    @Override
    public Boolean decode(JsonNode node) {
      if (!node.isBoolean()) throw mismatch("boolean", node);
      return node.booleanValue();
    }
  };

  public static final Codec<Integer> INT32 = new Codec<>() {
    @Override
    public JsonNode encode(Integer value) {
      return NODES.numberNode(value);
    }

    @Override
    public Integer decode(JsonNode node) {
      if (!node.isIntegralNumber() || !node.canConvertToInt()) throw mismatch("Int32", node);
      return node.intValue();
    }
  };

  public static final Codec<Long> UINT32 = new Codec<>() {
    @Override
    public JsonNode encode(Long value) {
      return NODES.numberNode(value);
    }

    @Override
    public Long decode(JsonNode node) {
      if (!node.isIntegralNumber() || !node.canConvertToLong()) throw mismatch("UInt32", node);
      long v = node.longValue();
      if (v < 0 || v > UINT32_MAX) throw mismatch("UInt32", node);
      return v;
    }
  };

  public static final Codec<Long> INT64 = new Codec<>() {
    @Override
    public JsonNode encode(Long value) {
      return NODES.numberNode(value);
    }

    @Override
    public Long decode(JsonNode node) {
      if (!node.isIntegralNumber() || !node.canConvertToLong()) throw mismatch("Int64", node);
      return node.longValue();
    }
  };

  public static final Codec<Long> UINT64 = new Codec<>() {
    @Override
    public JsonNode encode(Long value) {
      return NODES.numberNode(new BigInteger(Long.toUnsignedString(value)));
    }

    @Override
    public Long decode(JsonNode node) {
      if (!node.isIntegralNumber()) throw mismatch("UInt64", node);
      BigInteger v = node.bigIntegerValue();
      if (v.signum() < 0 || v.compareTo(UINT64_LIMIT) >= 0) throw mismatch("UInt64", node);
      return v.longValue();
    }
  };

  public static final Codec<Float> FLOAT32 = new Codec<>() {
    @Override
    public JsonNode encode(Float value) {
      return NODES.numberNode(value);
    }

    @Override
    public Float decode(JsonNode node) {
      if (!node.isNumber()) throw mismatch("Float32", node);
      return node.floatValue();
    }
  };

  public static final Codec<Double> FLOAT64 = new Codec<>() {
    @Override
    public JsonNode encode(Double value) {
      return NODES.numberNode(value);
    }

    @Override
    public Double decode(JsonNode node) {
      if (!node.isNumber()) throw mismatch("Float64", node);
      return node.doubleValue();
    }
  };

  public static final Codec<String> STRING = new Codec<>() {
    @Override
    public JsonNode encode(String value) {
      return NODES.textNode(value);
    }

    @Override
    public String decode(JsonNode node) {
      if (!node.isTextual()) throw mismatch("String", node);
      return node.textValue();
    }
  };

  public static final Codec<byte[]> BINARY = new Codec<>() {
    @Override
    public JsonNode encode(byte[] value) {
      return NODES.textNode(Base64.getEncoder().encodeToString(value));
    }

    @Override
    public byte[] decode(JsonNode node) {
      if (!node.isTextual()) throw mismatch("Bytes", node);
      try {
        return Base64.getDecoder().decode(node.textValue());
      } catch (IllegalArgumentException e) {
        throw new DecodingException("invalid base64 value", e);
      }
    }
  };

  public static final Codec<Instant> TIMESTAMP = new Codec<>() {
    @Override
    public JsonNode encode(Instant value) {
      return NODES.textNode(DateTimeFormatter.ISO_INSTANT.format(value));
    }

    @Override
    public Instant decode(JsonNode node) {
      if (!node.isTextual()) throw mismatch("Timestamp", node);
      try {
        return Instant.parse(node.textValue());
      } catch (DateTimeParseException e) {
        throw new DecodingException("invalid timestamp " + node.textValue(), e);
      }
    }
  };

  private static DecodingException mismatch(String expected, JsonNode node) {
    return new DecodingException("expected " + expected + ", got " + node);
  }
}
